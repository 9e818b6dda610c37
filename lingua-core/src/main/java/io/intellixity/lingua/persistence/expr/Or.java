package io.intellixity.lingua.persistence.expr;

public final class Or extends Binary {
  public Or(Node left, Node right) {
    super(left, right);
  }

  @Override
  public String toString() { return "(" + left() + " OR " + right() + ")"; }
}
