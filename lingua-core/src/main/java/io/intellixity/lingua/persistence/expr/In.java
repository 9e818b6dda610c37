package io.intellixity.lingua.persistence.expr;

public final class In extends Binary {
  public In(Node left, Node right) {
    super(left, right);
  }

  @Override
  public String toString() { return left() + " IN " + right(); }
}
