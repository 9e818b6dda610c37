package io.intellixity.lingua.persistence.expr;

public final class NotIn extends Binary {
  public NotIn(Node left, Node right) {
    super(left, right);
  }

  @Override
  public String toString() { return left() + " NOT IN " + right(); }
}
