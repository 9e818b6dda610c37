package io.intellixity.lingua.persistence.expr;

/** {@code left != right}; a {@link Literal#NULL} operand means {@code IS NOT NULL}. */
public final class NotEqual extends Binary {
  public NotEqual(Node left, Node right) {
    super(left, right);
  }

  @Override
  public String toString() { return left() + " != " + right(); }
}
