package io.intellixity.lingua.persistence.expr;

/** {@code left = right}; a {@link Literal#NULL} operand means {@code IS NULL}. */
public final class Equality extends Binary {
  public Equality(Node left, Node right) {
    super(left, right);
  }

  @Override
  public String toString() { return left() + " = " + right(); }
}
