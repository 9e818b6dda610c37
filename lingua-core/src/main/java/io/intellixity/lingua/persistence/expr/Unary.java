package io.intellixity.lingua.persistence.expr;

import java.util.Objects;

/** Node wrapping a single operand. */
public abstract class Unary extends Node {
  private final Node expr;

  protected Unary(Node expr) {
    this.expr = Objects.requireNonNull(expr, "expr");
  }

  public Node expr() { return expr; }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || o.getClass() != getClass()) return false;
    return expr.equals(((Unary) o).expr);
  }

  @Override
  public int hashCode() { return Objects.hash(getClass(), expr); }
}
