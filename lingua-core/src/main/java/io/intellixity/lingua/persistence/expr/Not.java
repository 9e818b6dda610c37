package io.intellixity.lingua.persistence.expr;

/** Unary NOT over any predicate subtree. */
public final class Not extends Unary {
  public Not(Node expr) {
    super(expr);
  }

  @Override
  public String toString() { return "NOT (" + expr() + ")"; }
}
