package io.intellixity.lingua.persistence.expr;

import java.util.List;

/**
 * Base of the predicate AST handed in by the host query builder.
 * <p>
 * Nodes are immutable. Visitors dispatch on the concrete node class (falling back to the nearest
 * registered superclass), so hosts may add their own subclasses of {@link Leaf}, {@link Unary} or {@link Binary}.
 */
public abstract class Node {
  protected Node() {}

  public Or or(Node other) { return new Or(this, other); }

  public And and(Node other) { return new And(List.of(this, other)); }

  public Not not() { return new Not(this); }
}
