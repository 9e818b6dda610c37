package io.intellixity.lingua.persistence.expr;

import java.util.List;

/** Static factories for predicate trees. */
public final class Nodes {
  private Nodes() {}

  /** Wraps a raw value as a {@link Literal}; nodes pass through unchanged. */
  public static Node quoted(Object value) {
    if (value instanceof Node n) return n;
    return Literal.of(value);
  }

  public static boolean isNullLiteral(Node node) {
    return node instanceof Literal l && l.isNull();
  }

  public static And and(Node... children) { return new And(List.of(children)); }

  public static And and(List<? extends Node> children) { return new And(children); }

  public static Or or(Node left, Node right) { return new Or(left, right); }

  public static Not not(Node expr) { return new Not(expr); }

  public static NodeList list(Node... children) { return new NodeList(List.of(children)); }

  public static NodeList list(List<? extends Node> children) { return new NodeList(children); }
}
