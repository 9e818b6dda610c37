package io.intellixity.lingua.persistence.expr;

import java.util.List;
import java.util.Objects;

/**
 * Ordered collection of nodes: the right-hand side of {@code IN}, or a batch of predicates handed
 * to a backend at once.
 */
public final class NodeList extends Node {
  private final List<Node> children;

  public NodeList(List<? extends Node> children) {
    this.children = List.copyOf(Objects.requireNonNull(children, "children"));
  }

  public List<Node> children() { return children; }

  public boolean isEmpty() { return children.isEmpty(); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof NodeList other)) return false;
    return children.equals(other.children);
  }

  @Override
  public int hashCode() { return Objects.hash(NodeList.class, children); }

  @Override
  public String toString() { return children.toString(); }
}
