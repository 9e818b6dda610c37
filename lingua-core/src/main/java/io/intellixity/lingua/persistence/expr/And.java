package io.intellixity.lingua.persistence.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/** Conjunction of any number of predicates. */
public final class And extends Node {
  private final List<Node> children;

  public And(List<? extends Node> children) {
    this.children = List.copyOf(Objects.requireNonNull(children, "children"));
  }

  public List<Node> children() { return children; }

  @Override
  public And and(Node other) {
    List<Node> out = new ArrayList<>(children);
    out.add(other);
    return new And(out);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof And other)) return false;
    return children.equals(other.children);
  }

  @Override
  public int hashCode() { return Objects.hash(And.class, children); }

  @Override
  public String toString() {
    return children.stream().map(String::valueOf).collect(Collectors.joining(" AND ", "(", ")"));
  }
}
