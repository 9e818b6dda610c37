package io.intellixity.lingua.persistence.expr;

import java.util.List;
import java.util.Objects;

/** Named SQL function call, e.g. {@code LOWER(title)}. */
public final class Function extends Node {
  private final String name;
  private final List<Node> expressions;

  public Function(String name, List<? extends Node> expressions) {
    this.name = Objects.requireNonNull(name, "name");
    this.expressions = List.copyOf(Objects.requireNonNull(expressions, "expressions"));
  }

  public static Function lower(Node expr) {
    return new Function("LOWER", List.of(expr));
  }

  public String name() { return name; }
  public List<Node> expressions() { return expressions; }

  public Equality eq(Object value) { return new Equality(this, Nodes.quoted(value)); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Function other)) return false;
    return name.equals(other.name) && expressions.equals(other.expressions);
  }

  @Override
  public int hashCode() { return Objects.hash(name, expressions); }

  @Override
  public String toString() { return name + expressions; }
}
