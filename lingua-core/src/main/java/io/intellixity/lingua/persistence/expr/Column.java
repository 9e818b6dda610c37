package io.intellixity.lingua.persistence.expr;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/** A column of a table reference. Carries the predications used to build filters. */
public class Column extends Leaf {
  private final TableRef table;
  private final String name;

  public Column(TableRef table, String name) {
    this.table = Objects.requireNonNull(table, "table");
    this.name = Objects.requireNonNull(name, "name");
  }

  public TableRef table() { return table; }
  public String name() { return name; }

  public Equality eq(Object value) { return new Equality(this, Nodes.quoted(value)); }

  public NotEqual notEq(Object value) { return new NotEqual(this, Nodes.quoted(value)); }

  public In in(Collection<?> values) { return new In(this, quotedList(values)); }

  public NotIn notIn(Collection<?> values) { return new NotIn(this, quotedList(values)); }

  public Matches matches(String pattern) { return new Matches(this, Literal.of(pattern), true); }

  public Matches matches(String pattern, boolean caseSensitive) {
    return new Matches(this, Literal.of(pattern), caseSensitive);
  }

  private static NodeList quotedList(Collection<?> values) {
    List<Node> out = new ArrayList<>();
    if (values != null) {
      for (Object v : values) out.add(Nodes.quoted(v));
    }
    return new NodeList(out);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || o.getClass() != getClass()) return false;
    Column other = (Column) o;
    return table.equals(other.table) && name.equals(other.name);
  }

  @Override
  public int hashCode() { return Objects.hash(table, name); }

  @Override
  public String toString() { return table.reference() + "." + name; }
}
