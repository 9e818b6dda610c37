package io.intellixity.lingua.persistence.relation;

import io.intellixity.lingua.persistence.expr.And;
import io.intellixity.lingua.persistence.expr.Node;
import io.intellixity.lingua.persistence.expr.TableRef;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable query under construction: a base table, its joins and its filters.
 * <p>
 * Every operation returns a new relation. Filters are AND-composed; joins are identified by
 * {@link TableRef#reference()} of their target.
 */
public record Relation(TableRef table, List<Join> joins, List<Node> wheres) {
  public Relation {
    Objects.requireNonNull(table, "table");
    joins = List.copyOf(joins == null ? List.of() : joins);
    wheres = List.copyOf(wheres == null ? List.of() : wheres);
  }

  public static Relation from(TableRef table) {
    return new Relation(table, List.of(), List.of());
  }

  /** Join whose target reference (alias or table name) is {@code reference}, or null. */
  public Join join(String reference) {
    if (reference == null) return null;
    for (Join j : joins) {
      if (reference.equals(j.target().reference())) return j;
    }
    return null;
  }

  public boolean hasJoin(String reference) {
    return join(reference) != null;
  }

  public Relation withJoin(Join join) {
    Objects.requireNonNull(join, "join");
    List<Join> out = new ArrayList<>(joins);
    out.add(join);
    return new Relation(table, out, wheres);
  }

  public Relation withoutJoin(Join join) {
    List<Join> out = new ArrayList<>(joins);
    if (!out.remove(join)) return this;
    return new Relation(table, out, wheres);
  }

  public Relation where(Node predicate) {
    if (predicate == null) return this;
    List<Node> out = new ArrayList<>(wheres);
    out.add(predicate);
    return new Relation(table, joins, out);
  }

  /** All filters as one predicate; null when there are none. */
  public Node predicate() {
    if (wheres.isEmpty()) return null;
    if (wheres.size() == 1) return wheres.get(0);
    return new And(wheres);
  }
}
