package io.intellixity.lingua.persistence.query;

import io.intellixity.lingua.persistence.expr.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/** Builds and inverts the predicates produced for {@code where}-style lookups. */
public final class Predicates {
  private Predicates() {}

  /**
   * Predicate matching any of {@code values} (a single value or a collection):
   * no non-null values gives {@code = NULL}, one gives {@code =}, several give {@code IN};
   * a null among several values adds {@code OR = NULL}.
   */
  public static Node matching(Column column, Object values) {
    List<Object> nonNull = new ArrayList<>();
    boolean hasNull = false;
    for (Object v : distinct(values)) {
      if (v == null) hasNull = true;
      else nonNull.add(v);
    }

    if (nonNull.isEmpty()) return column.eq(null);
    Node predicate = nonNull.size() == 1 ? column.eq(nonNull.get(0)) : column.in(nonNull);
    return hasNull ? predicate.or(column.eq(null)) : predicate;
  }

  /** {@code IN <-> NOT IN}, {@code = <-> !=}, {@code NOT x -> x}; anything else is wrapped in NOT. */
  public static Node invert(Node node) {
    if (node instanceof In in) return new NotIn(in.left(), in.right());
    if (node instanceof NotIn nin) return new In(nin.left(), nin.right());
    if (node instanceof Equality eq) return new NotEqual(eq.left(), eq.right());
    if (node instanceof NotEqual ne) return new Equality(ne.left(), ne.right());
    if (node instanceof Not not) return not.expr();
    return new Not(node);
  }

  private static Collection<Object> distinct(Object values) {
    LinkedHashSet<Object> out = new LinkedHashSet<>();
    if (values instanceof Collection<?> c) out.addAll(c);
    else if (values instanceof Object[] arr) out.addAll(Arrays.asList(arr));
    else out.add(values);
    return out;
  }
}
