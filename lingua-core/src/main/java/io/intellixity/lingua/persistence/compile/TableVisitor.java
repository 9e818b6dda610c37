package io.intellixity.lingua.persistence.compile;

import io.intellixity.lingua.persistence.backend.TranslationBackend;
import io.intellixity.lingua.persistence.expr.Equality;
import io.intellixity.lingua.persistence.expr.Node;
import io.intellixity.lingua.persistence.expr.Nodes;
import io.intellixity.lingua.persistence.expr.Or;
import io.intellixity.lingua.persistence.expr.TranslatedAttribute;

import java.util.List;
import java.util.Objects;

/**
 * Join requirement for a table backend: all attributes of the backend live in one translation row,
 * so the whole predicate needs at most one join.
 * <p>
 * Results are {@code null} when no join is required.
 */
public final class TableVisitor extends NodeVisitor<JoinKind> {
  private final TranslationBackend backend;

  public TableVisitor(TranslationBackend backend) {
    this.backend = Objects.requireNonNull(backend, "backend");
    on(TranslatedAttribute.class, this::visitAttribute);
    on(Equality.class, this::visitEquality);
    on(Or.class, this::visitOr);
  }

  /** Required join kind, or {@code null} when the predicate does not touch this backend. */
  public JoinKind accept(Node predicate) {
    return predicate == null ? null : visit(predicate);
  }

  @Override
  protected JoinKind empty() {
    return null;
  }

  /** INNER as soon as any child demands it, otherwise the first requirement found. */
  @Override
  protected JoinKind visitCollection(List<? extends Node> nodes) {
    JoinKind first = null;
    for (Node n : nodes) {
      JoinKind k = visit(n);
      if (k == JoinKind.INNER) return k;
      if (first == null) first = k;
    }
    return first;
  }

  private JoinKind visitAttribute(TranslatedAttribute attribute) {
    return attribute.backend() == backend ? JoinKind.OUTER : null;
  }

  private JoinKind visitEquality(Equality equality) {
    Node left = equality.left();
    Node right = equality.right();
    if (visit(left) == null && visit(right) == null) return null;
    return (Nodes.isNullLiteral(left) || Nodes.isNullLiteral(right)) ? JoinKind.OUTER : JoinKind.INNER;
  }

  private JoinKind visitOr(Or or) {
    JoinKind left = visit(or.left());
    JoinKind right = visit(or.right());
    return (left == null && right == null) ? null : JoinKind.OUTER;
  }
}
