package io.intellixity.lingua.persistence.compile;

import io.intellixity.lingua.persistence.backend.TranslationBackend;
import io.intellixity.lingua.persistence.expr.Equality;
import io.intellixity.lingua.persistence.expr.Node;
import io.intellixity.lingua.persistence.expr.Nodes;
import io.intellixity.lingua.persistence.expr.Or;
import io.intellixity.lingua.persistence.expr.TranslatedAttribute;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Join requirements for a key-value backend: every attribute is a separate row of one shared table,
 * so each attribute gets its own join kind.
 * <p>
 * Output is ordered by first occurrence; attributes of other backends are ignored.
 */
public final class KeyValueVisitor extends NodeVisitor<Map<String, JoinKind>> {
  private final TranslationBackend backend;

  public KeyValueVisitor(TranslationBackend backend) {
    this.backend = Objects.requireNonNull(backend, "backend");
    on(TranslatedAttribute.class, this::visitAttribute);
    on(Equality.class, this::visitEquality);
    on(Or.class, this::visitOr);
  }

  /** Attribute name to required join kind; empty when the predicate needs no translation join. */
  public Map<String, JoinKind> accept(Node predicate) {
    if (predicate == null) return Map.of();
    return Collections.unmodifiableMap(visit(predicate));
  }

  @Override
  protected Map<String, JoinKind> empty() {
    return new LinkedHashMap<>();
  }

  @Override
  protected Map<String, JoinKind> visitCollection(List<? extends Node> nodes) {
    Map<String, JoinKind> out = new LinkedHashMap<>();
    for (Node n : nodes) {
      visit(n).forEach((attr, kind) -> out.merge(attr, kind, JoinKind::merge));
    }
    return out;
  }

  private Map<String, JoinKind> visitAttribute(TranslatedAttribute attribute) {
    Map<String, JoinKind> out = new LinkedHashMap<>();
    if (attribute.backend() == backend) out.put(attribute.attributeName(), JoinKind.INNER);
    return out;
  }

  private Map<String, JoinKind> visitEquality(Equality equality) {
    List<Node> operands = new ArrayList<>(2);
    boolean comparesNull = false;
    for (Node side : List.of(equality.left(), equality.right())) {
      if (Nodes.isNullLiteral(side)) comparesNull = true;
      else operands.add(side);
    }
    Map<String, JoinKind> out = visitCollection(operands);
    if (comparesNull) out.replaceAll((attr, kind) -> JoinKind.OUTER);
    return out;
  }

  // Either branch may hold for a record without the translation row, so every key under OR is OUTER.
  private Map<String, JoinKind> visitOr(Or or) {
    Map<String, JoinKind> out = visitCollection(List.of(or.left(), or.right()));
    out.replaceAll((attr, kind) -> JoinKind.OUTER);
    return out;
  }
}
