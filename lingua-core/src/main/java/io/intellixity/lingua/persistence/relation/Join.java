package io.intellixity.lingua.persistence.relation;

import io.intellixity.lingua.persistence.compile.JoinKind;
import io.intellixity.lingua.persistence.expr.Node;
import io.intellixity.lingua.persistence.expr.TableRef;

import java.util.Objects;

/** A join of {@code target} with the given kind and ON clause. */
public record Join(JoinKind kind, TableRef target, Node on) {
  public Join {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(on, "on");
  }
}
