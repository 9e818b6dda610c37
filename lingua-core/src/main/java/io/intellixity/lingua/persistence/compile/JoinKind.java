package io.intellixity.lingua.persistence.compile;

import java.util.Objects;

/**
 * Join requirement for a translation target.
 * <p>
 * {@link #INNER} demands the translation row exists; {@link #OUTER} tolerates its absence (NULL comparisons,
 * disjunctions). {@code INNER} is the seed: merging only stays {@code INNER} while every occurrence agrees.
 */
public enum JoinKind {
  INNER,
  OUTER;

  /** INNER iff both are INNER; commutative, associative and idempotent. */
  public JoinKind merge(JoinKind other) {
    Objects.requireNonNull(other, "other");
    return (this == INNER && other == INNER) ? INNER : OUTER;
  }
}
