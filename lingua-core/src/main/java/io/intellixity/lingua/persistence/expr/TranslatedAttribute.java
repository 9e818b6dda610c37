package io.intellixity.lingua.persistence.expr;

import io.intellixity.lingua.persistence.backend.TranslationBackend;

import java.util.Objects;

/**
 * Column backed by a translation store.
 * <p>
 * {@link #backend()} is the backend that declared the attribute; visitors compare it by identity to decide
 * whether the reference is theirs. {@link #attributeName()} is the logical attribute (which may differ from
 * the physical column, e.g. {@code value} in a key-value table).
 */
public final class TranslatedAttribute extends Column {
  private final TranslationBackend backend;
  private final String attributeName;

  public TranslatedAttribute(TableRef table, String column, TranslationBackend backend, String attributeName) {
    super(table, column);
    this.backend = Objects.requireNonNull(backend, "backend");
    this.attributeName = Objects.requireNonNull(attributeName, "attributeName");
  }

  public TranslationBackend backend() { return backend; }
  public String attributeName() { return attributeName; }

  @Override
  public boolean equals(Object o) {
    if (!super.equals(o)) return false;
    TranslatedAttribute other = (TranslatedAttribute) o;
    return backend == other.backend && attributeName.equals(other.attributeName);
  }

  @Override
  public int hashCode() { return Objects.hash(super.hashCode(), System.identityHashCode(backend), attributeName); }
}
