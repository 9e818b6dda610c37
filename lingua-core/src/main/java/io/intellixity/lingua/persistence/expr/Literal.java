package io.intellixity.lingua.persistence.expr;

import java.util.Objects;

/** A quoted value; a literal whose value is {@code null} is SQL NULL. */
public final class Literal extends Leaf {
  public static final Literal NULL = new Literal(null);

  private final Object value;

  private Literal(Object value) {
    this.value = value;
  }

  public static Literal of(Object value) {
    return value == null ? NULL : new Literal(value);
  }

  public Object value() { return value; }

  public boolean isNull() { return value == null; }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Literal other)) return false;
    return Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() { return Objects.hashCode(value); }

  @Override
  public String toString() { return isNull() ? "NULL" : "'" + value + "'"; }
}
