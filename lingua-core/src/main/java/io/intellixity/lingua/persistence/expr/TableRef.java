package io.intellixity.lingua.persistence.expr;

import java.util.Objects;

/** A table, optionally aliased. Join identity is {@link #reference()}. */
public record TableRef(String name, String alias) {
  public TableRef {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) throw new IllegalArgumentException("table name must not be blank");
    if (alias != null && alias.isBlank()) alias = null;
  }

  public static TableRef of(String name) {
    return new TableRef(name, null);
  }

  public TableRef alias(String alias) {
    return new TableRef(name, alias);
  }

  /** Name used to qualify columns: the alias when present, else the table name. */
  public String reference() {
    return alias != null ? alias : name;
  }

  public Column column(String column) {
    return new Column(this, column);
  }
}
