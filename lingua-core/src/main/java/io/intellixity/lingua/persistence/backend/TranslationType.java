package io.intellixity.lingua.persistence.backend;

import java.util.Objects;

/** A key-value translation type (e.g. {@code string}, {@code text}) and the shared table storing it. */
public record TranslationType(String id, String table) {
  public TranslationType {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(table, "table");
  }
}
