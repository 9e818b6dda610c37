package io.intellixity.lingua.persistence.jdbc;

import java.util.List;
import java.util.Objects;

public record SqlStatement(String sql, List<Bind> binds) {
  public SqlStatement {
    Objects.requireNonNull(sql, "sql");
    binds = binds == null ? List.of() : List.copyOf(binds);
  }

  /** Bind values in placeholder order. */
  public List<Object> values() {
    return binds.stream().map(Bind::value).toList();
  }
}
