package io.intellixity.lingua.persistence.jdbc.dialect;

import io.intellixity.lingua.persistence.jdbc.SqlStatement;
import io.intellixity.lingua.persistence.relation.Relation;

/** Renders relations (base table, translation joins, filters) to SQL for JDBC engines. */
public interface JdbcDialect {
  String id();

  SqlStatement renderSelect(Relation relation);

  SqlStatement renderCount(Relation relation);
}
