package io.intellixity.lingua.persistence.jdbc.postgres;

import io.intellixity.lingua.persistence.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.lingua.persistence.jdbc.dialect.JdbcDialect;

/**
 * Postgres dialect implementation for JDBC.
 *
 * Keeps only Postgres-specific overrides; generic SQL rendering lives in {@link AbstractJdbcSqlDialect}.
 */
public final class PostgresDialect extends AbstractJdbcSqlDialect implements JdbcDialect {
  @Override public String id() { return "postgres"; }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  protected String renderCaseInsensitiveMatch(String left, String right) {
    return left + " ILIKE " + right;
  }
}
