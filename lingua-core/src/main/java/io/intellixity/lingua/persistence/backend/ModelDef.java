package io.intellixity.lingua.persistence.backend;

import io.intellixity.lingua.persistence.expr.TableRef;

import java.util.Objects;

/**
 * The translated model as seen by backends.
 *
 * @param type       model type name
 * @param baseType   owner type stored on polymorphic translation rows (the root of an inheritance hierarchy)
 * @param table      model table
 * @param primaryKey primary key column of {@code table}
 */
public record ModelDef(String type, String baseType, TableRef table, String primaryKey) {
  public ModelDef {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(table, "table");
    if (baseType == null || baseType.isBlank()) baseType = type;
    if (primaryKey == null || primaryKey.isBlank()) primaryKey = "id";
  }

  public static ModelDef of(String type, String tableName) {
    return new ModelDef(type, type, TableRef.of(tableName), "id");
  }
}
