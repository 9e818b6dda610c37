package io.intellixity.lingua.persistence.backend;

/**
 * Configuration of a {@link TableBackend}. Unset values are defaulted from the model table by
 * {@link TableBackend#configure(ModelDef, TableOptions)}.
 */
public final class TableOptions {
  private String tableName;
  private String foreignKey;
  private String associationName;
  private String localeColumn = "locale";

  public String tableName() { return tableName; }
  public String foreignKey() { return foreignKey; }
  public String associationName() { return associationName; }
  public String localeColumn() { return localeColumn; }

  public TableOptions withTableName(String tableName) { this.tableName = tableName; return this; }
  public TableOptions withForeignKey(String foreignKey) { this.foreignKey = foreignKey; return this; }
  public TableOptions withAssociationName(String associationName) { this.associationName = associationName; return this; }
  public TableOptions withLocaleColumn(String localeColumn) { this.localeColumn = localeColumn; return this; }
}
