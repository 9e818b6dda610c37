package io.intellixity.lingua.persistence.backend;

/**
 * Configuration of a {@link KeyValueBackend}. Unset values are defaulted by
 * {@link KeyValueBackend#configure(ModelDef, KeyValueOptions, TranslationTypes)}.
 */
public final class KeyValueOptions {
  private String type;
  private String associationName;
  private String translationsTable;
  private String keyColumn = "key";
  private String valueColumn = "value";
  private String localeColumn = "locale";
  private String ownerTypeColumn = "translatable_type";
  private String ownerIdColumn = "translatable_id";

  public static KeyValueOptions ofType(String type) {
    return new KeyValueOptions().withType(type);
  }

  public String type() { return type; }
  public String associationName() { return associationName; }
  public String translationsTable() { return translationsTable; }
  public String keyColumn() { return keyColumn; }
  public String valueColumn() { return valueColumn; }
  public String localeColumn() { return localeColumn; }
  public String ownerTypeColumn() { return ownerTypeColumn; }
  public String ownerIdColumn() { return ownerIdColumn; }

  public KeyValueOptions withType(String type) { this.type = type; return this; }
  public KeyValueOptions withAssociationName(String associationName) { this.associationName = associationName; return this; }
  public KeyValueOptions withTranslationsTable(String translationsTable) { this.translationsTable = translationsTable; return this; }
  public KeyValueOptions withKeyColumn(String keyColumn) { this.keyColumn = keyColumn; return this; }
  public KeyValueOptions withValueColumn(String valueColumn) { this.valueColumn = valueColumn; return this; }
  public KeyValueOptions withLocaleColumn(String localeColumn) { this.localeColumn = localeColumn; return this; }
  public KeyValueOptions withOwnerTypeColumn(String ownerTypeColumn) { this.ownerTypeColumn = ownerTypeColumn; return this; }
  public KeyValueOptions withOwnerIdColumn(String ownerIdColumn) { this.ownerIdColumn = ownerIdColumn; return this; }
}
