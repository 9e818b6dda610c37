package io.intellixity.lingua.persistence.backend;

import io.intellixity.lingua.persistence.compile.JoinKind;
import io.intellixity.lingua.persistence.compile.TableVisitor;
import io.intellixity.lingua.persistence.expr.Node;
import io.intellixity.lingua.persistence.expr.Nodes;
import io.intellixity.lingua.persistence.expr.TableRef;
import io.intellixity.lingua.persistence.expr.TranslatedAttribute;
import io.intellixity.lingua.persistence.relation.Join;
import io.intellixity.lingua.persistence.relation.Relation;
import io.intellixity.lingua.persistence.util.Inflections;

import java.util.Objects;

/**
 * Translations stored in a dedicated table with one row per (record, locale) and one column per attribute.
 * A predicate needs at most one join of that table.
 */
public final class TableBackend extends AbstractTranslationBackend {
  private final TableRef translations;
  private final String foreignKey;
  private final String associationName;
  private final String localeColumn;
  private final TableVisitor visitor;

  private TableBackend(ModelDef model, String tableName, String foreignKey, String associationName, String localeColumn) {
    super(model);
    this.translations = TableRef.of(tableName);
    this.foreignKey = foreignKey;
    this.associationName = associationName;
    this.localeColumn = localeColumn;
    this.visitor = new TableVisitor(this);
  }

  /** Defaults: {@code <singular table>_translations}, {@code <singular table>_id}, association {@code translations}. */
  public static TableBackend configure(ModelDef model, TableOptions options) {
    Objects.requireNonNull(model, "model");
    Objects.requireNonNull(options, "options");
    String singular = Inflections.singularize(model.table().name());
    String table = blankToNull(options.tableName());
    String fk = blankToNull(options.foreignKey());
    String association = blankToNull(options.associationName());
    String locale = blankToNull(options.localeColumn());
    return new TableBackend(model,
        table != null ? table : singular + "_translations",
        fk != null ? fk : singular + "_id",
        association != null ? association : "translations",
        locale != null ? locale : "locale");
  }

  public TableRef translationsTable() { return translations; }
  public String foreignKey() { return foreignKey; }
  public String associationName() { return associationName; }

  @Override
  public String name() { return "table:" + translations.name(); }

  @Override
  public TranslatedAttribute buildNode(String attribute, String locale) {
    Objects.requireNonNull(attribute, "attribute");
    return new TranslatedAttribute(translations, attribute, this, attribute);
  }

  @Override
  public Relation addTranslations(Relation relation, Node predicate, String locale, boolean invert) {
    Objects.requireNonNull(relation, "relation");
    requireLocale(locale);
    JoinKind kind = visitor.accept(predicate);
    if (kind == null) return relation;
    if (invert) kind = JoinKind.INNER;
    Node on = Nodes.and(
        translations.column(foreignKey).eq(model.table().column(model.primaryKey())),
        translations.column(localeColumn).eq(locale)
    );
    return joinTranslations(relation, new Join(kind, translations, on));
  }

  private static String blankToNull(String s) {
    return (s == null || s.isBlank()) ? null : s;
  }
}
