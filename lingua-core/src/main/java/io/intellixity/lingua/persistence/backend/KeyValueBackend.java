package io.intellixity.lingua.persistence.backend;

import io.intellixity.lingua.persistence.compile.JoinKind;
import io.intellixity.lingua.persistence.compile.KeyValueVisitor;
import io.intellixity.lingua.persistence.expr.Node;
import io.intellixity.lingua.persistence.expr.Nodes;
import io.intellixity.lingua.persistence.expr.TableRef;
import io.intellixity.lingua.persistence.expr.TranslatedAttribute;
import io.intellixity.lingua.persistence.relation.Join;
import io.intellixity.lingua.persistence.relation.Relation;

import java.util.Map;
import java.util.Objects;

/**
 * Translations stored as rows of one shared table keyed by {@code (key, locale, owner type, owner id)}.
 * <p>
 * Each queried attribute joins the shared table under its own alias {@code <attribute>_<associationName>},
 * so every attribute gets an independent join kind.
 */
public final class KeyValueBackend extends AbstractTranslationBackend {
  private final String associationName;
  private final TableRef translations;
  private final KeyValueOptions options;
  private final KeyValueVisitor visitor;

  private KeyValueBackend(ModelDef model, String associationName, String translationsTable, KeyValueOptions options) {
    super(model);
    this.associationName = associationName;
    this.translations = TableRef.of(translationsTable);
    this.options = options;
    this.visitor = new KeyValueVisitor(this);
  }

  /**
   * Resolves defaults and validates {@code options}.
   *
   * @throws IllegalArgumentException when the options name a type without a registered translation table,
   *                                  or give neither a type nor a table
   */
  public static KeyValueBackend configure(ModelDef model, KeyValueOptions options, TranslationTypes types) {
    Objects.requireNonNull(model, "model");
    Objects.requireNonNull(options, "options");
    Objects.requireNonNull(types, "types");

    String type = options.type();
    String table = options.translationsTable();
    String association = options.associationName();

    if (type != null && !type.isBlank()) {
      if (association == null || association.isBlank()) association = type + "_translations";
      if (table == null || table.isBlank()) {
        TranslationType registered = types.get(type);
        if (registered == null) {
          throw new IllegalArgumentException("No translation table registered for key-value type '" + type
              + "' (known types: " + types.ids() + "); register one through a "
              + TranslationTypeProvider.class.getSimpleName() + " in META-INF/lingua.factories");
        }
        table = registered.table();
      }
    }
    if (table == null || table.isBlank()) {
      throw new IllegalArgumentException("Key-value backend for model '" + model.type()
          + "' requires a type or a translationsTable");
    }
    if (association == null || association.isBlank()) association = "translations";
    return new KeyValueBackend(model, association, table, options);
  }

  public String associationName() { return associationName; }

  public TableRef translationsTable() { return translations; }

  /** Target the attribute's translation rows are joined as. */
  public TableRef aliasFor(String attribute) {
    return translations.alias(attribute + "_" + associationName);
  }

  @Override
  public String name() { return "key_value:" + associationName; }

  @Override
  public TranslatedAttribute buildNode(String attribute, String locale) {
    Objects.requireNonNull(attribute, "attribute");
    return new TranslatedAttribute(aliasFor(attribute), options.valueColumn(), this, attribute);
  }

  @Override
  public Relation addTranslations(Relation relation, Node predicate, String locale, boolean invert) {
    Objects.requireNonNull(relation, "relation");
    requireLocale(locale);
    Map<String, JoinKind> required = visitor.accept(predicate);
    Relation out = relation;
    for (Map.Entry<String, JoinKind> e : required.entrySet()) {
      JoinKind kind = invert ? JoinKind.INNER : e.getValue();
      out = joinTranslations(out, new Join(kind, aliasFor(e.getKey()), onClause(e.getKey(), locale)));
    }
    return out;
  }

  private Node onClause(String attribute, String locale) {
    TableRef t = aliasFor(attribute);
    TableRef m = model.table();
    return Nodes.and(
        t.column(options.keyColumn()).eq(attribute),
        t.column(options.localeColumn()).eq(locale),
        t.column(options.ownerTypeColumn()).eq(model.baseType()),
        t.column(options.ownerIdColumn()).eq(m.column(model.primaryKey()))
    );
  }
}
