package io.intellixity.lingua.persistence.backend;

import io.intellixity.lingua.persistence.expr.Node;
import io.intellixity.lingua.persistence.expr.TranslatedAttribute;
import io.intellixity.lingua.persistence.relation.Relation;

/**
 * Storage strategy for a group of translated attributes of one model.
 * <p>
 * Backends are compared by identity: a {@link TranslatedAttribute} belongs to the backend instance that built it.
 */
public interface TranslationBackend {
  /** Short name for logs and error messages. */
  String name();

  ModelDef model();

  /** Column reference a predicate on {@code attribute} in {@code locale} is written against. */
  TranslatedAttribute buildNode(String attribute, String locale);

  /**
   * Adds the translation joins {@code predicate} requires to {@code relation}. The predicate itself is
   * not attached; callers add it (inverted when {@code invert} is set) with {@link Relation#where}.
   */
  Relation addTranslations(Relation relation, Node predicate, String locale, boolean invert);

  default Relation addTranslations(Relation relation, Node predicate, String locale) {
    return addTranslations(relation, predicate, locale, false);
  }
}
