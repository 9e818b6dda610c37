package io.intellixity.lingua.persistence.backend;

import java.util.Collection;

/** Contributes key-value translation types; listed in {@code META-INF/lingua.factories}. */
public interface TranslationTypeProvider {
  Collection<TranslationType> translationTypes();
}
