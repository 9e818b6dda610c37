package io.intellixity.lingua.persistence.backend;

import java.util.Collection;
import java.util.List;

/** Built-in {@code string} and {@code text} translation tables. */
public final class DefaultTranslationTypeProvider implements TranslationTypeProvider {
  @Override
  public Collection<TranslationType> translationTypes() {
    return List.of(
        new TranslationType("string", "string_translations"),
        new TranslationType("text", "text_translations")
    );
  }
}
