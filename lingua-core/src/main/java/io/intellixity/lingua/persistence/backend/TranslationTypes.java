package io.intellixity.lingua.persistence.backend;

import io.intellixity.lingua.persistence.util.LinguaFactoriesLoader;

import java.util.*;

/**
 * Registry of key-value translation types.
 * <p>
 * The first provider registering a type id wins, so application providers listed before the built-in one
 * can re-map {@code string}/{@code text} to their own tables.
 */
public final class TranslationTypes {
  private final Map<String, TranslationType> types;

  public TranslationTypes(Collection<? extends TranslationTypeProvider> providers) {
    Map<String, TranslationType> out = new LinkedHashMap<>();
    for (TranslationTypeProvider p : providers) {
      if (p == null) continue;
      Collection<TranslationType> contributed = p.translationTypes();
      if (contributed == null) continue;
      for (TranslationType t : contributed) {
        if (t != null) out.putIfAbsent(t.id(), t);
      }
    }
    this.types = Collections.unmodifiableMap(out);
  }

  /** Types registered through {@code META-INF/lingua.factories}. */
  public static TranslationTypes discover() {
    return new TranslationTypes(LinguaFactoriesLoader.load(TranslationTypeProvider.class));
  }

  /** Registered type, or null. */
  public TranslationType get(String id) {
    return id == null ? null : types.get(id);
  }

  public Set<String> ids() {
    return types.keySet();
  }
}
