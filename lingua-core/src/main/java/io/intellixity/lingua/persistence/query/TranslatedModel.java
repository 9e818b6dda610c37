package io.intellixity.lingua.persistence.query;

import io.intellixity.lingua.persistence.backend.ModelDef;
import io.intellixity.lingua.persistence.backend.TranslationBackend;
import io.intellixity.lingua.persistence.expr.TranslatedAttribute;

import java.util.*;

/**
 * A model and its translated attribute declarations.
 * <p>
 * Each attribute belongs to exactly one backend; backends keep declaration order.
 */
public final class TranslatedModel {
  private final ModelDef model;
  private final Map<String, TranslationBackend> attributes = new LinkedHashMap<>();

  public TranslatedModel(ModelDef model) {
    this.model = Objects.requireNonNull(model, "model");
  }

  public ModelDef model() { return model; }

  /** Declares {@code names} as translated by {@code backend}. */
  public TranslatedModel translates(TranslationBackend backend, String... names) {
    Objects.requireNonNull(backend, "backend");
    if (!backend.model().equals(model)) {
      throw new IllegalArgumentException("Backend " + backend.name() + " is configured for model '"
          + backend.model().type() + "', not '" + model.type() + "'");
    }
    for (String name : names) {
      if (name == null || name.isBlank()) throw new IllegalArgumentException("attribute name must not be blank");
      TranslationBackend prev = attributes.putIfAbsent(name, backend);
      if (prev != null) {
        throw new IllegalArgumentException("Attribute '" + name + "' of model '" + model.type()
            + "' is already translated by " + prev.name());
      }
    }
    return this;
  }

  public boolean isTranslated(String name) {
    return attributes.containsKey(name);
  }

  /** Backend translating {@code name}, or null. */
  public TranslationBackend backendFor(String name) {
    return attributes.get(name);
  }

  /** Distinct backends in declaration order. */
  public List<TranslationBackend> backends() {
    List<TranslationBackend> out = new ArrayList<>();
    for (TranslationBackend b : attributes.values()) {
      if (out.stream().noneMatch(x -> x == b)) out.add(b);
    }
    return out;
  }

  /** Attribute names declared for {@code backend}, in declaration order. */
  public List<String> attributesOf(TranslationBackend backend) {
    List<String> out = new ArrayList<>();
    attributes.forEach((name, b) -> {
      if (b == backend) out.add(name);
    });
    return out;
  }

  /**
   * Node for a translated attribute.
   *
   * @throws QueryValidationException when {@code name} is not translated
   */
  public TranslatedAttribute attribute(String name, String locale) {
    TranslationBackend backend = attributes.get(name);
    if (backend == null) {
      throw new QueryValidationException("Attribute '" + name + "' is not translated on model '" + model.type() + "'");
    }
    return backend.buildNode(name, locale);
  }
}
