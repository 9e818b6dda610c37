package io.intellixity.lingua.persistence.backend;

import io.intellixity.lingua.persistence.compile.JoinKind;
import io.intellixity.lingua.persistence.relation.Join;
import io.intellixity.lingua.persistence.relation.Relation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/** Join de-duplication shared by the backends. */
public abstract class AbstractTranslationBackend implements TranslationBackend {
  private static final Logger log = LoggerFactory.getLogger(AbstractTranslationBackend.class);

  protected final ModelDef model;

  protected AbstractTranslationBackend(ModelDef model) {
    this.model = Objects.requireNonNull(model, "model");
  }

  @Override
  public final ModelDef model() { return model; }

  /**
   * Adds {@code required} unless {@code relation} already joins the same target at least as strongly.
   * An existing OUTER join is replaced when INNER is required; an existing INNER join satisfies both kinds.
   *
   * @throws IllegalArgumentException when the target is already joined with a different ON clause
   *                                  (typically another locale)
   */
  protected final Relation joinTranslations(Relation relation, Join required) {
    String target = required.target().reference();
    Join existing = relation.join(target);
    if (existing != null) {
      if (!existing.on().equals(required.on())) {
        throw new IllegalArgumentException("Relation already joins '" + target + "' on " + existing.on()
            + "; cannot join it again on " + required.on() + " (translations of one attribute are queried in a"
            + " single locale per relation)");
      }
      if (existing.kind() == JoinKind.INNER || required.kind() == JoinKind.OUTER) {
        debugJoin(target, existing.kind(), "kept");
        return relation;
      }
      debugJoin(target, required.kind(), "replaced");
      return relation.withoutJoin(existing).withJoin(required);
    }
    debugJoin(target, required.kind(), "added");
    return relation.withJoin(required);
  }

  protected static String requireLocale(String locale) {
    if (locale == null || locale.isBlank()) {
      throw new IllegalArgumentException("locale must not be blank");
    }
    return locale;
  }

  private void debugJoin(String target, JoinKind kind, String action) {
    if (!log.isDebugEnabled()) return;
    log.debug("lingua.join backend={} model={} target={} kind={} action={}",
        name(), model.type(), target, kind, action);
  }
}
