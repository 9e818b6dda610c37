package io.intellixity.lingua.persistence.query;

import io.intellixity.lingua.persistence.backend.TranslationBackend;
import io.intellixity.lingua.persistence.expr.Node;
import io.intellixity.lingua.persistence.expr.Nodes;
import io.intellixity.lingua.persistence.expr.TranslatedAttribute;
import io.intellixity.lingua.persistence.relation.Relation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Function;

/**
 * Query entry points for a {@link TranslatedModel}.
 * <p>
 * Translated attributes can be used like ordinary columns: each backend adds the translation joins the
 * predicate needs, then the predicate is attached as a filter. The locale is always explicit.
 */
public final class TranslationQueries {
  private static final Logger log = LoggerFactory.getLogger(TranslationQueries.class);

  private final TranslatedModel model;
  private final FilterJson filterJson;

  public TranslationQueries(TranslatedModel model) {
    this.model = Objects.requireNonNull(model, "model");
    this.filterJson = new FilterJson(model);
  }

  /** Unfiltered relation over the model table. */
  public Relation all() {
    return Relation.from(model.model().table());
  }

  /**
   * Adds {@code attribute = value} filters. Values may be single values or collections (matched with IN);
   * a null value matches records without a translation in {@code locale}.
   */
  public Relation where(Relation scope, Map<String, ?> opts, String locale) {
    return build(scope, opts, locale, false);
  }

  /** Like {@link #where} with every predicate inverted. */
  public Relation whereNot(Relation scope, Map<String, ?> opts, String locale) {
    return build(scope, opts, locale, true);
  }

  public Relation findBy(Relation scope, String attribute, Object value, String locale) {
    Map<String, Object> opts = new LinkedHashMap<>();
    opts.put(attribute, value);
    return where(scope, opts, locale);
  }

  /**
   * Filters with a predicate built by {@code block} from the nodes of {@code attributes}, e.g.
   * {@code nodes -> nodes.get(0).eq("foo").or(nodes.get(1).matches("%bar%"))}.
   */
  public Relation query(Relation scope, String locale, Function<List<TranslatedAttribute>, Node> block,
                        String... attributes) {
    Objects.requireNonNull(scope, "scope");
    Objects.requireNonNull(block, "block");
    requireLocale(locale);
    if (attributes == null || attributes.length == 0) {
      throw new IllegalArgumentException("query requires at least one attribute");
    }

    List<TranslatedAttribute> nodes = new ArrayList<>(attributes.length);
    for (String a : attributes) nodes.add(model.attribute(a, locale));
    Node predicate = Objects.requireNonNull(block.apply(nodes), "predicate");

    Relation out = scope;
    for (TranslationBackend b : distinctBackends(nodes)) {
      out = b.addTranslations(out, predicate, locale);
    }
    out = out.where(predicate);
    debugBuilt("query", out);
    return out;
  }

  /** Filters with a canonical JSON filter document (see {@link FilterJson}). */
  public Relation filter(Relation scope, String json, String locale, boolean invert) {
    Objects.requireNonNull(scope, "scope");
    requireLocale(locale);
    Node predicate = filterJson.parse(json, locale);
    if (predicate == null) return scope;

    Relation out = scope;
    for (TranslationBackend b : model.backends()) {
      out = b.addTranslations(out, predicate, locale, invert);
    }
    out = out.where(invert ? Predicates.invert(predicate) : predicate);
    debugBuilt("filter", out);
    return out;
  }

  private Relation build(Relation scope, Map<String, ?> opts, String locale, boolean invert) {
    Objects.requireNonNull(scope, "scope");
    Objects.requireNonNull(opts, "opts");
    requireLocale(locale);

    List<Node> untranslated = new ArrayList<>();
    Map<TranslationBackend, List<Node>> groups = new LinkedHashMap<>();
    for (Map.Entry<String, ?> e : opts.entrySet()) {
      String name = e.getKey();
      TranslationBackend backend = model.backendFor(name);
      if (backend == null) {
        untranslated.add(Predicates.matching(model.model().table().column(name), e.getValue()));
      } else {
        groups.computeIfAbsent(backend, b -> new ArrayList<>())
            .add(Predicates.matching(backend.buildNode(name, locale), e.getValue()));
      }
    }

    Relation out = scope;
    if (!untranslated.isEmpty()) out = out.where(combine(untranslated, invert));
    for (Map.Entry<TranslationBackend, List<Node>> g : groups.entrySet()) {
      List<Node> predicates = g.getValue();
      out = g.getKey().addTranslations(out, Nodes.list(predicates), locale, invert);
      out = out.where(combine(predicates, invert));
    }
    debugBuilt(invert ? "whereNot" : "where", out);
    return out;
  }

  private static Node combine(List<Node> predicates, boolean invert) {
    List<Node> out = new ArrayList<>(predicates.size());
    for (Node p : predicates) out.add(invert ? Predicates.invert(p) : p);
    return out.size() == 1 ? out.get(0) : Nodes.and(out);
  }

  private static List<TranslationBackend> distinctBackends(List<TranslatedAttribute> nodes) {
    List<TranslationBackend> out = new ArrayList<>();
    for (TranslatedAttribute n : nodes) {
      if (out.stream().noneMatch(b -> b == n.backend())) out.add(n.backend());
    }
    return out;
  }

  private static void requireLocale(String locale) {
    if (locale == null || locale.isBlank()) throw new IllegalArgumentException("locale must not be blank");
  }

  private void debugBuilt(String op, Relation r) {
    if (!log.isDebugEnabled()) return;
    log.debug("lingua.query op={} model={} joins={} filters={}",
        op, model.model().type(), r.joins().size(), r.wheres().size());
  }
}
