package io.intellixity.lingua.persistence.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.lingua.persistence.expr.Column;
import io.intellixity.lingua.persistence.expr.Node;
import io.intellixity.lingua.persistence.expr.Nodes;

import java.util.*;

/**
 * Canonical JSON filter reader.
 * <p>
 * Accepted forms:
 * <pre>
 * { "and": [ ... ] }   { "or": [ ... ] }   { "not": { ... } }
 * { "eq":   { "field": "title", "value": "foo" } }      // value null means IS NULL
 * { "ne":   { "field": "title", "value": "foo" } }
 * { "in":   { "field": "title", "values": ["a", null] } }  // a null among values also matches IS NULL
 * { "nin":  { "field": "title", "values": ["a", "b"] } }
 * { "like": { "field": "title", "value": "fo%", "ignoreCase": true } }
 * </pre>
 * Fields naming translated attributes resolve to the backend's node in the requested locale; other fields are
 * columns of the model table.
 */
public final class FilterJson {
  private static final ObjectMapper JSON = new ObjectMapper();

  private final TranslatedModel model;

  public FilterJson(TranslatedModel model) {
    this.model = Objects.requireNonNull(model, "model");
  }

  /** Parsed predicate, or null for an empty filter. */
  public Node parse(String json, String locale) {
    if (json == null || json.isBlank()) return null;
    JsonNode root;
    try {
      root = JSON.readTree(json);
    } catch (JsonProcessingException e) {
      throw new QueryValidationException("Filter is not valid JSON: " + e.getOriginalMessage(), e);
    }
    return parse(root, locale);
  }

  public Node parse(JsonNode n, String locale) {
    if (n == null || n.isNull() || n.isMissingNode()) return null;
    if (!n.isObject() || n.size() != 1) {
      throw new QueryValidationException("Filter element must be an object with exactly one key: " + n);
    }

    String key = n.fieldNames().next();
    JsonNode body = n.get(key);
    switch (key.toLowerCase(Locale.ROOT)) {
      case "and": {
        List<Node> children = parseChildren(key, body, locale);
        if (children.isEmpty()) return null;
        return children.size() == 1 ? children.get(0) : Nodes.and(children);
      }
      case "or": {
        List<Node> children = parseChildren(key, body, locale);
        if (children.isEmpty()) return null;
        Node out = children.get(0);
        for (int i = 1; i < children.size(); i++) out = out.or(children.get(i));
        return out;
      }
      case "not": {
        Node child = parse(body, locale);
        return child == null ? null : Nodes.not(child);
      }
      case "eq":
        return column(key, body, locale).eq(value(body.get("value")));
      case "ne":
        return column(key, body, locale).notEq(value(body.get("value")));
      case "in":
        return in(column(key, body, locale), values(key, body));
      case "nin":
        return Predicates.invert(in(column(key, body, locale), values(key, body)));
      case "like": {
        Object pattern = value(body.get("value"));
        if (pattern == null) throw new QueryValidationException("like requires a non-null value");
        JsonNode ignoreCase = body.get("ignoreCase");
        boolean caseSensitive = ignoreCase == null || !ignoreCase.asBoolean(false);
        return column(key, body, locale).matches(String.valueOf(pattern), caseSensitive);
      }
      default:
        throw new QueryValidationException("Unsupported filter operator: " + key);
    }
  }

  private List<Node> parseChildren(String key, JsonNode arr, String locale) {
    if (arr == null || !arr.isArray()) throw new QueryValidationException(key + " requires an array");
    List<Node> out = new ArrayList<>();
    for (JsonNode x : arr) {
      Node e = parse(x, locale);
      if (e != null) out.add(e);
    }
    return out;
  }

  private Column column(String op, JsonNode body, String locale) {
    if (body == null || !body.isObject()) throw new QueryValidationException(op + " must be an object");
    JsonNode f = body.get("field");
    if (f == null || !f.isTextual() || f.asText().isBlank()) {
      throw new QueryValidationException(op + " requires a field");
    }
    String field = f.asText();
    if (model.isTranslated(field)) return model.attribute(field, locale);
    return model.model().table().column(field);
  }

  /** Same value semantics as {@code where}: a null among values adds {@code OR IS NULL}. */
  private static Node in(Column column, List<Object> values) {
    return values.isEmpty() ? column.in(values) : Predicates.matching(column, values);
  }

  private static List<Object> values(String op, JsonNode body) {
    JsonNode v = body.get("values");
    if (v == null || !v.isArray()) throw new QueryValidationException(op + " requires a values array");
    List<Object> out = new ArrayList<>(v.size());
    for (JsonNode x : v) out.add(value(x));
    return out;
  }

  private static Object value(JsonNode v) {
    if (v == null || v.isNull()) return null;
    try {
      return JSON.treeToValue(v, Object.class);
    } catch (JsonProcessingException e) {
      throw new QueryValidationException("Unsupported filter value: " + v, e);
    }
  }
}
