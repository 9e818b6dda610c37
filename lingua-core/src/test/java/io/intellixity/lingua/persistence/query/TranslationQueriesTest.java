package io.intellixity.lingua.persistence.query;

import io.intellixity.lingua.persistence.backend.*;
import io.intellixity.lingua.persistence.compile.JoinKind;
import io.intellixity.lingua.persistence.expr.Nodes;
import io.intellixity.lingua.persistence.expr.TableRef;
import io.intellixity.lingua.persistence.expr.TranslatedAttribute;
import io.intellixity.lingua.persistence.relation.Relation;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class TranslationQueriesTest {
  private static final ModelDef POST = ModelDef.of("Post", "posts");
  private static final TableRef POSTS = POST.table();

  private final KeyValueBackend strings = KeyValueBackend.configure(POST, KeyValueOptions.ofType("string"),
      new TranslationTypes(List.of(new DefaultTranslationTypeProvider())));
  private final TableBackend table = TableBackend.configure(POST, new TableOptions());
  private final TranslationQueries queries = new TranslationQueries(new TranslatedModel(POST)
      .translates(strings, "title", "body")
      .translates(table, "subtitle"));

  private TranslatedAttribute title() {
    return strings.buildNode("title", "en");
  }

  @Test
  void whereOnValueJoinsInnerAndFilters() {
    Relation r = queries.where(queries.all(), Map.of("title", "foo"), "en");

    assertEquals(1, r.joins().size());
    assertEquals(JoinKind.INNER, r.joins().get(0).kind());
    assertEquals(List.of(title().eq("foo")), r.wheres());
  }

  @Test
  void whereOnNullJoinsOuter() {
    Map<String, Object> opts = new LinkedHashMap<>();
    opts.put("title", null);
    Relation r = queries.where(queries.all(), opts, "en");

    assertEquals(JoinKind.OUTER, r.joins().get(0).kind());
    assertEquals(List.of(title().eq(null)), r.wheres());
  }

  @Test
  void whereOnValueOrNullJoinsOuter() {
    Relation r = queries.where(queries.all(), Map.of("title", Arrays.asList("foo", null)), "en");

    assertEquals(JoinKind.OUTER, r.joins().get(0).kind());
    assertEquals(List.of(title().eq("foo").or(title().eq(null))), r.wheres());
  }

  @Test
  void whereNotInvertsAndJoinsInner() {
    Map<String, Object> opts = new LinkedHashMap<>();
    opts.put("title", "foo");
    opts.put("body", null);
    Relation r = queries.whereNot(queries.all(), opts, "en");

    assertEquals(2, r.joins().size());
    assertTrue(r.joins().stream().allMatch(j -> j.kind() == JoinKind.INNER));
    assertEquals(List.of(Nodes.and(title().notEq("foo"), strings.buildNode("body", "en").notEq(null))), r.wheres());
  }

  @Test
  void untranslatedKeysFilterTheModelTable() {
    Map<String, Object> opts = new LinkedHashMap<>();
    opts.put("published", true);
    opts.put("subtitle", List.of("a", "b"));
    Relation r = queries.where(queries.all(), opts, "en");

    assertEquals(1, r.joins().size());
    assertEquals(table.translationsTable(), r.joins().get(0).target());
    assertEquals(List.of(
        POSTS.column("published").eq(true),
        table.buildNode("subtitle", "en").in(List.of("a", "b"))
    ), r.wheres());
  }

  @Test
  void chainedLookupsReuseJoins() {
    Relation r = queries.where(queries.all(), Map.of("title", "foo"), "en");
    r = queries.findBy(r, "title", "bar", "en");

    assertEquals(1, r.joins().size());
    assertEquals(2, r.wheres().size());
  }

  @Test
  void chainingAnotherLocaleFailsInsteadOfReusingTheJoin() {
    Relation en = queries.where(queries.all(), Map.of("title", "foo"), "en");
    assertThrows(IllegalArgumentException.class, () -> queries.findBy(en, "title", "bar", "fr"));
  }

  @Test
  void queryBlockJoinsEveryNamedBackend() {
    Relation r = queries.query(queries.all(), "en",
        nodes -> nodes.get(0).eq("foo").or(nodes.get(1).matches("%bar%")),
        "title", "subtitle");

    assertEquals(2, r.joins().size());
    assertTrue(r.joins().stream().allMatch(j -> j.kind() == JoinKind.OUTER));
    assertEquals(1, r.wheres().size());
  }

  @Test
  void queryOnUnknownAttributeFails() {
    assertThrows(QueryValidationException.class,
        () -> queries.query(queries.all(), "en", nodes -> nodes.get(0).eq("x"), "published"));
  }

  @Test
  void filterUsesJsonDocument() {
    Relation r = queries.filter(queries.all(), """
        { "or": [
          { "eq": { "field": "title", "value": "foo" } },
          { "eq": { "field": "title", "value": null } }
        ] }
        """, "en", false);

    assertEquals(1, r.joins().size());
    assertEquals(JoinKind.OUTER, r.joins().get(0).kind());
    assertEquals(List.of(title().eq("foo").or(title().eq(null))), r.wheres());
  }

  @Test
  void filterInWithNullJoinsOuterLikeWhere() {
    Relation viaFilter = queries.filter(queries.all(),
        "{ \"in\": { \"field\": \"title\", \"values\": [\"foo\", null] } }", "en", false);
    Relation viaWhere = queries.where(queries.all(), Map.of("title", Arrays.asList("foo", null)), "en");

    assertEquals(JoinKind.OUTER, viaFilter.joins().get(0).kind());
    assertEquals(List.of(title().eq("foo").or(title().eq(null))), viaFilter.wheres());
    assertEquals(viaWhere, viaFilter);
  }

  @Test
  void invertedFilterJoinsInner() {
    Relation r = queries.filter(queries.all(), "{ \"eq\": { \"field\": \"title\", \"value\": \"foo\" } }", "en", true);

    assertEquals(JoinKind.INNER, r.joins().get(0).kind());
    assertEquals(List.of(title().notEq("foo")), r.wheres());
  }

  @Test
  void emptyFilterLeavesScopeUntouched() {
    Relation all = queries.all();
    assertSame(all, queries.filter(all, " ", "en", false));
  }

  @Test
  void blankLocaleIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> queries.where(queries.all(), Map.of("title", "foo"), ""));
    assertThrows(IllegalArgumentException.class, () -> queries.findBy(queries.all(), "title", "foo", null));
  }
}
