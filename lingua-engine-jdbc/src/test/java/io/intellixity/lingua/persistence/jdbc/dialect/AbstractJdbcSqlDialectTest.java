package io.intellixity.lingua.persistence.jdbc.dialect;

import io.intellixity.lingua.persistence.compile.JoinKind;
import io.intellixity.lingua.persistence.expr.*;
import io.intellixity.lingua.persistence.jdbc.SqlStatement;
import io.intellixity.lingua.persistence.relation.Join;
import io.intellixity.lingua.persistence.relation.Relation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class AbstractJdbcSqlDialectTest {
  private static final TableRef POSTS = TableRef.of("posts");
  private static final TableRef T = TableRef.of("post_translations").alias("t");

  /** Leaves identifiers unquoted to keep expectations readable. */
  private static final class PlainDialect extends AbstractJdbcSqlDialect {
    @Override public String id() { return "plain"; }
    @Override protected String quoteIdent(String ident) { return ident; }
  }

  private final JdbcDialect dialect = new PlainDialect();

  private String where(Node predicate) {
    String sql = dialect.renderSelect(Relation.from(POSTS).where(predicate)).sql();
    return sql.substring(sql.indexOf(" WHERE ") + " WHERE ".length());
  }

  @Test
  void rendersJoinsThenFiltersWithOrderedBinds() {
    Relation r = Relation.from(POSTS)
        .withJoin(new Join(JoinKind.INNER, T, Nodes.and(
            T.column("post_id").eq(POSTS.column("id")),
            T.column("locale").eq("en"))))
        .where(POSTS.column("published").eq(true))
        .where(T.column("title").eq("foo"));

    SqlStatement s = dialect.renderSelect(r);
    assertEquals("SELECT posts.* FROM posts"
        + " INNER JOIN post_translations t ON t.post_id = posts.id AND t.locale = :b1"
        + " WHERE posts.published = :b2 AND t.title = :b3", s.sql());
    assertEquals(List.of("en", true, "foo"), s.values());
  }

  @Test
  void outerJoinsRenderAsLeftOuter() {
    Relation r = Relation.from(POSTS.alias("p"))
        .withJoin(new Join(JoinKind.OUTER, T, T.column("post_id").eq(POSTS.alias("p").column("id"))));
    assertEquals("SELECT p.* FROM posts p LEFT OUTER JOIN post_translations t ON t.post_id = p.id",
        dialect.renderSelect(r).sql());
  }

  @Test
  void nullComparisonsRenderAsNullChecks() {
    assertEquals("t.title IS NULL", where(T.column("title").eq(null)));
    assertEquals("t.title IS NOT NULL", where(T.column("title").notEq(null)));
    assertEquals("t.title <> :b1", where(T.column("title").notEq("foo")));
  }

  @Test
  void emptyListsRenderAsConstants() {
    assertEquals("1=0", where(T.column("title").in(List.of())));
    assertEquals("1=1", where(T.column("title").notIn(List.of())));
    assertEquals("t.title IN (:b1, :b2)", where(T.column("title").in(List.of("a", "b"))));
  }

  @Test
  void disjunctionsAndNegationsAreParenthesised() {
    Node p = Nodes.not(T.column("title").eq("a").or(T.column("title").eq(null)))
        .and(T.column("locale").eq("en").or(T.column("locale").eq("fr")));
    assertEquals("NOT ((t.title = :b1 OR t.title IS NULL)) AND (t.locale = :b2 OR t.locale = :b3)", where(p));
  }

  @Test
  void nestedConjunctionsAreGrouped() {
    Node p = Nodes.and(T.column("a").eq(1), T.column("b").eq(2)).or(T.column("c").eq(3));
    assertEquals("((t.a = :b1 AND t.b = :b2) OR t.c = :b3)", where(p));
  }

  @Test
  void caseInsensitiveMatchLowersBothSides() {
    assertEquals("LOWER(t.title) LIKE LOWER(:b1)", where(T.column("title").matches("%foo%", false)));
    assertEquals("t.title LIKE :b1", where(T.column("title").matches("%foo%")));
    assertEquals("LOWER(t.title) = :b1", where(Function.lower(T.column("title")).eq("foo")));
  }

  @Test
  void countKeepsJoinsAndFilters() {
    Relation r = Relation.from(POSTS)
        .withJoin(new Join(JoinKind.OUTER, T, T.column("post_id").eq(POSTS.column("id"))))
        .where(T.column("title").eq(null));
    SqlStatement s = dialect.renderCount(r);
    assertEquals("SELECT COUNT(*) FROM posts LEFT OUTER JOIN post_translations t ON t.post_id = posts.id"
        + " WHERE t.title IS NULL", s.sql());
    assertTrue(s.binds().isEmpty());
  }

  @Test
  void unsupportedNodesAreRejected() {
    Node opaque = new Leaf() {};
    assertThrows(IllegalArgumentException.class, () -> dialect.renderSelect(Relation.from(POSTS).where(opaque)));
  }
}
