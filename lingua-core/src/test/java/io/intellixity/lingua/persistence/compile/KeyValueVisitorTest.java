package io.intellixity.lingua.persistence.compile;

import io.intellixity.lingua.persistence.backend.DefaultTranslationTypeProvider;
import io.intellixity.lingua.persistence.backend.KeyValueBackend;
import io.intellixity.lingua.persistence.backend.KeyValueOptions;
import io.intellixity.lingua.persistence.backend.ModelDef;
import io.intellixity.lingua.persistence.backend.TranslationTypes;
import io.intellixity.lingua.persistence.expr.Node;
import io.intellixity.lingua.persistence.expr.Nodes;
import io.intellixity.lingua.persistence.expr.TableRef;
import io.intellixity.lingua.persistence.expr.TranslatedAttribute;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.intellixity.lingua.persistence.compile.JoinKind.INNER;
import static io.intellixity.lingua.persistence.compile.JoinKind.OUTER;
import static org.junit.jupiter.api.Assertions.*;

final class KeyValueVisitorTest {
  private static final ModelDef POST = ModelDef.of("Post", "posts");
  private static final TranslationTypes TYPES = new TranslationTypes(List.of(new DefaultTranslationTypeProvider()));

  private final KeyValueBackend backend = KeyValueBackend.configure(POST, KeyValueOptions.ofType("string"), TYPES);
  private final KeyValueBackend other = KeyValueBackend.configure(POST, KeyValueOptions.ofType("text"), TYPES);
  private final KeyValueVisitor visitor = new KeyValueVisitor(backend);

  private TranslatedAttribute attr(String name) {
    return backend.buildNode(name, "en");
  }

  @Test
  void equalityOnValueRequiresInner() {
    assertEquals(Map.of("title", INNER), visitor.accept(attr("title").eq("foo")));
  }

  @Test
  void equalityOnNullRequiresOuter() {
    assertEquals(Map.of("title", OUTER), visitor.accept(attr("title").eq(null)));
  }

  @Test
  void disjunctionWithNullCheckRequiresOuter() {
    Node p = attr("title").eq("foo").or(attr("title").eq(null));
    assertEquals(Map.of("title", OUTER), visitor.accept(p));
  }

  @Test
  void disjunctionMakesEveryTouchedAttributeOuter() {
    Node p = attr("title").eq("foo").or(attr("body").eq("bar"));
    assertEquals(Map.of("title", OUTER, "body", OUTER), visitor.accept(p));
  }

  @Test
  void conjunctionKeepsOuterOnceSeen() {
    Node p = Nodes.and(attr("title").eq(null), attr("title").eq("foo"), attr("body").eq("bar"));
    Map<String, JoinKind> out = visitor.accept(p);
    assertEquals(Map.of("title", OUTER, "body", INNER), out);
    assertEquals(List.of("title", "body"), List.copyOf(out.keySet()));
  }

  @Test
  void inListAndNegationRecurse() {
    Node p = Nodes.list(attr("title").in(List.of("a", "b")), attr("body").notEq("x").not());
    assertEquals(Map.of("title", INNER, "body", INNER), visitor.accept(p));
  }

  @Test
  void foreignAndPlainColumnsAreIgnored() {
    Node p = Nodes.and(other.buildNode("title", "en").eq("foo"), TableRef.of("posts").column("published").eq(true));
    assertTrue(visitor.accept(p).isEmpty());
  }

  @Test
  void emptyPredicateRequiresNothing() {
    assertTrue(visitor.accept(null).isEmpty());
    assertTrue(visitor.accept(Nodes.list()).isEmpty());
  }

  @Test
  void resultIsReadOnly() {
    Map<String, JoinKind> out = visitor.accept(attr("title").eq("foo"));
    assertThrows(UnsupportedOperationException.class, () -> out.put("body", INNER));
  }
}
