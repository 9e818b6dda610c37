package io.intellixity.lingua.persistence.jdbc.dialect;

import io.intellixity.lingua.persistence.compile.JoinKind;
import io.intellixity.lingua.persistence.expr.*;
import io.intellixity.lingua.persistence.jdbc.Bind;
import io.intellixity.lingua.persistence.jdbc.SqlStatement;
import io.intellixity.lingua.persistence.relation.Join;
import io.intellixity.lingua.persistence.relation.Relation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * JDBC-generic SQL dialect base.
 *
 * Renders a {@link Relation} as {@code SELECT <base>.* FROM <base> <joins> WHERE <filters>} with literals bound as
 * named parameters ({@code :b1}, {@code :b2}, ...) in order of appearance: ON clauses first, then filters.
 *
 * DB-specific dialects override identifier quoting and case-insensitive matching.
 */
public abstract class AbstractJdbcSqlDialect implements JdbcDialect {
  private static final Logger log = LoggerFactory.getLogger(AbstractJdbcSqlDialect.class);

  protected static final class RenderCtx {
    private int n = 1;
    private final List<Bind> binds = new ArrayList<>();

    public String add(Bind b) {
      binds.add(b);
      return ":b" + (n++);
    }
  }

  @Override
  public final SqlStatement renderSelect(Relation relation) {
    RenderCtx ctx = new RenderCtx();
    String sql = "SELECT " + quoteIdent(relation.table().reference()) + ".* FROM " + renderBody(relation, ctx);
    SqlStatement stmt = new SqlStatement(sql, ctx.binds);
    debugSql("SELECT", relation, stmt);
    return stmt;
  }

  @Override
  public final SqlStatement renderCount(Relation relation) {
    RenderCtx ctx = new RenderCtx();
    String sql = "SELECT COUNT(*) FROM " + renderBody(relation, ctx);
    SqlStatement stmt = new SqlStatement(sql, ctx.binds);
    debugSql("COUNT", relation, stmt);
    return stmt;
  }

  private String renderBody(Relation relation, RenderCtx ctx) {
    StringBuilder sql = new StringBuilder(renderTable(relation.table()));
    for (Join j : relation.joins()) {
      sql.append(j.kind() == JoinKind.INNER ? " INNER JOIN " : " LEFT OUTER JOIN ")
          .append(renderTable(j.target()))
          .append(" ON ")
          .append(renderCondition(j.on(), ctx));
    }
    Node predicate = relation.predicate();
    if (predicate != null) sql.append(" WHERE ").append(renderCondition(predicate, ctx));
    return sql.toString();
  }

  /** Top-level conjunctions render without enclosing parentheses. */
  private String renderCondition(Node node, RenderCtx ctx) {
    if (node instanceof And a && !a.children().isEmpty()) {
      List<String> parts = new ArrayList<>();
      for (Node c : a.children()) parts.add(render(c, ctx));
      return String.join(" AND ", parts);
    }
    return render(node, ctx);
  }

  protected String render(Node node, RenderCtx ctx) {
    if (node instanceof Not n) {
      return "NOT (" + renderCondition(n.expr(), ctx) + ")";
    }

    if (node instanceof And a) {
      if (a.children().isEmpty()) return "1=1";
      if (a.children().size() == 1) return render(a.children().get(0), ctx);
      return "(" + renderCondition(a, ctx) + ")";
    }

    if (node instanceof Or o) {
      return "(" + render(o.left(), ctx) + " OR " + render(o.right(), ctx) + ")";
    }

    if (node instanceof Equality eq) {
      if (Nodes.isNullLiteral(eq.right())) return render(eq.left(), ctx) + " IS NULL";
      if (Nodes.isNullLiteral(eq.left())) return render(eq.right(), ctx) + " IS NULL";
      return render(eq.left(), ctx) + " = " + render(eq.right(), ctx);
    }

    if (node instanceof NotEqual ne) {
      if (Nodes.isNullLiteral(ne.right())) return render(ne.left(), ctx) + " IS NOT NULL";
      if (Nodes.isNullLiteral(ne.left())) return render(ne.right(), ctx) + " IS NOT NULL";
      return render(ne.left(), ctx) + " <> " + render(ne.right(), ctx);
    }

    if (node instanceof In in) {
      return listSql(in.left(), "IN", in.right(), ctx);
    }

    if (node instanceof NotIn nin) {
      return listSql(nin.left(), "NOT IN", nin.right(), ctx);
    }

    if (node instanceof Matches m) {
      String left = render(m.left(), ctx);
      String right = render(m.right(), ctx);
      return m.caseSensitive() ? left + " LIKE " + right : renderCaseInsensitiveMatch(left, right);
    }

    if (node instanceof Function f) {
      List<String> args = new ArrayList<>();
      for (Node e : f.expressions()) args.add(render(e, ctx));
      return f.name() + "(" + String.join(", ", args) + ")";
    }

    if (node instanceof Column c) {
      return quoteIdent(c.table().reference()) + "." + quoteIdent(c.name());
    }

    if (node instanceof Literal l) {
      return l.isNull() ? "NULL" : ctx.add(new Bind(l.value()));
    }

    if (node instanceof NodeList list) {
      List<String> items = new ArrayList<>();
      for (Node c : list.children()) items.add(render(c, ctx));
      return "(" + String.join(", ", items) + ")";
    }

    throw new IllegalArgumentException("Unsupported node in SQL rendering: " + node.getClass().getName());
  }

  /** Case-insensitive LIKE; generic SQL lower-cases both sides. */
  protected String renderCaseInsensitiveMatch(String left, String right) {
    return "LOWER(" + left + ") LIKE LOWER(" + right + ")";
  }

  protected abstract String quoteIdent(String ident);

  private String listSql(Node left, String op, Node right, RenderCtx ctx) {
    if (right instanceof NodeList list && list.isEmpty()) {
      // "IN ()" matches nothing, "NOT IN ()" matches everything
      return "IN".equals(op) ? "1=0" : "1=1";
    }
    return render(left, ctx) + " " + op + " " + render(right, ctx);
  }

  private String renderTable(TableRef t) {
    String sql = quoteIdent(t.name());
    return t.alias() == null ? sql : sql + " " + quoteIdent(t.alias());
  }

  private void debugSql(String op, Relation relation, SqlStatement stmt) {
    if (!log.isDebugEnabled()) return;
    log.debug("lingua.jdbc op={} dialect={} table={} joins={} bindCount={} sql={}",
        op, id(), relation.table().name(), relation.joins().size(), stmt.binds().size(), stmt.sql());
  }
}
