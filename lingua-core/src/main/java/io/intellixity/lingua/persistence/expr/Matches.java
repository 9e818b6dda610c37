package io.intellixity.lingua.persistence.expr;

/** SQL {@code LIKE}. Case-insensitive matches are rendered per dialect. */
public final class Matches extends Binary {
  private final boolean caseSensitive;

  public Matches(Node left, Node right, boolean caseSensitive) {
    super(left, right);
    this.caseSensitive = caseSensitive;
  }

  public boolean caseSensitive() { return caseSensitive; }

  @Override
  public boolean equals(Object o) {
    return super.equals(o) && caseSensitive == ((Matches) o).caseSensitive;
  }

  @Override
  public int hashCode() { return 31 * super.hashCode() + Boolean.hashCode(caseSensitive); }

  @Override
  public String toString() { return left() + (caseSensitive ? " LIKE " : " ILIKE ") + right(); }
}
