package io.intellixity.lingua.persistence.expr;

import java.util.Objects;

/** Node with a left and a right operand. */
public abstract class Binary extends Node {
  private final Node left;
  private final Node right;

  protected Binary(Node left, Node right) {
    this.left = Objects.requireNonNull(left, "left");
    this.right = Objects.requireNonNull(right, "right");
  }

  public Node left() { return left; }
  public Node right() { return right; }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || o.getClass() != getClass()) return false;
    Binary other = (Binary) o;
    return left.equals(other.left) && right.equals(other.right);
  }

  @Override
  public int hashCode() { return Objects.hash(getClass(), left, right); }
}
