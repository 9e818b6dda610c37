package io.intellixity.lingua.persistence.expr;

/** A node without children (literal, column, host-specific opaque leaf). */
public abstract class Leaf extends Node {
  protected Leaf() {}
}
