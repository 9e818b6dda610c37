package io.intellixity.lingua.persistence.jdbc;

/** A positional bind value; {@code :bN} placeholders in {@link SqlStatement#sql()} map to {@code binds().get(N - 1)}. */
public record Bind(Object value) {}
