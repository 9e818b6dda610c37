package io.intellixity.lingua.persistence.query;

/**
 * Raised when a query references unknown translated attributes or a filter document is malformed.
 */
public final class QueryValidationException extends RuntimeException {
  public QueryValidationException(String message) {
    super(message);
  }

  public QueryValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
