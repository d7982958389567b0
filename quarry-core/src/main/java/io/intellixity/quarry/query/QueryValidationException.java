package io.intellixity.quarry.query;

/**
 * Raised when a filter references a property a row type does not expose, or uses an operator
 * with values it cannot evaluate.
 */
public final class QueryValidationException extends RuntimeException {
  public QueryValidationException(String message) {
    super(message);
  }

  public QueryValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
