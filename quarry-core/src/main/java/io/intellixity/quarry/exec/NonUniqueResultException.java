package io.intellixity.quarry.exec;

/** Thrown when a single-row lookup matched more than one row. */
public final class NonUniqueResultException extends RuntimeException {
  public NonUniqueResultException(String message) {
    super(message);
  }
}
