package io.intellixity.quarry.exec;

/** Thrown by {@link PersistenceSession#one} when the query matched no row. */
public final class NoResultException extends RuntimeException {
  public NoResultException(String message) {
    super(message);
  }
}
