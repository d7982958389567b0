package io.intellixity.quarry.registry;

/** A lookup named a datasource type tag that has no registered connector. */
public final class UnknownDatasourceTypeException extends RuntimeException {
  private final String type;

  public UnknownDatasourceTypeException(String type) {
    super("Unknown datasource type: " + type);
    this.type = type;
  }

  public String type() { return type; }
}
