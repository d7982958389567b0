package io.intellixity.quarry.registry;

/**
 * No datasource matched a lookup, or an id lookup within one type matched more than one row.
 * Both cases are reported the same way; the session exception, if any, is the cause.
 */
public final class DatasourceNotFoundException extends RuntimeException {
  private final String type;
  private final Long id;

  public DatasourceNotFoundException(String type, Long id, String message, Throwable cause) {
    super(message, cause);
    this.type = type;
    this.id = id;
  }

  public static DatasourceNotFoundException of(String type, long id) {
    return of(type, id, null);
  }

  public static DatasourceNotFoundException of(String type, long id, Throwable cause) {
    return new DatasourceNotFoundException(type, id, "Datasource not found: " + type + "/" + id, cause);
  }

  /** Type-agnostic id lookup found nothing in any registered type. */
  public static DatasourceNotFoundException forId(long id) {
    return new DatasourceNotFoundException(null, id, "Datasource id not found: " + id, null);
  }

  /** Type tag of the failed lookup, or null for a lookup across all types. */
  public String type() { return type; }

  /** Requested id, or null when the lookup was not by id. */
  public Long id() { return id; }
}
