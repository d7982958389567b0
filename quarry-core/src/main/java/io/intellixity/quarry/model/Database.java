package io.intellixity.quarry.model;

/**
 * Connection descriptor owning datasources.
 *
 * @param type tag of the connector whose datasources live in this database
 */
public record Database(long id, String name, String type) {
  public static final String ID = "id";
  public static final String NAME = "name";

  public Database {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
    if (type == null || type.isBlank()) throw new IllegalArgumentException("type is required");
  }
}
