package io.intellixity.quarry.exec;

import java.util.Objects;

/**
 * Selector for session operations: the backing table name plus the row type stored there.
 *
 * @param name     table (or collection) name
 * @param rowType  Java type of the rows
 */
public record EntityRef<T>(String name, Class<T> rowType) {
  public EntityRef {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
    Objects.requireNonNull(rowType, "rowType");
  }

  public static <T> EntityRef<T> of(String name, Class<T> rowType) {
    return new EntityRef<>(name, rowType);
  }
}
