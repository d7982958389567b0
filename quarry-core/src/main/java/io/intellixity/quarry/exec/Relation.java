package io.intellixity.quarry.exec;

import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * One-to-many relation that a session can load together with its parent rows.\n
 *
 * Children are the rows of {@code target} whose {@code foreignKey} property equals the parent's
 * {@code parentKey} property. {@code attach} receives every parent, with an empty list when it has
 * no children.\n
 */
public record Relation<P, C>(String name,
                             EntityRef<C> target,
                             String foreignKey,
                             String parentKey,
                             BiConsumer<? super P, List<C>> attach) {
  public Relation {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
    Objects.requireNonNull(target, "target");
    if (foreignKey == null || foreignKey.isBlank()) throw new IllegalArgumentException("foreignKey is required");
    parentKey = (parentKey == null || parentKey.isBlank()) ? "id" : parentKey;
    Objects.requireNonNull(attach, "attach");
  }

  /** Relation keyed on the parent's {@code id}. */
  public static <P, C> Relation<P, C> of(String name,
                                         EntityRef<C> target,
                                         String foreignKey,
                                         BiConsumer<? super P, List<C>> attach) {
    return new Relation<>(name, target, foreignKey, "id", attach);
  }
}
