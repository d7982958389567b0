package io.intellixity.quarry.exec;

import io.intellixity.quarry.query.Query;

import java.util.List;
import java.util.Optional;

/**
 * Executes queries against the store backing an {@link EntityRef}.\n
 *
 * Sessions are supplied by callers per operation and own the rows they return. Implementations
 * decide how filters are executed; the single-row helpers are defined here on top of
 * {@link #select(EntityRef, Query, List)}.\n
 */
public interface PersistenceSession {

  /** Predicate-filtered multi-row fetch in the store's natural row order. */
  default <T> List<T> select(EntityRef<T> ref, Query query) {
    return select(ref, query, List.of());
  }

  /**
   * Multi-row fetch that also loads the given relations for every returned row, in the same call.
   * An empty {@code fetch} list loads no relation.
   */
  <T> List<T> select(EntityRef<T> ref, Query query, List<Relation<T, ?>> fetch);

  /**
   * Returns the single matching row, or empty when nothing matches.
   *
   * @throws NonUniqueResultException if more than one row matches
   */
  default <T> Optional<T> oneOrNone(EntityRef<T> ref, Query query) {
    return oneOrNone(ref, query, List.of());
  }

  /** {@link #oneOrNone(EntityRef, Query)} with eager relations. */
  default <T> Optional<T> oneOrNone(EntityRef<T> ref, Query query, List<Relation<T, ?>> fetch) {
    Query q = (query == null) ? Query.all() : query.copy();
    // Two rows are enough to tell "one" from "many".
    List<T> rows = select(ref, q.withLimit(2), fetch);
    if (rows.size() > 1) {
      throw new NonUniqueResultException("Multiple rows in '" + ref.name() + "' for " + query);
    }
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  /**
   * Returns exactly one matching row.
   *
   * @throws NoResultException        if nothing matches
   * @throws NonUniqueResultException if more than one row matches
   */
  default <T> T one(EntityRef<T> ref, Query query) {
    return oneOrNone(ref, query)
        .orElseThrow(() -> new NoResultException("No row in '" + ref.name() + "' for " + query));
  }
}
