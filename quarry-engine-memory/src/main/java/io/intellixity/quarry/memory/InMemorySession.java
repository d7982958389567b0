package io.intellixity.quarry.memory;

import io.intellixity.quarry.exec.EntityRef;
import io.intellixity.quarry.exec.PersistenceSession;
import io.intellixity.quarry.exec.Relation;
import io.intellixity.quarry.query.Query;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * {@link PersistenceSession} over named in-memory tables.\n
 *
 * - Rows are kept in insertion order, which is the natural row order of every select.\n
 * - A table is bound to the row type of the first {@link EntityRef} that touches it.\n
 * - Tables that were never written are empty.\n
 * - Returned rows are the stored instances, so relations attached by an eager fetch stay visible to
 *   later selects through the same session.\n
 *
 * Safe for concurrent selects and inserts.
 */
public final class InMemorySession implements PersistenceSession {
  private static final Logger log = LoggerFactory.getLogger(InMemorySession.class);

  private final Map<String, Table> tables = new ConcurrentHashMap<>();
  private final PropertyReader properties = new PropertyReader();
  private final AtomicLong statements = new AtomicLong();

  private record Table(Class<?> rowType, List<Object> rows) {}

  public <T> InMemorySession insert(EntityRef<T> ref, T row) {
    Objects.requireNonNull(ref, "ref");
    Objects.requireNonNull(row, "row");
    table(ref).rows().add(ref.rowType().cast(row));
    return this;
  }

  public <T> InMemorySession insertAll(EntityRef<T> ref, Collection<? extends T> rows) {
    Objects.requireNonNull(rows, "rows");
    for (T row : rows) insert(ref, row);
    return this;
  }

  /** Number of {@code select} calls served so far. Relation loads within a select are not counted. */
  public long statementCount() {
    return statements.get();
  }

  @Override
  public <T> List<T> select(EntityRef<T> ref, Query query, List<Relation<T, ?>> fetch) {
    Objects.requireNonNull(ref, "ref");
    statements.incrementAndGet();
    Query q = (query == null) ? Query.all() : query;

    List<T> out = filter(ref, q);
    if (fetch != null) {
      for (Relation<T, ?> relation : fetch) {
        if (relation != null) attach(out, relation);
      }
    }
    if (log.isDebugEnabled()) {
      log.debug("SELECT {} {} fetch={} -> {} row(s)", ref.name(), q, relationNames(fetch), out.size());
    }
    return out;
  }

  private <T> List<T> filter(EntityRef<T> ref, Query q) {
    Predicate<Object> predicate = InMemoryPredicates.compile(q.filter(), properties);
    long limit = (q.limit() == null) ? Long.MAX_VALUE : q.limit();
    List<T> out = new ArrayList<>();
    for (Object row : table(ref).rows()) {
      if (out.size() >= limit) break;
      if (predicate.test(row)) out.add(ref.rowType().cast(row));
    }
    return out;
  }

  private <P, C> void attach(List<P> parents, Relation<P, C> relation) {
    Map<Object, List<C>> byKey = new LinkedHashMap<>();
    for (P parent : parents) {
      byKey.putIfAbsent(normalizeKey(properties.read(parent, relation.parentKey())), new ArrayList<>());
    }
    if (!byKey.isEmpty()) {
      for (C child : filter(relation.target(), Query.all())) {
        List<C> bucket = byKey.get(normalizeKey(properties.read(child, relation.foreignKey())));
        if (bucket != null) bucket.add(child);
      }
    }
    for (P parent : parents) {
      List<C> children = byKey.get(normalizeKey(properties.read(parent, relation.parentKey())));
      relation.attach().accept(parent, List.copyOf(children));
    }
  }

  /** Integral keys of different boxed types must land in the same bucket. */
  private static Object normalizeKey(Object key) {
    if (key instanceof Integer || key instanceof Short || key instanceof Byte) return ((Number) key).longValue();
    return key;
  }

  private Table table(EntityRef<?> ref) {
    Table t = tables.computeIfAbsent(ref.name(), n -> new Table(ref.rowType(), new CopyOnWriteArrayList<>()));
    if (t.rowType() != ref.rowType()) {
      throw new IllegalArgumentException("Table '" + ref.name() + "' holds " + t.rowType().getName()
          + ", not " + ref.rowType().getName());
    }
    return t;
  }

  private static List<String> relationNames(List<? extends Relation<?, ?>> fetch) {
    if (fetch == null || fetch.isEmpty()) return List.of();
    List<String> names = new ArrayList<>(fetch.size());
    for (Relation<?, ?> r : fetch) {
      if (r != null) names.add(r.name());
    }
    return names;
  }
}
