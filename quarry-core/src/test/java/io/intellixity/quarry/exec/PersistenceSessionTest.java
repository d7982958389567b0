package io.intellixity.quarry.exec;

import io.intellixity.quarry.query.Query;
import io.intellixity.quarry.query.QueryFilters;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class PersistenceSessionTest {
  private static final EntityRef<String> NAMES = EntityRef.of("names", String.class);

  /** Returns a fixed row list, honoring the limit, and records every query. */
  static final class CapturingSession implements PersistenceSession {
    final List<String> rows;
    final List<Query> queries = new ArrayList<>();

    CapturingSession(String... rows) {
      this.rows = List.of(rows);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> List<T> select(EntityRef<T> ref, Query query, List<Relation<T, ?>> fetch) {
      queries.add(query);
      int limit = (query.limit() == null) ? rows.size() : Math.min(query.limit(), rows.size());
      return (List<T>) (List<?>) rows.subList(0, limit);
    }
  }

  @Test
  void oneOrNone_emptyWhenNoRows() {
    CapturingSession s = new CapturingSession();
    assertEquals(Optional.empty(), s.oneOrNone(NAMES, Query.of(QueryFilters.eq("id", 1))));
  }

  @Test
  void oneOrNone_returnsSingleRow() {
    CapturingSession s = new CapturingSession("a");
    assertEquals(Optional.of("a"), s.oneOrNone(NAMES, Query.all()));
  }

  @Test
  void oneOrNone_throwsOnAmbiguity() {
    CapturingSession s = new CapturingSession("a", "b", "c");
    assertThrows(NonUniqueResultException.class, () -> s.oneOrNone(NAMES, Query.all()));
  }

  @Test
  void oneOrNone_limitsToTwoRowsWithoutTouchingCallerQuery() {
    CapturingSession s = new CapturingSession("a");
    Query q = Query.of(QueryFilters.eq("id", 1));
    s.oneOrNone(NAMES, q);

    assertNull(q.limit());
    assertEquals(2, s.queries.get(0).limit());
    assertSame(q.filter(), s.queries.get(0).filter());
  }

  @Test
  void oneOrNone_acceptsNullQuery() {
    CapturingSession s = new CapturingSession("a");
    assertEquals(Optional.of("a"), s.oneOrNone(NAMES, null));
  }

  @Test
  void one_throwsNoResultWhenEmpty() {
    CapturingSession s = new CapturingSession();
    NoResultException ex = assertThrows(NoResultException.class, () -> s.one(NAMES, Query.all()));
    assertTrue(ex.getMessage().contains("names"));
  }

  @Test
  void one_returnsSingleRow() {
    assertEquals("x", new CapturingSession("x").one(NAMES, Query.all()));
  }
}
