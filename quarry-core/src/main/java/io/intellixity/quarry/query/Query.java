package io.intellixity.quarry.query;

/**
 * Filter plus an optional row limit, handed to a {@link io.intellixity.quarry.exec.PersistenceSession}.
 * <p>
 * Instances are mutable builders; the {@code with*} methods return {@code this}.
 */
public final class Query implements QueryElement {
  private QueryElement filter;
  private Integer limit;

  public Query() {}

  public QueryElement filter() { return filter; }
  /** Maximum number of rows to return, or null for no limit. */
  public Integer limit() { return limit; }

  public Query withFilter(QueryElement filter) { this.filter = filter; return this; }

  public Query withLimit(Integer limit) {
    if (limit != null && limit < 0) throw new IllegalArgumentException("limit must be >= 0: " + limit);
    this.limit = limit;
    return this;
  }

  /** Narrows the current filter: the result matches only rows matching both. */
  public Query withAndFilter(QueryElement element) {
    if (element == null) return this;
    this.filter = (filter == null) ? element : QueryFilters.and(filter, element);
    return this;
  }

  /** Copy with the same filter and limit. Filter nodes are immutable and shared. */
  public Query copy() {
    return new Query().withFilter(filter).withLimit(limit);
  }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) {
    return filter != null ? filter.accept(visitor) : null;
  }

  public static Query all() {
    return new Query();
  }

  public static Query of(QueryElement filter) {
    return new Query().withFilter(filter);
  }

  public static Query and(QueryElement... elements) {
    return Query.of(QueryFilters.and(elements));
  }

  public static Query or(QueryElement... elements) {
    return Query.of(QueryFilters.or(elements));
  }

  @Override
  public String toString() {
    return "Query{filter=" + filter + (limit == null ? "" : ", limit=" + limit) + "}";
  }
}
