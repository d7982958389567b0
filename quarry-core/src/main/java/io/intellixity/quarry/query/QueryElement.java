package io.intellixity.quarry.query;

/** Node of a backend-agnostic filter tree. */
public interface QueryElement {
  <Q> Q accept(QueryVisitor<Q> visitor);
}
