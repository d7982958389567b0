package io.intellixity.quarry.query;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public final class LogicalGroup implements QueryElement {
  private final Clause clause;
  private final List<QueryElement> elements;

  public LogicalGroup(Clause clause, List<QueryElement> elements) {
    this.clause = Objects.requireNonNull(clause, "clause");
    this.elements = List.copyOf(elements == null ? List.of() : elements);
  }

  public Clause clause() { return clause; }
  public List<QueryElement> elements() { return elements; }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) { return visitor.visit(this); }

  @Override
  public String toString() {
    return elements.stream().map(String::valueOf).collect(Collectors.joining(" " + clause + " ", "(", ")"));
  }
}
