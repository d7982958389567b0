package io.intellixity.quarry.query;

import java.util.Objects;

public final class Condition implements QueryElement {
  private final String property;
  private final Operator operator;
  private final Object value;
  private final boolean not;

  public Condition(String property, Operator operator, Object value, boolean not) {
    this.property = Objects.requireNonNull(property, "property");
    this.operator = Objects.requireNonNull(operator, "operator");
    if (property.isBlank()) throw new IllegalArgumentException("property is blank");
    this.value = value;
    this.not = not;
  }

  public String property() { return property; }
  public Operator operator() { return operator; }
  public Object value() { return value; }
  public boolean not() { return not; }

  public Condition negate() {
    return new Condition(property, operator, value, !not);
  }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) { return visitor.visit(this); }

  public static Condition of(String property, Operator operator, Object value) {
    return new Condition(property, operator, value, false);
  }

  @Override
  public String toString() {
    return (not ? "!" : "") + property + " " + operator + " " + value;
  }
}
