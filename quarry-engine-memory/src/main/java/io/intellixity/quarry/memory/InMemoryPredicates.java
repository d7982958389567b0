package io.intellixity.quarry.memory;

import io.intellixity.quarry.query.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Compiles filters ({@link QueryElement}) into row predicates, pushing NOT down to the conditions
 * (De Morgan) and reading EQ/NE null as IS NULL/IS NOT NULL.
 * <p>
 * Any other condition on a null property value is false under either polarity, as in SQL.
 */
final class InMemoryPredicates {
  private InMemoryPredicates() {}

  static Predicate<Object> compile(QueryElement filter, PropertyReader reader) {
    if (filter == null) return row -> true;
    Predicate<Object> p = filter.accept(new Compiler(reader, false));
    return (p == null) ? row -> true : p;
  }

  private static final class Compiler implements QueryVisitor<Predicate<Object>> {
    private final PropertyReader reader;
    private final boolean negate;

    Compiler(PropertyReader reader, boolean negate) {
      this.reader = reader;
      this.negate = negate;
    }

    @Override
    public Predicate<Object> visit(NotElement not) {
      return not.element().accept(new Compiler(reader, !negate));
    }

    @Override
    public Predicate<Object> visit(LogicalGroup group) {
      Clause clause = group.clause();
      if (negate) clause = (clause == Clause.OR) ? Clause.AND : Clause.OR;

      List<Predicate<Object>> parts = new ArrayList<>();
      for (QueryElement child : group.elements()) {
        Predicate<Object> p = child.accept(this);
        if (p != null) parts.add(p);
      }
      if (clause == Clause.OR) {
        return row -> parts.stream().anyMatch(p -> p.test(row));
      }
      return row -> parts.stream().allMatch(p -> p.test(row));
    }

    @Override
    public Predicate<Object> visit(Condition c) {
      String property = c.property();
      boolean not = c.not() ^ negate;
      Object expected = c.value();

      if (expected == null && (c.operator() == Operator.EQ || c.operator() == Operator.NE)) {
        boolean wantNull = (c.operator() == Operator.EQ) ^ not;
        return row -> (reader.read(row, property) == null) == wantNull;
      }

      Predicate<Object> positive = positive(c.operator(), expected);
      return row -> {
        Object actual = reader.read(row, property);
        if (actual == null) return false;
        return positive.test(actual) ^ not;
      };
    }
  }

  private static Predicate<Object> positive(Operator op, Object expected) {
    return switch (op) {
      case EQ -> actual -> valuesEqual(actual, expected);
      case NE -> actual -> !valuesEqual(actual, expected);
      case GT -> actual -> compare(op, actual, requireNonNull(op, expected)) > 0;
      case GE -> actual -> compare(op, actual, requireNonNull(op, expected)) >= 0;
      case LT -> actual -> compare(op, actual, requireNonNull(op, expected)) < 0;
      case LE -> actual -> compare(op, actual, requireNonNull(op, expected)) <= 0;
      case IN -> {
        List<Object> values = toList(expected);
        yield actual -> values.stream().anyMatch(v -> valuesEqual(actual, v));
      }
      case NIN -> {
        List<Object> values = toList(expected);
        yield actual -> values.stream().noneMatch(v -> valuesEqual(actual, v));
      }
      case LIKE -> {
        Pattern pattern = likePattern(String.valueOf(requireNonNull(op, expected)));
        yield actual -> pattern.matcher(String.valueOf(actual)).matches();
      }
    };
  }

  private static Object requireNonNull(Operator op, Object v) {
    if (v == null) throw new QueryValidationException(op + " requires non-null value");
    return v;
  }

  /** Numbers compare by value across boxed types; enums match their name. */
  static boolean valuesEqual(Object a, Object b) {
    if (a == null || b == null) return a == b;
    if (a instanceof Number x && b instanceof Number y) {
      if (isIntegral(x) && isIntegral(y)) return x.longValue() == y.longValue();
      return Double.compare(x.doubleValue(), y.doubleValue()) == 0;
    }
    if (a instanceof Enum<?> e && b instanceof String s) return e.name().equals(s);
    if (b instanceof Enum<?> e && a instanceof String s) return e.name().equals(s);
    return a.equals(b);
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private static int compare(Operator op, Object actual, Object expected) {
    if (actual instanceof Number x && expected instanceof Number y) {
      if (isIntegral(x) && isIntegral(y)) return Long.compare(x.longValue(), y.longValue());
      return Double.compare(x.doubleValue(), y.doubleValue());
    }
    if (actual instanceof Comparable ca && actual.getClass().isInstance(expected)) {
      return ca.compareTo(expected);
    }
    throw new QueryValidationException(op + " cannot compare " + actual.getClass().getName()
        + " with " + expected.getClass().getName());
  }

  private static boolean isIntegral(Number n) {
    return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
  }

  private static List<Object> toList(Object v) {
    if (v == null) return List.of();
    if (v instanceof Collection<?> c) return new ArrayList<>(c);
    if (v instanceof Object[] arr) return Arrays.asList(arr);
    return List.of(v);
  }

  static Pattern likePattern(String likePattern) {
    // Translate SQL LIKE to regex. '%' -> '.*', '_' -> '.'
    StringBuilder re = new StringBuilder();
    for (int i = 0; i < likePattern.length(); i++) {
      char ch = likePattern.charAt(i);
      if (ch == '%') re.append(".*");
      else if (ch == '_') re.append(".");
      else re.append(Pattern.quote(String.valueOf(ch)));
    }
    return Pattern.compile(re.toString(), Pattern.DOTALL);
  }
}
