package io.intellixity.quarry.memory;

import io.intellixity.quarry.query.QueryValidationException;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reads named properties off row objects.\n
 *
 * Resolution order per (class, property): public no-arg {@code property()}, {@code getProperty()},
 * {@code isProperty()}, then a declared field anywhere in the class hierarchy. Resolved accessors
 * are cached.\n
 */
final class PropertyReader {
  private final Map<AccessorKey, Accessor> accessors = new ConcurrentHashMap<>();

  Object read(Object row, String property) {
    Objects.requireNonNull(row, "row");
    Objects.requireNonNull(property, "property");
    Accessor a = accessors.computeIfAbsent(new AccessorKey(row.getClass(), property), PropertyReader::resolve);
    return a.get(row);
  }

  private static Accessor resolve(AccessorKey key) {
    Class<?> type = key.type();
    String p = key.property();
    String cap = Character.toUpperCase(p.charAt(0)) + p.substring(1);
    for (String name : new String[] {p, "get" + cap, "is" + cap}) {
      Method m = publicNoArg(type, name);
      if (m != null) return row -> invoke(m, row);
    }
    for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
      try {
        Field f = c.getDeclaredField(p);
        if (Modifier.isStatic(f.getModifiers())) continue;
        f.setAccessible(true);
        return row -> {
          try {
            return f.get(row);
          } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot read field " + p + " of " + type.getName(), e);
          }
        };
      } catch (NoSuchFieldException ignored) {
        // keep walking up
      }
    }
    throw new QueryValidationException("Unknown property '" + p + "' on " + type.getName());
  }

  private static Method publicNoArg(Class<?> type, String name) {
    try {
      Method m = type.getMethod(name);
      if (Modifier.isStatic(m.getModifiers()) || m.getReturnType() == void.class) return null;
      m.setAccessible(true);
      return m;
    } catch (NoSuchMethodException e) {
      return null;
    }
  }

  private static Object invoke(Method m, Object row) {
    try {
      return m.invoke(row);
    } catch (InvocationTargetException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException re) throw re;
      throw new IllegalStateException("Accessor " + m + " failed", cause);
    } catch (IllegalAccessException e) {
      throw new IllegalStateException("Cannot call " + m, e);
    }
  }

  @FunctionalInterface
  private interface Accessor {
    Object get(Object row);
  }

  private record AccessorKey(Class<?> type, String property) {}
}
