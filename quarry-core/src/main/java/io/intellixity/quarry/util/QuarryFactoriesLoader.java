package io.intellixity.quarry.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URL;
import java.util.*;

/**
 * spring.factories-style loader for quarry SPIs.\n
 *
 * Looks up all {@code META-INF/quarry.factories} resources on the classpath.\n
 * Each resource is a Java Properties file of the form:\n
 *
 * <pre>
 * io.intellixity.quarry.connector.DatasourceConnector=com.acme.HiveConnector,com.acme.TrinoConnector
 * </pre>
 *
 * Values may be comma-separated. Whitespace is ignored. Implementations are instantiated through
 * their public no-arg constructor, in classpath order, once per class name.\n
 */
public final class QuarryFactoriesLoader {
  private static final Logger log = LoggerFactory.getLogger(QuarryFactoriesLoader.class);

  public static final String RESOURCE = "META-INF/quarry.factories";

  private QuarryFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    if (cl == null) cl = QuarryFactoriesLoader.class.getClassLoader();

    List<String> implNames = implementationNames(spiType.getName(), cl);
    List<T> out = new ArrayList<>(implNames.size());
    for (String implName : implNames) {
      out.add(newInstance(implName, spiType, cl));
    }
    log.debug("Loaded {} implementation(s) of {} from {}", out.size(), spiType.getName(), RESOURCE);
    return out;
  }

  static List<String> implementationNames(String key, ClassLoader cl) {
    Enumeration<URL> resources;
    try {
      resources = cl.getResources(RESOURCE);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to enumerate " + RESOURCE, e);
    }

    // De-dupe while preserving order
    LinkedHashSet<String> names = new LinkedHashSet<>();
    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      Properties p = new Properties();
      try (InputStream in = url.openStream()) {
        p.load(in);
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to load " + RESOURCE + " from " + url, e);
      }

      String v = p.getProperty(key);
      if (v == null || v.isBlank()) continue;
      for (String part : v.split(",")) {
        String name = part.trim();
        if (!name.isEmpty()) names.add(name);
      }
    }
    return List.copyOf(names);
  }

  /**
   * Instantiates {@code implName} through its no-arg constructor.
   *
   * @throws IllegalArgumentException if the class does not implement {@code spiType}
   * @throws IllegalStateException    if the class cannot be loaded or instantiated
   */
  public static <T> T newInstance(String implName, Class<T> spiType, ClassLoader cl) {
    Class<?> raw;
    try {
      raw = Class.forName(implName, true, cl);
    } catch (ClassNotFoundException | LinkageError e) {
      throw new IllegalStateException("Failed to load " + implName + " for SPI " + spiType.getName(), e);
    }
    if (!spiType.isAssignableFrom(raw)) {
      throw new IllegalArgumentException("Class " + implName + " does not implement " + spiType.getName());
    }
    try {
      return spiType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to instantiate " + implName + " for SPI " + spiType.getName(), e);
    }
  }
}
