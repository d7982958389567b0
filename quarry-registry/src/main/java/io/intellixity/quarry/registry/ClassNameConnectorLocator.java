package io.intellixity.quarry.registry;

import io.intellixity.quarry.connector.DatasourceConnector;
import io.intellixity.quarry.util.QuarryFactoriesLoader;

import java.util.Objects;

/**
 * Treats the module as a Java package and the connector name as a simple class name, then
 * instantiates {@code module + "." + name} through its public no-arg constructor. A name that
 * already contains a dot is used as a fully-qualified class name.
 */
public final class ClassNameConnectorLocator implements ConnectorLocator {
  private final ClassLoader classLoader;

  public ClassNameConnectorLocator() {
    this(Thread.currentThread().getContextClassLoader());
  }

  public ClassNameConnectorLocator(ClassLoader classLoader) {
    this.classLoader = (classLoader == null) ? ClassNameConnectorLocator.class.getClassLoader() : classLoader;
  }

  @Override
  public DatasourceConnector<?> locate(String module, String connectorName) {
    Objects.requireNonNull(connectorName, "connectorName");
    String name = connectorName.trim();
    if (name.isEmpty()) throw new IllegalArgumentException("Blank connector name in module " + module);

    String className;
    if (name.contains(".") || module == null || module.isBlank()) className = name;
    else className = module.trim() + "." + name;
    return QuarryFactoriesLoader.newInstance(className, DatasourceConnector.class, classLoader);
  }
}
