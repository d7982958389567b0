package io.intellixity.quarry.registry;

import io.intellixity.quarry.connector.DatasourceConnector;

/**
 * Resolves one entry of registration configuration to a connector instance.
 *
 * @see ClassNameConnectorLocator
 */
@FunctionalInterface
public interface ConnectorLocator {
  /**
   * @param module        locator key of the configuration entry (for example a Java package)
   * @param connectorName one of the names listed under {@code module}
   */
  DatasourceConnector<?> locate(String module, String connectorName);
}
