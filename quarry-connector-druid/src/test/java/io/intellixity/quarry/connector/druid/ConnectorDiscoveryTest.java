package io.intellixity.quarry.connector.druid;

import io.intellixity.quarry.connector.sql.SqlTable;
import io.intellixity.quarry.connector.sql.SqlTableConnector;
import io.intellixity.quarry.memory.InMemorySession;
import io.intellixity.quarry.model.Database;
import io.intellixity.quarry.model.Datasource;
import io.intellixity.quarry.registry.ConnectorRegistry;
import io.intellixity.quarry.registry.DatasourceNotFoundException;
import io.intellixity.quarry.registry.RegistrationConfig;
import io.intellixity.quarry.registry.UnknownDatasourceTypeException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/** Both shipped connectors side by side in one registry. */
final class ConnectorDiscoveryTest {

  private static InMemorySession session() {
    return new InMemorySession()
        .insert(SqlTableConnector.TABLES,
            SqlTable.builder().id(1).name("orders").databaseId(1).schema("public").perm("p:orders").build())
        .insert(SqlTableConnector.TABLES,
            SqlTable.builder().id(2).name("customers").databaseId(1).schema("public").perm("p:customers").build())
        .insert(DruidDatasourceConnector.DATASOURCES, new DruidDatasource(2, "clicks", 5, "analytics", "p:clicks"))
        .insert(DruidDatasourceConnector.DATASOURCES, new DruidDatasource(3, "views", 5, "analytics", "p:views"));
  }

  @Test
  void discover_findsBothConnectors() {
    ConnectorRegistry registry = ConnectorRegistry.discover();
    assertTrue(registry.connector("table") instanceof SqlTableConnector);
    assertTrue(registry.connector("druid") instanceof DruidDatasourceConnector);
  }

  @Test
  void yamlConfig_decidesProbeOrder() throws IOException {
    RegistrationConfig config = RegistrationConfig.read(new ByteArrayInputStream("""
        sources:
          io.intellixity.quarry.connector.druid: [DruidDatasourceConnector]
          io.intellixity.quarry.connector.sql: [SqlTableConnector]
        """.getBytes(StandardCharsets.UTF_8)), RegistrationConfig.Format.YAML);
    ConnectorRegistry registry = ConnectorRegistry.builder().registerSources(config).build();
    InMemorySession s = session();

    assertEquals(List.of("druid", "table"), registry.types());
    assertEquals("clicks", registry.getDatasourceById(s, 2).name());
    assertEquals("orders", registry.getDatasourceById(s, 1).name());
    assertEquals(List.of("clicks", "views", "orders", "customers"),
        registry.getAllDatasources(s).stream().map(Datasource::name).toList());
  }

  @Test
  void typedLookupsStayWithinTheirType() {
    ConnectorRegistry registry = ConnectorRegistry.builder()
        .register(new SqlTableConnector())
        .register(new DruidDatasourceConnector())
        .build();
    InMemorySession s = session();

    assertEquals("customers", registry.getDatasource("table", 2, s).name());
    assertEquals("clicks", registry.getDatasource("druid", 2, s).name());
    assertThrows(DatasourceNotFoundException.class, () -> registry.getDatasource("table", 3, s));
    assertThrows(UnknownDatasourceTypeException.class, () -> registry.getDatasource("hive", 1, s));

    Database analytics = new Database(5, "analytics", "druid");
    assertEquals(List.of("views"), registry.queryDatasourcesByPermissions(s, analytics, Set.of("p:views"), Set.of())
        .stream().map(Datasource::name).toList());
    assertEquals(2L, registry.getDatasourceByName(s, "druid", "clicks", null, "analytics")
        .map(Datasource::id).orElse(-1L));
    assertTrue(registry.getDatasourceByName(s, "table", "clicks", null, "analytics").isEmpty());
  }
}
