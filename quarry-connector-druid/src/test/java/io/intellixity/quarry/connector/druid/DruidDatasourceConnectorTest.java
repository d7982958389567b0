package io.intellixity.quarry.connector.druid;

import io.intellixity.quarry.exec.NonUniqueResultException;
import io.intellixity.quarry.memory.InMemorySession;
import io.intellixity.quarry.model.Database;
import io.intellixity.quarry.model.Datasource;
import io.intellixity.quarry.model.DatasourceColumn;
import io.intellixity.quarry.model.DatasourceMetric;
import io.intellixity.quarry.registry.ConnectorRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class DruidDatasourceConnectorTest {
  private final DruidDatasourceConnector connector = new DruidDatasourceConnector();

  private static InMemorySession session() {
    return new InMemorySession()
        .insertAll(DruidDatasourceConnector.CLUSTERS, List.of(
            new DruidCluster(1, "analytics", "broker-a", 8082),
            new DruidCluster(2, "ops", "broker-b", 8082)))
        .insertAll(DruidDatasourceConnector.DATASOURCES, List.of(
            new DruidDatasource(1, "wikipedia", 1, "analytics", "[analytics].[wikipedia]"),
            new DruidDatasource(2, "clicks", 1, "analytics", "[analytics].[clicks]"),
            new DruidDatasource(3, "wikipedia", 2, "ops", "[ops].[wikipedia]")));
  }

  @Test
  void typeAndTables() {
    assertEquals("druid", connector.type());
    assertEquals("datasources", connector.entity().name());
    assertEquals("druid_columns", connector.columns().target().name());
    assertEquals("druid_metrics", connector.metrics().target().name());
  }

  @Test
  void druidDatasourceHasNoSchema() {
    DruidDatasource d = new DruidDatasource(1, "w", 1, "c", null);
    assertNull(d.schema());
    assertNull(d.schemaPerm());
    assertEquals("druid", d.type());
  }

  @Test
  void getDatasourceByName_matchesClusterAndIgnoresSchema() {
    InMemorySession s = session();
    assertEquals(3L, connector.getDatasourceByName(s, "wikipedia", null, "ops").map(Datasource::id).orElse(-1L));
    assertEquals(1L, connector.getDatasourceByName(s, "wikipedia", "whatever", "analytics")
        .map(Datasource::id).orElse(-1L));
    assertEquals(Optional.empty(), connector.getDatasourceByName(s, "clicks", null, "ops"));
  }

  @Test
  void getDatasourceByName_duplicateIsAnError() {
    InMemorySession s = session()
        .insert(DruidDatasourceConnector.DATASOURCES, new DruidDatasource(9, "clicks", 1, "analytics", null));
    assertThrows(NonUniqueResultException.class, () -> connector.getDatasourceByName(s, "clicks", null, "analytics"));
  }

  @Test
  void queryDatasourcesByName_ignoresSchema() {
    Database analytics = new Database(1, "analytics", "druid");
    List<DruidDatasource> rows = connector.queryDatasourcesByName(session(), analytics, "wikipedia", "public");
    assertEquals(1, rows.size());
    assertEquals("analytics", rows.get(0).clusterName());
  }

  @Test
  void cluster_resolvesAsDatabase() {
    Database ops = connector.cluster(session(), "ops").orElseThrow();
    assertEquals(new Database(2, "ops", "druid"), ops);
    assertTrue(connector.cluster(session(), "missing").isEmpty());
  }

  @Test
  void listing_isUnscoped_andEagerFetchUsesDruidTables() {
    InMemorySession s = session()
        .insert(DruidDatasourceConnector.COLUMNS, new DatasourceColumn(1, 2, "__time", "LONG"))
        .insert(DruidDatasourceConnector.METRICS, new DatasourceMetric(1, 2, "count", "{\"type\": \"count\"}"));
    ConnectorRegistry registry = ConnectorRegistry.builder().register(connector).build();

    assertEquals(3, registry.getAllDatasources(s).size());
    Datasource clicks = registry.getEagerDatasource(s, "druid", 2);
    assertEquals(List.of("__time"), clicks.columns().stream().map(DatasourceColumn::name).toList());
    assertEquals(1, clicks.metrics().size());
  }
}
