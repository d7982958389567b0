package io.intellixity.quarry.connector.sql;

import io.intellixity.quarry.memory.InMemorySession;
import io.intellixity.quarry.model.Database;
import io.intellixity.quarry.model.Datasource;
import io.intellixity.quarry.model.DatasourceColumn;
import io.intellixity.quarry.model.DatasourceMetric;
import io.intellixity.quarry.registry.ConnectorRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class SqlTableConnectorTest {
  private static final Database MAIN = new Database(1, "main", SqlTableConnector.TYPE);
  private static final Database OTHER = new Database(2, "other", SqlTableConnector.TYPE);

  private final SqlTableConnector connector = new SqlTableConnector();

  private static SqlTable table(long id, String name, long dbId, String schema) {
    return SqlTable.builder().id(id).name(name).databaseId(dbId).schema(schema)
        .perm("[" + dbId + "]." + name).schemaPerm(schema == null ? null : "[" + dbId + "]." + schema)
        .build();
  }

  private static InMemorySession session() {
    return new InMemorySession()
        .insertAll(SqlTableConnector.DATABASES, List.of(MAIN, OTHER))
        .insertAll(SqlTableConnector.TABLES, List.of(
            table(1, "orders", 1, "public"),
            table(2, "orders", 1, null),
            table(3, "orders", 1, "staging"),
            table(4, "orders", 2, "public"),
            SqlTable.builder().id(5).name("scratch").databaseId(1).sql("select 1").sqlLabView(true).build()
        ));
  }

  @Test
  void typeAndTables() {
    assertEquals("table", connector.type());
    assertEquals("tables", connector.entity().name());
    assertEquals("table_columns", connector.columns().target().name());
    assertEquals("sql_metrics", connector.metrics().target().name());
    assertEquals("table", table(1, "t", 1, null).type());
  }

  @Test
  void getDatasourceByName_resolvesDatabaseThenTable() {
    InMemorySession s = session();

    assertEquals(1L, connector.getDatasourceByName(s, "orders", "public", "main").map(Datasource::id).orElse(-1L));
    assertEquals(4L, connector.getDatasourceByName(s, "orders", "public", "other").map(Datasource::id).orElse(-1L));
    assertEquals(2L, connector.getDatasourceByName(s, "orders", null, "main").map(Datasource::id).orElse(-1L));
    assertEquals(Optional.empty(), connector.getDatasourceByName(s, "orders", "missing", "main"));
  }

  @Test
  void getDatasourceByName_unknownDatabaseIsEmpty() {
    InMemorySession s = session();
    long before = s.statementCount();
    assertEquals(Optional.empty(), connector.getDatasourceByName(s, "orders", "public", "nope"));
    assertEquals(1, s.statementCount() - before);
  }

  @Test
  void queryDatasourcesByName_schemaIsOptional() {
    InMemorySession s = session();
    assertEquals(3, connector.queryDatasourcesByName(s, MAIN, "orders", null).size());
    List<SqlTable> staging = connector.queryDatasourcesByName(s, MAIN, "orders", "staging");
    assertEquals(1, staging.size());
    assertEquals(3L, staging.get(0).id());
  }

  @Test
  void listing_hidesSqlLabViews() {
    ConnectorRegistry registry = ConnectorRegistry.builder().register(connector).build();
    List<Datasource> all = registry.getAllDatasources(session());

    assertEquals(List.of(1L, 2L, 3L, 4L), all.stream().map(Datasource::id).toList());
    // still reachable by id
    SqlTable view = (SqlTable) registry.getDatasource("table", 5, session());
    assertTrue(view.sqlLabView());
    assertTrue(view.isVirtual());
  }

  @Test
  void permissionsQuery_overTables() {
    ConnectorRegistry registry = ConnectorRegistry.builder().register(connector).build();
    List<Datasource> rows = registry.queryDatasourcesByPermissions(session(), MAIN,
        Set.of("[1].orders"), Set.of());
    assertEquals(List.of(1L, 2L, 3L), rows.stream().map(Datasource::id).toList());

    rows = registry.queryDatasourcesByPermissions(session(), MAIN, Set.of(), Set.of("[1].staging"));
    assertEquals(List.of(3L), rows.stream().map(Datasource::id).toList());
  }

  @Test
  void eagerFetch_attachesColumnsAndMetrics() {
    InMemorySession s = session()
        .insertAll(SqlTableConnector.COLUMNS, List.of(
            new DatasourceColumn(10, 1, "id", "BIGINT"),
            new DatasourceColumn(11, 1, "total", "NUMERIC"),
            new DatasourceColumn(12, 4, "id", "BIGINT")))
        .insert(SqlTableConnector.METRICS, new DatasourceMetric(20, 1, "count", "COUNT(*)"));
    ConnectorRegistry registry = ConnectorRegistry.builder().register(connector).build();

    long before = s.statementCount();
    Datasource t = registry.getEagerDatasource(s, "table", 1);

    assertEquals(1, s.statementCount() - before);
    assertEquals(List.of(10L, 11L), t.columns().stream().map(DatasourceColumn::id).toList());
    assertEquals(List.of("count"), t.metrics().stream().map(DatasourceMetric::name).toList());
  }
}
