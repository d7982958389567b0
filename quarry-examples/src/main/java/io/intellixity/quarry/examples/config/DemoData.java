package io.intellixity.quarry.examples.config;

import io.intellixity.quarry.connector.druid.DruidCluster;
import io.intellixity.quarry.connector.druid.DruidDatasource;
import io.intellixity.quarry.connector.druid.DruidDatasourceConnector;
import io.intellixity.quarry.connector.sql.SqlTable;
import io.intellixity.quarry.connector.sql.SqlTableConnector;
import io.intellixity.quarry.memory.InMemorySession;
import io.intellixity.quarry.model.Database;
import io.intellixity.quarry.model.DatasourceColumn;
import io.intellixity.quarry.model.DatasourceMetric;

import java.util.List;

/** Sample metadata: one warehouse database with three tables, one Druid cluster with two datasources. */
public final class DemoData {
  private DemoData() {}

  public static InMemorySession seed(InMemorySession s) {
    s.insert(SqlTableConnector.DATABASES, new Database(1, "warehouse", SqlTableConnector.TYPE));
    s.insertAll(SqlTableConnector.TABLES, List.of(
        table(1, "orders", "public"),
        table(2, "customers", "public"),
        table(3, "orders", "staging"),
        SqlTable.builder().id(4).name("adhoc_revenue").databaseId(1).schema("public")
            .perm("[warehouse].[adhoc_revenue]").sql("SELECT sum(total) FROM orders").sqlLabView(true).build()
    ));
    s.insertAll(SqlTableConnector.COLUMNS, List.of(
        new DatasourceColumn(1, 1, "id", "BIGINT"),
        new DatasourceColumn(2, 1, "customer_id", "BIGINT"),
        new DatasourceColumn(3, 1, "total", "NUMERIC"),
        new DatasourceColumn(4, 2, "id", "BIGINT"),
        new DatasourceColumn(5, 2, "email", "VARCHAR")
    ));
    s.insert(SqlTableConnector.METRICS, new DatasourceMetric(1, 1, "revenue", "SUM(total)"));

    s.insert(DruidDatasourceConnector.CLUSTERS, new DruidCluster(10, "analytics", "druid-broker", 8082));
    s.insertAll(DruidDatasourceConnector.DATASOURCES, List.of(
        new DruidDatasource(1, "clicks", 10, "analytics", "[analytics].[clicks]"),
        new DruidDatasource(5, "page_views", 10, "analytics", "[analytics].[page_views]")
    ));
    s.insertAll(DruidDatasourceConnector.COLUMNS, List.of(
        new DatasourceColumn(1, 1, "__time", "LONG"),
        new DatasourceColumn(2, 1, "country", "STRING")
    ));
    s.insert(DruidDatasourceConnector.METRICS, new DatasourceMetric(1, 1, "count", "{\"type\": \"count\"}"));
    return s;
  }

  private static SqlTable table(long id, String name, String schema) {
    return SqlTable.builder().id(id).name(name).databaseId(1).schema(schema)
        .perm("[warehouse].[" + name + "]").schemaPerm("[warehouse].[" + schema + "]").build();
  }
}
