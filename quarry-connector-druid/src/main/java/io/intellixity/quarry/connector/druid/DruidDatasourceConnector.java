package io.intellixity.quarry.connector.druid;

import io.intellixity.quarry.connector.DatasourceConnector;
import io.intellixity.quarry.exec.EntityRef;
import io.intellixity.quarry.exec.PersistenceSession;
import io.intellixity.quarry.exec.Relation;
import io.intellixity.quarry.model.Database;
import io.intellixity.quarry.model.Datasource;
import io.intellixity.quarry.model.DatasourceColumn;
import io.intellixity.quarry.model.DatasourceMetric;
import io.intellixity.quarry.query.Query;
import io.intellixity.quarry.query.QueryFilters;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Connector for Druid datasources, registered as {@code druid}.\n
 *
 * Name lookups match the cluster by name and ignore any schema argument.\n
 */
public final class DruidDatasourceConnector implements DatasourceConnector<DruidDatasource> {
  public static final String TYPE = "druid";

  public static final EntityRef<DruidDatasource> DATASOURCES = EntityRef.of("datasources", DruidDatasource.class);
  public static final EntityRef<DruidCluster> CLUSTERS = EntityRef.of("clusters", DruidCluster.class);
  public static final EntityRef<DatasourceColumn> COLUMNS = EntityRef.of("druid_columns", DatasourceColumn.class);
  public static final EntityRef<DatasourceMetric> METRICS = EntityRef.of("druid_metrics", DatasourceMetric.class);

  private static final Relation<DruidDatasource, DatasourceColumn> COLUMNS_REL =
      Relation.of("columns", COLUMNS, "datasourceId", DruidDatasource::columns);
  private static final Relation<DruidDatasource, DatasourceMetric> METRICS_REL =
      Relation.of("metrics", METRICS, "datasourceId", DruidDatasource::metrics);

  public DruidDatasourceConnector() {}

  @Override public String type() { return TYPE; }
  @Override public EntityRef<DruidDatasource> entity() { return DATASOURCES; }
  @Override public Relation<DruidDatasource, DatasourceColumn> columns() { return COLUMNS_REL; }
  @Override public Relation<DruidDatasource, DatasourceMetric> metrics() { return METRICS_REL; }

  @Override
  public Optional<DruidDatasource> getDatasourceByName(PersistenceSession session, String name, String schema,
                                                       String databaseName) {
    Objects.requireNonNull(session, "session");
    return session.oneOrNone(DATASOURCES, Query.and(
        QueryFilters.eq(Datasource.NAME, name),
        QueryFilters.eq(DruidDatasource.CLUSTER_NAME, databaseName)
    ));
  }

  @Override
  public List<DruidDatasource> queryDatasourcesByName(PersistenceSession session, Database database, String name,
                                                      String schema) {
    Objects.requireNonNull(session, "session");
    Objects.requireNonNull(database, "database");
    return session.select(DATASOURCES, Query.and(
        QueryFilters.eq(Datasource.DATABASE_ID, database.id()),
        QueryFilters.eq(Datasource.NAME, name)
    ));
  }

  /** Cluster registered under {@code clusterName}, as the database owning its datasources. */
  public Optional<Database> cluster(PersistenceSession session, String clusterName) {
    Objects.requireNonNull(session, "session");
    return session.oneOrNone(CLUSTERS, Query.of(QueryFilters.eq(DruidCluster.CLUSTER_NAME, clusterName)))
        .map(DruidCluster::asDatabase);
  }
}
