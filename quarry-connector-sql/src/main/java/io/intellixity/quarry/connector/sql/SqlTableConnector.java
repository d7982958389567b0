package io.intellixity.quarry.connector.sql;

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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Connector for tables of relational databases, registered as {@code table}. */
public final class SqlTableConnector implements DatasourceConnector<SqlTable> {
  private static final Logger log = LoggerFactory.getLogger(SqlTableConnector.class);

  public static final String TYPE = "table";

  public static final EntityRef<SqlTable> TABLES = EntityRef.of("tables", SqlTable.class);
  public static final EntityRef<Database> DATABASES = EntityRef.of("dbs", Database.class);
  public static final EntityRef<DatasourceColumn> COLUMNS = EntityRef.of("table_columns", DatasourceColumn.class);
  public static final EntityRef<DatasourceMetric> METRICS = EntityRef.of("sql_metrics", DatasourceMetric.class);

  private static final Relation<SqlTable, DatasourceColumn> COLUMNS_REL =
      Relation.of("columns", COLUMNS, "datasourceId", SqlTable::columns);
  private static final Relation<SqlTable, DatasourceMetric> METRICS_REL =
      Relation.of("metrics", METRICS, "datasourceId", SqlTable::metrics);

  public SqlTableConnector() {}

  @Override public String type() { return TYPE; }
  @Override public EntityRef<SqlTable> entity() { return TABLES; }
  @Override public Relation<SqlTable, DatasourceColumn> columns() { return COLUMNS_REL; }
  @Override public Relation<SqlTable, DatasourceMetric> metrics() { return METRICS_REL; }

  /** SQL Lab views are left out of listings. */
  @Override
  public Query defaultQuery(Query query) {
    return query.withAndFilter(QueryFilters.eq("sqlLabView", false));
  }

  @Override
  public Optional<SqlTable> getDatasourceByName(PersistenceSession session, String name, String schema,
                                                String databaseName) {
    Objects.requireNonNull(session, "session");
    Optional<Database> db = session.oneOrNone(DATABASES, Query.of(QueryFilters.eq(Database.NAME, databaseName)));
    if (db.isEmpty()) {
      log.debug("No database named '{}' for table lookup '{}'", databaseName, name);
      return Optional.empty();
    }
    // null schema only matches tables without one
    return session.oneOrNone(TABLES, Query.and(
        QueryFilters.eq(Datasource.DATABASE_ID, db.get().id()),
        QueryFilters.eq(Datasource.SCHEMA, schema),
        QueryFilters.eq(Datasource.NAME, name)
    ));
  }

  @Override
  public List<SqlTable> queryDatasourcesByName(PersistenceSession session, Database database, String name,
                                               String schema) {
    Objects.requireNonNull(session, "session");
    Objects.requireNonNull(database, "database");
    Query q = Query.and(
        QueryFilters.eq(Datasource.DATABASE_ID, database.id()),
        QueryFilters.eq(Datasource.NAME, name)
    );
    if (schema != null) q.withAndFilter(QueryFilters.eq(Datasource.SCHEMA, schema));
    return session.select(TABLES, q);
  }
}
