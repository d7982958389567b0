package io.intellixity.quarry.connector;

import io.intellixity.quarry.exec.EntityRef;
import io.intellixity.quarry.exec.PersistenceSession;
import io.intellixity.quarry.exec.Relation;
import io.intellixity.quarry.model.Database;
import io.intellixity.quarry.model.Datasource;
import io.intellixity.quarry.model.DatasourceColumn;
import io.intellixity.quarry.model.DatasourceMetric;
import io.intellixity.quarry.query.Query;

import java.util.List;
import java.util.Optional;

/**
 * Capability contract of one datasource backend kind.\n
 *
 * A connector is registered under {@link #type()} and must be stateless: the same instance serves
 * every caller. Implementations are discovered from {@code META-INF/quarry.factories} under this
 * interface's name, or listed explicitly in registration configuration; both paths need a public
 * no-arg constructor.\n
 */
public interface DatasourceConnector<D extends Datasource> {

  /** Constant type tag; also the registry key. */
  String type();

  /** Table holding this connector's datasource rows. */
  EntityRef<D> entity();

  /**
   * Default scoping applied when listing every datasource of this type. The returned query may be
   * the argument itself.
   */
  default Query defaultQuery(Query query) {
    return query;
  }

  Relation<D, DatasourceColumn> columns();

  Relation<D, DatasourceMetric> metrics();

  /** Relations loaded by an eager fetch. */
  default List<Relation<D, ?>> eagerRelations() {
    return List.of(columns(), metrics());
  }

  /**
   * Looks a datasource up by its name within the named database.
   *
   * @param schema        schema to match; its meaning is connector-specific
   * @param databaseName  name of the owning database
   * @return the match, or empty
   */
  Optional<D> getDatasourceByName(PersistenceSession session, String name, String schema, String databaseName);

  /**
   * Datasources named {@code name} in {@code database}.
   *
   * @param schema optional; null leaves the schema unconstrained
   */
  List<D> queryDatasourcesByName(PersistenceSession session, Database database, String name, String schema);
}
