package io.intellixity.quarry.model;

import java.util.List;

/**
 * A datasource row produced by a session for one connector type.\n
 *
 * The property-name constants are the paths filters use; every row type must expose them as
 * accessors.\n
 */
public interface Datasource {
  String ID = "id";
  String NAME = "name";
  String DATABASE_ID = "databaseId";
  String SCHEMA = "schema";
  String PERM = "perm";
  String SCHEMA_PERM = "schemaPerm";

  /** Type tag of the connector that owns this row. */
  String type();

  long id();

  String name();

  long databaseId();

  /** Schema within the owning database, or null. */
  String schema();

  String perm();

  String schemaPerm();

  /** Columns; empty unless loaded (see {@code ConnectorRegistry#getEagerDatasource}). */
  List<DatasourceColumn> columns();

  /** Metrics; empty unless loaded. */
  List<DatasourceMetric> metrics();
}
