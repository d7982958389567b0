package io.intellixity.quarry.model;

import java.util.List;
import java.util.Objects;

/** Shared state of the shipped datasource row types. */
public abstract class AbstractDatasource implements Datasource {
  private final long id;
  private final String name;
  private final long databaseId;
  private final String schema;
  private final String perm;
  private final String schemaPerm;

  private volatile List<DatasourceColumn> columns = List.of();
  private volatile List<DatasourceMetric> metrics = List.of();

  protected AbstractDatasource(long id, String name, long databaseId, String schema, String perm, String schemaPerm) {
    this.id = id;
    this.name = Objects.requireNonNull(name, "name");
    this.databaseId = databaseId;
    this.schema = schema;
    this.perm = perm;
    this.schemaPerm = schemaPerm;
  }

  @Override public long id() { return id; }
  @Override public String name() { return name; }
  @Override public long databaseId() { return databaseId; }
  @Override public String schema() { return schema; }
  @Override public String perm() { return perm; }
  @Override public String schemaPerm() { return schemaPerm; }
  @Override public List<DatasourceColumn> columns() { return columns; }
  @Override public List<DatasourceMetric> metrics() { return metrics; }

  public void columns(List<DatasourceColumn> columns) {
    this.columns = List.copyOf(columns == null ? List.of() : columns);
  }

  public void metrics(List<DatasourceMetric> metrics) {
    this.metrics = List.copyOf(metrics == null ? List.of() : metrics);
  }

  @Override
  public String toString() {
    return type() + "[" + id + ":" + (schema == null ? "" : schema + ".") + name + "]";
  }
}
