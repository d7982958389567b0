package io.intellixity.quarry.connector.druid;

import io.intellixity.quarry.model.AbstractDatasource;

import java.util.Objects;

/** Druid datasource. Belongs to a cluster; Druid has no schemas. */
public final class DruidDatasource extends AbstractDatasource {
  public static final String CLUSTER_NAME = "clusterName";

  private final String clusterName;

  public DruidDatasource(long id, String name, long databaseId, String clusterName, String perm) {
    super(id, name, databaseId, null, perm, null);
    this.clusterName = Objects.requireNonNull(clusterName, "clusterName");
  }

  @Override public String type() { return DruidDatasourceConnector.TYPE; }
  public String clusterName() { return clusterName; }
}
