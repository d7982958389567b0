package io.intellixity.quarry.connector.druid;

import io.intellixity.quarry.model.Database;

/** Druid cluster row; the cluster plays the part of the owning database. */
public record DruidCluster(long id, String clusterName, String brokerHost, int brokerPort) {
  public static final String CLUSTER_NAME = "clusterName";

  public Database asDatabase() {
    return new Database(id, clusterName, DruidDatasourceConnector.TYPE);
  }
}
