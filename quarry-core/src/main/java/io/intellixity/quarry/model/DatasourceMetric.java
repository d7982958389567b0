package io.intellixity.quarry.model;

import java.util.Objects;

/**
 * @param datasourceId id of the owning datasource
 * @param expression   backend expression computing the metric
 */
public record DatasourceMetric(long id, long datasourceId, String name, String expression) {
  public DatasourceMetric {
    Objects.requireNonNull(name, "name");
  }
}
