package io.intellixity.quarry.model;

import java.util.Objects;

/**
 * @param datasourceId id of the owning datasource
 * @param type         backend type name, may be null
 */
public record DatasourceColumn(long id, long datasourceId, String name, String type) {
  public DatasourceColumn {
    Objects.requireNonNull(name, "name");
  }
}
