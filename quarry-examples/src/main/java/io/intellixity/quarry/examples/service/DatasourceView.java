package io.intellixity.quarry.examples.service;

import io.intellixity.quarry.model.Datasource;
import io.intellixity.quarry.model.DatasourceColumn;
import io.intellixity.quarry.model.DatasourceMetric;

import java.util.List;

/** JSON shape of a datasource. */
public record DatasourceView(String type,
                             long id,
                             String name,
                             long databaseId,
                             String schema,
                             String perm,
                             List<String> columns,
                             List<String> metrics) {

  public static DatasourceView of(Datasource d) {
    return new DatasourceView(d.type(), d.id(), d.name(), d.databaseId(), d.schema(), d.perm(),
        d.columns().stream().map(DatasourceColumn::name).toList(),
        d.metrics().stream().map(DatasourceMetric::name).toList());
  }
}
