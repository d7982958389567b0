package io.intellixity.quarry.examples.service;

import io.intellixity.quarry.exec.PersistenceSession;
import io.intellixity.quarry.registry.ConnectorRegistry;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public final class DatasourceService {
  private final ConnectorRegistry registry;
  private final PersistenceSession session;

  public DatasourceService(ConnectorRegistry registry, PersistenceSession session) {
    this.registry = registry;
    this.session = session;
  }

  public List<DatasourceView> all() {
    return registry.getAllDatasources(session).stream().map(DatasourceView::of).toList();
  }

  public DatasourceView get(String type, long id) {
    return DatasourceView.of(registry.getDatasource(type, id, session));
  }

  public DatasourceView eager(String type, long id) {
    return DatasourceView.of(registry.getEagerDatasource(session, type, id));
  }

  public DatasourceView byId(long id) {
    return DatasourceView.of(registry.getDatasourceById(session, id));
  }

  public Optional<DatasourceView> byName(String type, String name, String schema, String database) {
    return registry.getDatasourceByName(session, type, name, schema, database).map(DatasourceView::of);
  }
}
