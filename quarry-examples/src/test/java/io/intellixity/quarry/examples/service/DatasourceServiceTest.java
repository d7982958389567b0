package io.intellixity.quarry.examples.service;

import io.intellixity.quarry.examples.config.DemoData;
import io.intellixity.quarry.memory.InMemorySession;
import io.intellixity.quarry.registry.ConnectorRegistry;
import io.intellixity.quarry.registry.DatasourceNotFoundException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class DatasourceServiceTest {

  private static DatasourceService service() {
    Map<String, List<String>> sources = new LinkedHashMap<>();
    sources.put("io.intellixity.quarry.connector.sql", List.of("SqlTableConnector"));
    sources.put("io.intellixity.quarry.connector.druid", List.of("DruidDatasourceConnector"));
    ConnectorRegistry registry = ConnectorRegistry.builder().registerSources(sources).build();
    return new DatasourceService(registry, DemoData.seed(new InMemorySession()));
  }

  @Test
  void all_listsTablesThenDruid_withoutSqlLabViews() {
    List<String> names = service().all().stream().map(v -> v.type() + ":" + v.name()).toList();
    assertEquals(List.of("table:orders", "table:customers", "table:orders", "druid:clicks", "druid:page_views"), names);
  }

  @Test
  void byId_prefersFirstRegisteredType() {
    DatasourceService s = service();
    assertEquals("table", s.byId(1).type());
    assertEquals("druid", s.byId(5).type());
    assertThrows(DatasourceNotFoundException.class, () -> s.byId(404));
  }

  @Test
  void eager_includesColumnsAndMetrics() {
    DatasourceView v = service().eager("table", 1);
    assertEquals(List.of("id", "customer_id", "total"), v.columns());
    assertEquals(List.of("revenue"), v.metrics());
    assertTrue(service().get("table", 1).columns().isEmpty());
  }

  @Test
  void byName_perConnector() {
    DatasourceService s = service();
    assertEquals(3L, s.byName("table", "orders", "staging", "warehouse").map(DatasourceView::id).orElse(-1L));
    assertEquals(5L, s.byName("druid", "page_views", null, "analytics").map(DatasourceView::id).orElse(-1L));
    assertTrue(s.byName("table", "orders", "staging", "lake").isEmpty());
  }
}
