package io.intellixity.quarry.registry;

import io.intellixity.quarry.connector.DatasourceConnector;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ClassNameConnectorLocatorTest {
  private final ClassNameConnectorLocator locator = new ClassNameConnectorLocator();

  @Test
  void joinsModuleAndSimpleName() {
    DatasourceConnector<?> c = locator.locate("io.intellixity.quarry.registry", "XConnector");
    assertTrue(c instanceof XConnector);
  }

  @Test
  void qualifiedNameIgnoresModule() {
    DatasourceConnector<?> c = locator.locate("ignored.module", "io.intellixity.quarry.registry.YConnector");
    assertEquals("y", c.type());
  }

  @Test
  void failures() {
    assertThrows(IllegalArgumentException.class, () -> locator.locate("m", "  "));
    assertThrows(IllegalStateException.class, () -> locator.locate("io.intellixity.quarry.registry", "Missing"));
    // not a connector
    assertThrows(IllegalArgumentException.class,
        () -> locator.locate("io.intellixity.quarry.registry", "FakeDatasource"));
  }
}
