package io.intellixity.quarry.examples.config;

import io.intellixity.quarry.memory.InMemorySession;
import io.intellixity.quarry.registry.ConnectorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Map;

@Configuration
@EnableConfigurationProperties(QuarryProperties.class)
public class QuarryExampleConfig {
  private static final Logger log = LoggerFactory.getLogger(QuarryExampleConfig.class);

  @Bean
  public ConnectorRegistry connectorRegistry(QuarryProperties props) {
    Map<String, List<String>> sources = props.getConnectors().getSources();
    ConnectorRegistry registry = sources.isEmpty()
        ? ConnectorRegistry.discover()
        : ConnectorRegistry.builder().registerSources(sources).build();
    log.info("Datasource connectors: {}", registry.types());
    return registry;
  }

  @Bean
  public InMemorySession persistenceSession() {
    // Stands in for the metadata database.
    return DemoData.seed(new InMemorySession());
  }
}
