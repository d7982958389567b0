package io.intellixity.quarry.examples.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "quarry")
public class QuarryProperties {
  private final Connectors connectors = new Connectors();

  public Connectors getConnectors() { return connectors; }

  public static class Connectors {
    /**
     * Package → connector class names, in registration order. Package keys contain dots and must
     * use bracket notation in YAML. Empty means classpath discovery.
     */
    private final Map<String, List<String>> sources = new LinkedHashMap<>();

    public Map<String, List<String>> getSources() { return sources; }
  }
}
