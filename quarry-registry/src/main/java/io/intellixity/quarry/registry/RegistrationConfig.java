package io.intellixity.quarry.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Ordered registration configuration: module → connector names.\n
 *
 * File form (JSON or YAML):\n
 *
 * <pre>
 * sources:
 *   io.intellixity.quarry.connector.sql: [SqlTableConnector]
 *   io.intellixity.quarry.connector.druid: [DruidDatasourceConnector]
 * </pre>
 *
 * A module may also map to a single name instead of a list. Module order and name order are kept;
 * they decide registry iteration order.\n
 */
public record RegistrationConfig(Map<String, List<String>> sources) {
  private static final ObjectMapper JSON = new ObjectMapper();
  private static final ObjectMapper YAML = new YAMLMapper();

  public enum Format { JSON, YAML }

  public RegistrationConfig {
    Map<String, List<String>> copy = new LinkedHashMap<>();
    if (sources != null) {
      for (Map.Entry<String, List<String>> e : sources.entrySet()) {
        String module = Objects.requireNonNull(e.getKey(), "module").trim();
        if (module.isEmpty()) throw new IllegalArgumentException("Blank module in registration config");
        copy.put(module, List.copyOf(e.getValue() == null ? List.of() : e.getValue()));
      }
    }
    sources = Collections.unmodifiableMap(copy);
  }

  public static RegistrationConfig of(Map<String, List<String>> sources) {
    return new RegistrationConfig(sources);
  }

  public static RegistrationConfig read(InputStream in, Format format) throws IOException {
    Objects.requireNonNull(in, "in");
    Objects.requireNonNull(format, "format");
    JsonNode root = (format == Format.YAML ? YAML : JSON).readTree(in);
    return fromTree(root);
  }

  /** Reads a {@code .json}, {@code .yaml} or {@code .yml} file. */
  public static RegistrationConfig load(Path path) {
    Objects.requireNonNull(path, "path");
    String file = path.getFileName().toString().toLowerCase(Locale.ROOT);
    Format format;
    if (file.endsWith(".json")) format = Format.JSON;
    else if (file.endsWith(".yaml") || file.endsWith(".yml")) format = Format.YAML;
    else throw new IllegalArgumentException("Unsupported registration config file: " + path);

    try (InputStream in = Files.newInputStream(path)) {
      return read(in, format);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read registration config " + path, e);
    }
  }

  private static RegistrationConfig fromTree(JsonNode root) {
    if (root == null || root.isMissingNode() || root.isNull()) return new RegistrationConfig(Map.of());
    if (!root.isObject()) throw new IllegalArgumentException("Registration config must be an object");

    JsonNode sources = root.get("sources");
    if (sources == null || sources.isNull()) return new RegistrationConfig(Map.of());
    if (!sources.isObject()) throw new IllegalArgumentException("'sources' must map module -> connector names");

    Map<String, List<String>> out = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> it = sources.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      out.put(e.getKey(), names(e.getKey(), e.getValue()));
    }
    return new RegistrationConfig(out);
  }

  private static List<String> names(String module, JsonNode node) {
    if (node == null || node.isNull()) return List.of();
    if (node.isTextual()) return List.of(node.asText());
    if (!node.isArray()) {
      throw new IllegalArgumentException("Connector names for module '" + module + "' must be a string or list");
    }
    List<String> out = new ArrayList<>(node.size());
    for (JsonNode n : node) {
      if (!n.isTextual()) {
        throw new IllegalArgumentException("Connector name in module '" + module + "' is not a string: " + n);
      }
      out.add(n.asText());
    }
    return out;
  }
}
