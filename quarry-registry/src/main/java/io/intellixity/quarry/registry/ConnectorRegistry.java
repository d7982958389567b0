package io.intellixity.quarry.registry;

import io.intellixity.quarry.connector.DatasourceConnector;
import io.intellixity.quarry.exec.NonUniqueResultException;
import io.intellixity.quarry.exec.PersistenceSession;
import io.intellixity.quarry.model.Database;
import io.intellixity.quarry.model.Datasource;
import io.intellixity.quarry.query.Query;
import io.intellixity.quarry.query.QueryFilters;
import io.intellixity.quarry.util.QuarryFactoriesLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Central registry of datasource connectors, keyed by type tag.\n
 *
 * Instances are immutable snapshots built by {@link Builder}; iteration order is registration
 * order, and re-registering a type replaces its connector in place. Lookups take the caller's
 * {@link PersistenceSession} and never cache returned rows.\n
 *
 * Failures:\n
 * - unknown type tag: {@link UnknownDatasourceTypeException}\n
 * - no row, or more than one row for an id within one type: {@link DatasourceNotFoundException}\n
 * - anything thrown by the session propagates unchanged\n
 */
public final class ConnectorRegistry {
  private final Map<String, DatasourceConnector<?>> byType;
  private final List<DatasourceConnector<?>> ordered;

  private ConnectorRegistry(LinkedHashMap<String, DatasourceConnector<?>> connectors) {
    this.byType = Map.copyOf(connectors);
    this.ordered = List.copyOf(connectors.values());
  }

  public static Builder builder() {
    return new Builder();
  }

  public static ConnectorRegistry of(Collection<? extends DatasourceConnector<?>> connectors) {
    return builder().registerAll(connectors).build();
  }

  /** Registry of every connector listed in {@code META-INF/quarry.factories} on the classpath. */
  public static ConnectorRegistry discover() {
    return builder().registerDiscovered().build();
  }

  public Builder toBuilder() {
    return new Builder().registerAll(ordered);
  }

  // --- Registry contents ---

  public boolean isRegistered(String type) {
    return type != null && byType.containsKey(type);
  }

  /** Registered type tags in iteration order. */
  public List<String> types() {
    List<String> out = new ArrayList<>(ordered.size());
    for (DatasourceConnector<?> c : ordered) out.add(c.type());
    return out;
  }

  public List<DatasourceConnector<?>> connectors() {
    return ordered;
  }

  public int size() {
    return ordered.size();
  }

  /** @throws UnknownDatasourceTypeException if {@code type} is not registered */
  public DatasourceConnector<?> connector(String type) {
    DatasourceConnector<?> c = (type == null) ? null : byType.get(type);
    if (c == null) throw new UnknownDatasourceTypeException(type);
    return c;
  }

  // --- Lookups ---

  /**
   * Datasource of the given type and id.
   *
   * @throws UnknownDatasourceTypeException if {@code type} is not registered
   * @throws DatasourceNotFoundException    if no row, or more than one row, has that id
   */
  public Datasource getDatasource(String type, long id, PersistenceSession session) {
    Objects.requireNonNull(session, "session");
    return findOne(connector(type), id, session, false);
  }

  /** Every datasource of every registered type, each type narrowed by its default query. */
  public List<Datasource> getAllDatasources(PersistenceSession session) {
    Objects.requireNonNull(session, "session");
    List<Datasource> out = new ArrayList<>();
    for (DatasourceConnector<?> c : ordered) {
      out.addAll(selectDefault(c, session));
    }
    return out;
  }

  /**
   * Datasource with the given id in the first registered type that has one. Types are probed one
   * after another in registry order.
   *
   * @throws DatasourceNotFoundException if no registered type has a row with that id
   * @throws NonUniqueResultException    if the first type with a match has several rows with that id
   */
  public Datasource getDatasourceById(PersistenceSession session, long id) {
    Objects.requireNonNull(session, "session");
    for (DatasourceConnector<?> c : ordered) {
      Optional<? extends Datasource> found = session.oneOrNone(c.entity(), byId(id));
      if (found.isPresent()) return found.get();
    }
    throw DatasourceNotFoundException.forId(id);
  }

  /**
   * Delegates to the connector's own name lookup.
   *
   * @return the match, or empty when the connector finds none
   * @throws UnknownDatasourceTypeException if {@code type} is not registered
   */
  public Optional<Datasource> getDatasourceByName(PersistenceSession session,
                                                  String type,
                                                  String name,
                                                  String schema,
                                                  String databaseName) {
    Objects.requireNonNull(session, "session");
    DatasourceConnector<?> c = connector(type);
    return c.getDatasourceByName(session, name, schema, databaseName).map(Datasource.class::cast);
  }

  /**
   * Datasources of {@code database} that are readable through one of the accepted permissions:
   * {@code databaseId} matches AND ({@code perm} in {@code permissions} OR {@code schemaPerm} in
   * {@code schemaPerms}).
   *
   * @throws UnknownDatasourceTypeException if the database's type is not registered
   */
  public List<Datasource> queryDatasourcesByPermissions(PersistenceSession session,
                                                        Database database,
                                                        Set<String> permissions,
                                                        Set<String> schemaPerms) {
    Objects.requireNonNull(session, "session");
    Objects.requireNonNull(database, "database");
    DatasourceConnector<?> c = connector(database.type());
    Query q = Query.and(
        QueryFilters.eq(Datasource.DATABASE_ID, database.id()),
        QueryFilters.or(
            QueryFilters.in(Datasource.PERM, permissions == null ? Set.of() : permissions),
            QueryFilters.in(Datasource.SCHEMA_PERM, schemaPerms == null ? Set.of() : schemaPerms)
        )
    );
    return List.copyOf(session.select(c.entity(), q));
  }

  /**
   * {@link #getDatasource} with columns and metrics loaded by the same session call.
   *
   * @throws UnknownDatasourceTypeException if {@code type} is not registered
   * @throws DatasourceNotFoundException    if no row, or more than one row, has that id
   */
  public Datasource getEagerDatasource(PersistenceSession session, String type, long id) {
    Objects.requireNonNull(session, "session");
    return findOne(connector(type), id, session, true);
  }

  public List<Datasource> queryDatasourcesByName(PersistenceSession session, Database database, String name) {
    return queryDatasourcesByName(session, database, name, null);
  }

  /**
   * Delegates to the connector of {@code database}'s type.
   *
   * @param schema optional; null leaves the schema to the connector
   * @throws UnknownDatasourceTypeException if the database's type is not registered
   */
  public List<Datasource> queryDatasourcesByName(PersistenceSession session,
                                                 Database database,
                                                 String name,
                                                 String schema) {
    Objects.requireNonNull(session, "session");
    Objects.requireNonNull(database, "database");
    DatasourceConnector<?> c = connector(database.type());
    return List.copyOf(c.queryDatasourcesByName(session, database, name, schema));
  }

  private static <D extends Datasource> Datasource findOne(DatasourceConnector<D> c,
                                                           long id,
                                                           PersistenceSession session,
                                                           boolean eager) {
    Optional<D> found;
    try {
      found = eager
          ? session.oneOrNone(c.entity(), byId(id), c.eagerRelations())
          : session.oneOrNone(c.entity(), byId(id));
    } catch (NonUniqueResultException e) {
      throw DatasourceNotFoundException.of(c.type(), id, e);
    }
    return found.orElseThrow(() -> DatasourceNotFoundException.of(c.type(), id));
  }

  private static <D extends Datasource> List<D> selectDefault(DatasourceConnector<D> c, PersistenceSession session) {
    Query q = c.defaultQuery(Query.all());
    return session.select(c.entity(), q == null ? Query.all() : q);
  }

  private static Query byId(long id) {
    return Query.of(QueryFilters.eq(Datasource.ID, id));
  }

  @Override
  public String toString() {
    return "ConnectorRegistry" + types();
  }

  /**
   * Collects connectors before the registry is published. Not thread-safe; build once at startup
   * and share the resulting {@link ConnectorRegistry}.
   */
  public static final class Builder {
    private static final Logger log = LoggerFactory.getLogger(ConnectorRegistry.class);

    private final LinkedHashMap<String, DatasourceConnector<?>> connectors = new LinkedHashMap<>();

    private Builder() {}

    /** Adds {@code connector} under its type tag, replacing any connector already there. */
    public Builder register(DatasourceConnector<?> connector) {
      Objects.requireNonNull(connector, "connector");
      String type = connector.type();
      if (type == null || type.isBlank()) {
        throw new IllegalArgumentException("Connector " + connector.getClass().getName() + " has no type");
      }
      DatasourceConnector<?> previous = connectors.put(type, connector);
      if (previous != null && previous != connector) {
        log.debug("Replaced datasource connector type={} {} -> {}", type,
            previous.getClass().getName(), connector.getClass().getName());
      } else {
        log.debug("Registered datasource connector type={} class={}", type, connector.getClass().getName());
      }
      return this;
    }

    public Builder registerAll(Collection<? extends DatasourceConnector<?>> connectors) {
      Objects.requireNonNull(connectors, "connectors");
      for (DatasourceConnector<?> c : connectors) register(c);
      return this;
    }

    /** Registers every connector named in {@code config}, resolved by class name. */
    public Builder registerSources(RegistrationConfig config) {
      return registerSources(config, new ClassNameConnectorLocator());
    }

    public Builder registerSources(Map<String, List<String>> config) {
      return registerSources(RegistrationConfig.of(config));
    }

    /** Registers every connector named in {@code config}, in configuration order. */
    public Builder registerSources(RegistrationConfig config, ConnectorLocator locator) {
      Objects.requireNonNull(config, "config");
      Objects.requireNonNull(locator, "locator");
      for (Map.Entry<String, List<String>> e : config.sources().entrySet()) {
        for (String name : e.getValue()) {
          DatasourceConnector<?> c = locator.locate(e.getKey(), name);
          if (c == null) {
            throw new IllegalStateException("Locator returned null for " + e.getKey() + ":" + name);
          }
          register(c);
        }
      }
      return this;
    }

    /** Registers the connectors listed in {@code META-INF/quarry.factories}. */
    public Builder registerDiscovered() {
      @SuppressWarnings("rawtypes")
      List<DatasourceConnector> found = QuarryFactoriesLoader.load(DatasourceConnector.class);
      for (DatasourceConnector<?> c : found) register(c);
      return this;
    }

    public Builder remove(String type) {
      if (connectors.remove(type) != null) log.debug("Removed datasource connector type={}", type);
      return this;
    }

    public ConnectorRegistry build() {
      return new ConnectorRegistry(connectors);
    }
  }
}
