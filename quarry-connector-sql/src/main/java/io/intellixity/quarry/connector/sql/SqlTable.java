package io.intellixity.quarry.connector.sql;

import io.intellixity.quarry.model.AbstractDatasource;

/**
 * Physical table (or SQL Lab view) inside a relational database.\n
 *
 * {@code sql} is set for virtual datasets only; {@code sqlLabView} marks views saved from SQL Lab,
 * which are hidden from the default listing.\n
 */
public final class SqlTable extends AbstractDatasource {
  private final String sql;
  private final boolean sqlLabView;

  public SqlTable(long id, String name, long databaseId, String schema, String perm, String schemaPerm,
                  String sql, boolean sqlLabView) {
    super(id, name, databaseId, schema, perm, schemaPerm);
    this.sql = sql;
    this.sqlLabView = sqlLabView;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override public String type() { return SqlTableConnector.TYPE; }
  public String sql() { return sql; }
  public boolean sqlLabView() { return sqlLabView; }
  public boolean isVirtual() { return sql != null && !sql.isBlank(); }

  public static final class Builder {
    private long id;
    private String name;
    private long databaseId;
    private String schema;
    private String perm;
    private String schemaPerm;
    private String sql;
    private boolean sqlLabView;

    private Builder() {}

    public Builder id(long id) { this.id = id; return this; }
    public Builder name(String name) { this.name = name; return this; }
    public Builder databaseId(long databaseId) { this.databaseId = databaseId; return this; }
    public Builder schema(String schema) { this.schema = schema; return this; }
    public Builder perm(String perm) { this.perm = perm; return this; }
    public Builder schemaPerm(String schemaPerm) { this.schemaPerm = schemaPerm; return this; }
    public Builder sql(String sql) { this.sql = sql; return this; }
    public Builder sqlLabView(boolean sqlLabView) { this.sqlLabView = sqlLabView; return this; }

    public SqlTable build() {
      return new SqlTable(id, name, databaseId, schema, perm, schemaPerm, sql, sqlLabView);
    }
  }
}
