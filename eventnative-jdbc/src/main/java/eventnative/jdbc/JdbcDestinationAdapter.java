package eventnative.jdbc;

import eventnative.ProcessedRow;
import eventnative.jdbc.spi.SqlDialect;
import eventnative.spi.DeliveryException;
import eventnative.spi.DestinationAdapter;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes rows into existing tables through JDBC.
 *
 * <p>Each {@link #write} call runs in one transaction: rows are grouped by table and column set,
 * each group goes out as one JDBC batch, and any failure rolls the whole call back. Rows with
 * primary-key fields are upserted when the dialect supports it and inserted otherwise.
 * {@link SQLException}s are classified by {@link SqlErrors}.
 *
 * <p>Tables are not created or altered.
 *
 * @see Builder
 */
public final class JdbcDestinationAdapter implements DestinationAdapter {
  private static final Logger logger = Logger.getLogger(JdbcDestinationAdapter.class.getName());

  private final String destination;
  private final DataSource dataSource;
  private final SqlDialect dialect;
  private final String schema;
  private final Map<String, String> sqlTypeCasts;
  private final boolean closeDataSource;

  private JdbcDestinationAdapter(Builder builder) {
    this.destination = Objects.requireNonNull(builder.destination, "destination");
    this.dataSource = Objects.requireNonNull(builder.dataSource, "dataSource");
    this.dialect = Objects.requireNonNull(builder.dialect, "dialect");
    this.schema = builder.schema == null || builder.schema.isBlank()
        ? null : Identifiers.validate(builder.schema);
    this.sqlTypeCasts = Map.copyOf(builder.sqlTypeCasts);
    this.closeDataSource = builder.closeDataSource;
  }

  public static Builder builder() {
    return new Builder();
  }

  public SqlDialect dialect() {
    return dialect;
  }

  @Override
  public void write(List<ProcessedRow> rows) throws DeliveryException {
    if (rows.isEmpty()) {
      return;
    }
    Map<RowGroup, List<ProcessedRow>> groups = group(rows);
    try (Connection conn = dataSource.getConnection()) {
      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      try {
        for (Map.Entry<RowGroup, List<ProcessedRow>> entry : groups.entrySet()) {
          writeGroup(conn, entry.getKey(), entry.getValue());
        }
        conn.commit();
      } catch (SQLException | RuntimeException e) {
        rollback(conn, e);
        throw e;
      } finally {
        conn.setAutoCommit(autoCommit);
      }
    } catch (SQLException e) {
      throw SqlErrors.classify(destination, e);
    }
    logger.log(Level.FINE, "[{0}] Wrote {1} rows in {2} groups",
        new Object[]{destination, rows.size(), groups.size()});
  }

  private Map<RowGroup, List<ProcessedRow>> group(List<ProcessedRow> rows) throws DeliveryException {
    Map<RowGroup, List<ProcessedRow>> groups = new LinkedHashMap<>();
    for (ProcessedRow row : rows) {
      RowGroup key;
      try {
        key = RowGroup.of(row);
      } catch (IllegalArgumentException e) {
        throw DeliveryException.permanent("[" + destination + "] event " + row.eventId()
            + ": " + e.getMessage(), e);
      }
      groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
    }
    return groups;
  }

  private void writeGroup(Connection conn, RowGroup group, List<ProcessedRow> rows)
      throws SQLException {
    String table = schema != null
        ? dialect.quote(schema) + "." + dialect.quote(group.table())
        : dialect.quote(group.table());
    String sql = !group.keys().isEmpty() && dialect.supportsUpsert()
        ? dialect.upsertSql(table, group.columns(), group.keys(), sqlTypeCasts)
        : dialect.insertSql(table, group.columns(), sqlTypeCasts);

    List<List<Object>> batch = new ArrayList<>(rows.size());
    for (ProcessedRow row : rows) {
      List<Object> params = new ArrayList<>(group.columns().size());
      for (String column : group.columns()) {
        params.add(row.columns().get(column));
      }
      batch.add(params);
    }
    JdbcTemplate.executeBatch(conn, sql, batch);
  }

  private void rollback(Connection conn, Exception failure) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      failure.addSuppressed(e);
      logger.log(Level.WARNING, "[" + destination + "] Rollback failed", e);
    }
  }

  @Override
  public void close() {
    if (closeDataSource && dataSource instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        logger.log(Level.WARNING, "[" + destination + "] Error closing data source", e);
      }
    }
  }

  private record RowGroup(String table, List<String> columns, Set<String> keys) {
    static RowGroup of(ProcessedRow row) {
      Identifiers.validate(row.tableName());
      Set<String> columns = new TreeSet<>(row.columns().keySet());
      for (String column : columns) {
        Identifiers.validate(column);
      }
      return new RowGroup(row.tableName(), List.copyOf(columns),
          Set.copyOf(row.primaryKeyFields()));
    }
  }

  /** Builder for {@link JdbcDestinationAdapter}. */
  public static final class Builder {
    private String destination;
    private DataSource dataSource;
    private SqlDialect dialect;
    private String schema;
    private Map<String, String> sqlTypeCasts = Map.of();
    private boolean closeDataSource;

    private Builder() {}

    /**
     * Sets the destination name used in log lines and error messages.
     *
     * <p><b>Required.</b>
     *
     * @return this builder
     */
    public Builder destination(String destination) {
      this.destination = destination;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @return this builder
     */
    public Builder dataSource(DataSource dataSource) {
      this.dataSource = dataSource;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @return this builder
     */
    public Builder dialect(SqlDialect dialect) {
      this.dialect = dialect;
      return this;
    }

    /**
     * Sets the schema qualifying every table.
     *
     * <p>Optional. Defaults to the connection's current schema.
     *
     * @return this builder
     */
    public Builder schema(String schema) {
      this.schema = schema;
      return this;
    }

    /**
     * Sets column name to SQL type casts applied to bound values.
     *
     * <p>Optional. Defaults to none.
     *
     * @return this builder
     */
    public Builder sqlTypeCasts(Map<String, String> sqlTypeCasts) {
      this.sqlTypeCasts = Objects.requireNonNull(sqlTypeCasts, "sqlTypeCasts");
      return this;
    }

    /**
     * Closes the data source when the adapter closes, for pools owned by the adapter.
     *
     * <p>Optional. Defaults to {@code false}.
     *
     * @return this builder
     */
    public Builder closeDataSource(boolean closeDataSource) {
      this.closeDataSource = closeDataSource;
      return this;
    }

    public JdbcDestinationAdapter build() {
      return new JdbcDestinationAdapter(this);
    }
  }
}
