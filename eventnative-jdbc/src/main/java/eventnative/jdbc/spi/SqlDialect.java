package eventnative.jdbc.spi;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Database-specific SQL for writing flattened rows.
 *
 * <p>Implementations are discovered through {@link java.util.ServiceLoader}; register them in
 * {@code META-INF/services/eventnative.jdbc.spi.SqlDialect}.
 *
 * @see eventnative.jdbc.dialect.SqlDialects
 */
public interface SqlDialect {

  /** Unique name used in the {@code dialect} destination parameter. */
  String name();

  /** JDBC URL prefixes this dialect handles, e.g. {@code jdbc:postgresql:}. */
  List<String> jdbcUrlPrefixes();

  /** Quotes a validated table or column identifier. */
  String quote(String identifier);

  /**
   * Builds a single-row {@code INSERT} statement.
   *
   * @param table   qualified, already quoted table reference
   * @param columns unquoted column names in binding order
   * @param casts   column name to SQL type; matching placeholders become {@code CAST(? AS type)}
   */
  String insertSql(String table, List<String> columns, Map<String, String> casts);

  /** Whether {@link #upsertSql} is supported. */
  boolean supportsUpsert();

  /**
   * Builds a single-row statement that replaces the row sharing {@code keys}.
   *
   * @throws UnsupportedOperationException if {@link #supportsUpsert()} is false
   */
  String upsertSql(String table, List<String> columns, Set<String> keys, Map<String, String> casts);
}
