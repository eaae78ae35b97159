package eventnative.jdbc.dialect;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/**
 * PostgreSQL: upserts through {@code INSERT ... ON CONFLICT (keys) DO UPDATE}.
 */
public final class PostgresDialect extends AbstractSqlDialect {

  @Override
  public String name() {
    return "postgres";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public boolean supportsUpsert() {
    return true;
  }

  @Override
  public String upsertSql(String table, List<String> columns, Set<String> keys,
      Map<String, String> casts) {
    StringJoiner conflict = new StringJoiner(", ");
    StringJoiner updates = new StringJoiner(", ");
    for (String column : columns) {
      if (keys.contains(column)) {
        conflict.add(quote(column));
      } else {
        updates.add(quote(column) + " = EXCLUDED." + quote(column));
      }
    }
    String action = updates.length() == 0 ? "DO NOTHING" : "DO UPDATE SET " + updates;
    return insertSql(table, columns, casts) + " ON CONFLICT (" + conflict + ") " + action;
  }
}
