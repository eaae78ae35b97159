package eventnative.jdbc.dialect;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/**
 * H2, for local runs and tests. Upserts use {@code MERGE INTO ... KEY (...)}.
 */
public final class H2Dialect extends AbstractSqlDialect {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public boolean supportsUpsert() {
    return true;
  }

  @Override
  public String upsertSql(String table, List<String> columns, Set<String> keys,
      Map<String, String> casts) {
    StringJoiner key = new StringJoiner(", ");
    for (String column : columns) {
      if (keys.contains(column)) {
        key.add(quote(column));
      }
    }
    return "MERGE INTO " + table + " (" + columnList(columns) + ") KEY (" + key + ") VALUES ("
        + placeholders(columns, casts) + ")";
  }
}
