package eventnative.jdbc.dialect;

import eventnative.jdbc.spi.SqlDialect;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Base class with ANSI quoting and a plain {@code INSERT}. Subclasses add upsert syntax.
 */
public abstract class AbstractSqlDialect implements SqlDialect {

  @Override
  public String quote(String identifier) {
    return "\"" + identifier.replace("\"", "\"\"") + "\"";
  }

  @Override
  public String insertSql(String table, List<String> columns, Map<String, String> casts) {
    return "INSERT INTO " + table + " (" + columnList(columns) + ") VALUES ("
        + placeholders(columns, casts) + ")";
  }

  @Override
  public boolean supportsUpsert() {
    return false;
  }

  @Override
  public String upsertSql(String table, List<String> columns, Set<String> keys,
      Map<String, String> casts) {
    throw new UnsupportedOperationException(name() + " does not support upserts");
  }

  protected String columnList(List<String> columns) {
    StringJoiner joiner = new StringJoiner(", ");
    for (String column : columns) {
      joiner.add(quote(column));
    }
    return joiner.toString();
  }

  protected String placeholders(List<String> columns, Map<String, String> casts) {
    StringJoiner joiner = new StringJoiner(", ");
    for (String column : columns) {
      String type = casts.get(column);
      joiner.add(type == null ? "?" : "CAST(? AS " + type + ")");
    }
    return joiner.toString();
  }

  @Override
  public String toString() {
    return name();
  }
}
