package eventnative.jdbc.dialect;

import eventnative.jdbc.spi.SqlDialect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The SQL dialects available to JDBC destinations, keyed by the name a destination's
 * {@code dialect} parameter uses.
 *
 * <p>The set is fixed when the class loads: every {@link SqlDialect} listed in
 * {@code META-INF/services/eventnative.jdbc.spi.SqlDialect} on the JDBC module's class path.
 * A generic {@code jdbc} destination picks its dialect from the connection URL with
 * {@link #detect(String)}.
 */
public final class SqlDialects {
  private static final Logger logger = Logger.getLogger(SqlDialects.class.getName());

  private static final Map<String, SqlDialect> BY_NAME = load();

  private SqlDialects() {
  }

  private static Map<String, SqlDialect> load() {
    Map<String, SqlDialect> byName = new LinkedHashMap<>();
    for (SqlDialect dialect : ServiceLoader.load(SqlDialect.class, SqlDialects.class.getClassLoader())) {
      SqlDialect previous = byName.putIfAbsent(key(dialect.name()), dialect);
      if (previous != null) {
        logger.log(Level.WARNING, "SQL dialect {0} from {1} ignored, already provided by {2}",
            new Object[]{dialect.name(), dialect.getClass().getName(), previous.getClass().getName()});
      }
    }
    return Collections.unmodifiableMap(byName);
  }

  /** Dialects in service registration order. */
  public static List<SqlDialect> all() {
    return List.copyOf(BY_NAME.values());
  }

  /**
   * @param name dialect name, any case
   * @throws IllegalArgumentException if no dialect has that name
   */
  public static SqlDialect get(String name) {
    SqlDialect dialect = BY_NAME.get(key(name));
    if (dialect == null) {
      throw new IllegalArgumentException("Unknown dialect: " + name + ". Available: " + BY_NAME.keySet());
    }
    return dialect;
  }

  /**
   * Picks the dialect whose URL prefix matches {@code jdbcUrl}. When several prefixes match, the
   * longest one wins.
   *
   * @throws IllegalArgumentException if the URL is blank or no dialect claims it
   */
  public static SqlDialect detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isBlank()) {
      throw new IllegalArgumentException("JDBC URL is required to detect a dialect");
    }
    String url = jdbcUrl.trim().toLowerCase(Locale.ROOT);
    SqlDialect match = null;
    int matchLength = -1;
    List<String> prefixes = new ArrayList<>();
    for (SqlDialect dialect : BY_NAME.values()) {
      for (String prefix : dialect.jdbcUrlPrefixes()) {
        prefixes.add(prefix);
        if (url.startsWith(prefix.toLowerCase(Locale.ROOT)) && prefix.length() > matchLength) {
          match = dialect;
          matchLength = prefix.length();
        }
      }
    }
    if (match == null) {
      throw new IllegalArgumentException("No SQL dialect for JDBC URL " + jdbcUrl
          + ". Known URL prefixes: " + prefixes);
    }
    return match;
  }

  private static String key(String name) {
    return name.trim().toLowerCase(Locale.ROOT);
  }
}
