package eventnative.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import eventnative.storage.DestinationSpec;

/**
 * Builds HikariCP pools from destination parameters.
 *
 * <p>Recognized parameters: {@code url} (a full JDBC URL; otherwise {@code host}, {@code port}
 * and {@code db} are required), {@code username}, {@code password}, {@code max_pool_size}
 * (default 4) and {@code connection_timeout_ms} (default 30000).
 */
public final class DataSources {
  static final int DEFAULT_POOL_SIZE = 4;
  static final long DEFAULT_CONNECTION_TIMEOUT_MS = 30_000;

  private DataSources() {}

  /**
   * Resolves the JDBC URL of a destination.
   *
   * @param scheme      driver scheme used when the URL is built from host and port, e.g.
   *                    {@code postgresql}
   * @param defaultPort port used when {@code port} is absent
   * @throws IllegalArgumentException if neither {@code url} nor {@code host} and {@code db} are set
   */
  public static String jdbcUrl(DestinationSpec spec, String scheme, int defaultPort) {
    String url = spec.parameter("url");
    if (url != null && !url.isBlank()) {
      return url.trim();
    }
    String host = spec.requiredParameter("host");
    String port = spec.parameter("port", String.valueOf(defaultPort));
    String db = spec.requiredParameter("db");
    return "jdbc:" + scheme + "://" + host + ":" + port + "/" + db;
  }

  /**
   * Opens a pool. Fails if the database cannot be reached.
   */
  public static HikariDataSource create(DestinationSpec spec, String jdbcUrl) {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(jdbcUrl);
    String username = spec.parameter("username");
    if (username != null) {
      config.setUsername(username);
    }
    String password = spec.parameter("password");
    if (password != null) {
      config.setPassword(password);
    }
    config.setMaximumPoolSize(Integer.parseInt(
        spec.parameter("max_pool_size", String.valueOf(DEFAULT_POOL_SIZE))));
    config.setMinimumIdle(1);
    config.setConnectionTimeout(Long.parseLong(
        spec.parameter("connection_timeout_ms", String.valueOf(DEFAULT_CONNECTION_TIMEOUT_MS))));
    config.setPoolName("eventnative-" + spec.name());
    return new HikariDataSource(config);
  }
}
