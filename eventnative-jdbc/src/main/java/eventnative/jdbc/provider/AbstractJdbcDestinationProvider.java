package eventnative.jdbc.provider;

import com.zaxxer.hikari.HikariDataSource;
import eventnative.jdbc.DataSources;
import eventnative.jdbc.JdbcDestinationAdapter;
import eventnative.jdbc.dialect.SqlDialects;
import eventnative.jdbc.spi.SqlDialect;
import eventnative.spi.DestinationAdapter;
import eventnative.storage.DestinationProvider;
import eventnative.storage.DestinationSpec;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Shared wiring for JDBC destination types: resolve the dialect, open a pool, build the adapter.
 *
 * <p>A {@code dialect} parameter overrides the type's default dialect. The optional
 * {@code schema} parameter qualifies every table.
 */
public abstract class AbstractJdbcDestinationProvider implements DestinationProvider {
  private static final Logger logger =
      Logger.getLogger(AbstractJdbcDestinationProvider.class.getName());

  @Override
  public DestinationAdapter create(DestinationSpec spec) {
    String url = jdbcUrl(spec);
    String dialectName = spec.parameter("dialect");
    SqlDialect dialect = dialectName != null && !dialectName.isBlank()
        ? SqlDialects.get(dialectName.trim())
        : defaultDialect(url);
    if (!spec.primaryKeyFields().isEmpty() && !dialect.supportsUpsert()) {
      logger.log(Level.WARNING, "[{0}] {1} does not support upserts, primary keys {2} are ignored",
          new Object[]{spec.name(), dialect.name(), spec.primaryKeyFields()});
    }

    HikariDataSource dataSource = DataSources.create(spec, url);
    logger.log(Level.INFO, "[{0}] Connected with dialect {1}", new Object[]{spec.name(), dialect.name()});
    return JdbcDestinationAdapter.builder()
        .destination(spec.name())
        .dataSource(dataSource)
        .dialect(dialect)
        .schema(spec.parameter("schema"))
        .sqlTypeCasts(spec.sqlTypeCasts())
        .closeDataSource(true)
        .build();
  }

  /** JDBC URL built from the destination parameters. */
  protected abstract String jdbcUrl(DestinationSpec spec);

  /** Dialect used when no {@code dialect} parameter is given. */
  protected abstract SqlDialect defaultDialect(String jdbcUrl);
}
