package eventnative.jdbc.provider;

import eventnative.jdbc.dialect.SqlDialects;
import eventnative.jdbc.spi.SqlDialect;
import eventnative.storage.DestinationSpec;
import eventnative.storage.DestinationTypes;

/**
 * Destination type {@code jdbc}: any database reachable by a {@code url} parameter, with the
 * dialect detected from the URL. Used with H2 for local runs.
 */
public final class JdbcDestinationProvider extends AbstractJdbcDestinationProvider {

  @Override
  public String type() {
    return DestinationTypes.JDBC;
  }

  @Override
  protected String jdbcUrl(DestinationSpec spec) {
    return spec.requiredParameter("url").trim();
  }

  @Override
  protected SqlDialect defaultDialect(String jdbcUrl) {
    return SqlDialects.detect(jdbcUrl);
  }
}
