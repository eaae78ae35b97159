package eventnative.jdbc.provider;

import eventnative.jdbc.DataSources;
import eventnative.jdbc.dialect.SqlDialects;
import eventnative.jdbc.spi.SqlDialect;
import eventnative.storage.DestinationSpec;
import eventnative.storage.DestinationTypes;

/**
 * Destination type {@code redshift}. Without a {@code url} the cluster is reached through the
 * PostgreSQL driver on port 5439.
 */
public final class RedshiftDestinationProvider extends AbstractJdbcDestinationProvider {

  @Override
  public String type() {
    return DestinationTypes.REDSHIFT;
  }

  @Override
  protected String jdbcUrl(DestinationSpec spec) {
    return DataSources.jdbcUrl(spec, "postgresql", 5439);
  }

  @Override
  protected SqlDialect defaultDialect(String jdbcUrl) {
    return SqlDialects.get("redshift");
  }
}
