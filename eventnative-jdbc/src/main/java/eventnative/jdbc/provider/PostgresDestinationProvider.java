package eventnative.jdbc.provider;

import eventnative.jdbc.DataSources;
import eventnative.jdbc.dialect.SqlDialects;
import eventnative.jdbc.spi.SqlDialect;
import eventnative.storage.DestinationSpec;
import eventnative.storage.DestinationTypes;

/** Destination type {@code postgres}. */
public final class PostgresDestinationProvider extends AbstractJdbcDestinationProvider {

  @Override
  public String type() {
    return DestinationTypes.POSTGRES;
  }

  @Override
  protected String jdbcUrl(DestinationSpec spec) {
    return DataSources.jdbcUrl(spec, "postgresql", 5432);
  }

  @Override
  protected SqlDialect defaultDialect(String jdbcUrl) {
    return SqlDialects.get("postgres");
  }
}
