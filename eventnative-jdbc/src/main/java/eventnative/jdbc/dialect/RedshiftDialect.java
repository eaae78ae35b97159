package eventnative.jdbc.dialect;

import java.util.List;

/**
 * Amazon Redshift. Primary keys are informational there, so rows are always appended.
 */
public final class RedshiftDialect extends AbstractSqlDialect {

  @Override
  public String name() {
    return "redshift";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:redshift:");
  }
}
