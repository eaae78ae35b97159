package eventnative.storage;

/**
 * Well-known destination type ids. Only types with a registered {@link DestinationProvider}
 * can be instantiated.
 */
public final class DestinationTypes {
  public static final String POSTGRES = "postgres";
  public static final String REDSHIFT = "redshift";
  public static final String CLICKHOUSE = "clickhouse";
  public static final String BIGQUERY = "bigquery";
  public static final String SNOWFLAKE = "snowflake";
  public static final String S3 = "s3";
  public static final String JDBC = "jdbc";

  private DestinationTypes() {
  }
}
