/**
 * JDBC destination adapters.
 *
 * <p>{@link eventnative.jdbc.JdbcDestinationAdapter} writes rows through a pooled
 * {@link javax.sql.DataSource}; {@link eventnative.jdbc.spi.SqlDialect} implementations supply
 * the insert and upsert syntax. Destination types {@code postgres}, {@code redshift} and
 * {@code jdbc} are contributed through {@code META-INF/services}.
 *
 * @see eventnative.jdbc.provider.AbstractJdbcDestinationProvider
 * @see eventnative.jdbc.dialect.SqlDialects
 */
package eventnative.jdbc;
