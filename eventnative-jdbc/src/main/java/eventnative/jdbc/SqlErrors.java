package eventnative.jdbc;

import eventnative.spi.DeliveryException;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.Set;

/**
 * Maps {@link SQLException}s onto retryable and permanent {@link DeliveryException}s.
 *
 * <p>Transient and recoverable exceptions, and SQLState classes {@code 08} (connection),
 * {@code 40} (transaction rollback), {@code 53} (insufficient resources) and {@code 57}
 * (operator intervention), are retryable. Classes {@code 22} (data), {@code 23} (integrity),
 * {@code 28} (authorization) and {@code 42} (syntax or missing object) are permanent. Anything
 * else is retried.
 */
public final class SqlErrors {
  private static final Set<String> PERMANENT_CLASSES = Set.of("22", "23", "28", "42");

  private SqlErrors() {}

  public static DeliveryException classify(String destination, SQLException e) {
    String message = "[" + destination + "] " + describe(e);
    return isRetryable(e)
        ? DeliveryException.retryable(message, e)
        : DeliveryException.permanent(message, e);
  }

  public static boolean isRetryable(SQLException e) {
    if (e instanceof SQLTransientException || e instanceof SQLRecoverableException) {
      return true;
    }
    if (e instanceof SQLNonTransientConnectionException) {
      return true;
    }
    String state = sqlState(e);
    if (state == null || state.length() < 2) {
      return true;
    }
    return !PERMANENT_CLASSES.contains(state.substring(0, 2));
  }

  /** SQLState of the exception, or of the first chained exception that carries one. */
  static String sqlState(SQLException e) {
    for (SQLException current = e; current != null; current = current.getNextException()) {
      if (current.getSQLState() != null) {
        return current.getSQLState();
      }
    }
    return null;
  }

  private static String describe(SQLException e) {
    SQLException next = e.getNextException();
    String detail = next != null && next.getMessage() != null ? next.getMessage() : e.getMessage();
    String state = sqlState(e);
    return state != null ? detail + " (SQLState " + state + ")" : detail;
  }
}
