package eventnative.spi;

import eventnative.ProcessedRow;

import java.util.List;

/**
 * Writes rows to a concrete destination (warehouse, database, object storage).
 *
 * <p>Calls for one destination are serialized by its storage proxy, so implementations need
 * not be thread-safe. A call either writes every row or throws.
 */
public interface DestinationAdapter extends AutoCloseable {

  /**
   * Writes a batch of rows, possibly spanning several tables.
   *
   * @throws DeliveryException with {@code retryable=false} for failures that will not go away
   *                           on retry (bad schema, rejected credentials)
   * @throws Exception         for any other failure, treated as retryable
   */
  void write(List<ProcessedRow> rows) throws Exception;

  /** Releases connections. The default does nothing. */
  @Override
  default void close() {
  }
}
