package eventnative.spi;

/**
 * Observability hook for per-destination delivery counters and gauges.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of rows accepted into a destination's buffer or queue.
   */
  void incrementAccepted(String destination);

  /**
   * Increments the count of rows rejected because the buffer or queue was full.
   */
  void incrementBackpressure(String destination);

  /**
   * Increments the count of events dropped by the transform pipeline.
   */
  void incrementSkipped(String destination);

  /**
   * Adds to the count of rows written successfully.
   *
   * @param rows number of rows in the successful write
   */
  void incrementDelivered(String destination, int rows);

  /**
   * Increments the count of failed write attempts that will be retried.
   */
  void incrementRetried(String destination);

  /**
   * Adds to the count of rows given up on (dropped batch or dead-lettered entry).
   */
  void incrementFailed(String destination, int rows);

  /**
   * Records the number of unresolved entries in a stream destination's queue.
   */
  void recordQueueDepth(String destination, long depth);

  /**
   * Records the time spent in one adapter write.
   *
   * @param durationMs write duration in milliseconds (always non-negative)
   */
  default void recordWriteDurationMs(String destination, long durationMs) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementAccepted(String destination) {
    }

    @Override
    public void incrementBackpressure(String destination) {
    }

    @Override
    public void incrementSkipped(String destination) {
    }

    @Override
    public void incrementDelivered(String destination, int rows) {
    }

    @Override
    public void incrementRetried(String destination) {
    }

    @Override
    public void incrementFailed(String destination, int rows) {
    }

    @Override
    public void recordQueueDepth(String destination, long depth) {
    }
  }
}
