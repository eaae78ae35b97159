package eventnative.queue;

import eventnative.ProcessedRow;

import java.time.Instant;
import java.util.Objects;

/**
 * A row waiting in a destination's durable queue.
 *
 * @param destination owning destination
 * @param enqueuedAt  time of the first enqueue; retries keep it
 * @param retryCount  failed delivery attempts so far
 * @param row         the row to deliver
 */
public record QueueEntry(String destination, Instant enqueuedAt, int retryCount, ProcessedRow row) {
  public QueueEntry {
    Objects.requireNonNull(destination, "destination");
    Objects.requireNonNull(enqueuedAt, "enqueuedAt");
    Objects.requireNonNull(row, "row");
    if (retryCount < 0) {
      throw new IllegalArgumentException("retryCount must be >= 0");
    }
  }

  public static QueueEntry of(String destination, ProcessedRow row) {
    return new QueueEntry(destination, Instant.now(), 0, row);
  }

  /** Copy with the retry count incremented, used when a delivery attempt fails. */
  public QueueEntry withRetry() {
    return new QueueEntry(destination, enqueuedAt, retryCount + 1, row);
  }

  public QueueEntry withRetryCount(int retryCount) {
    return new QueueEntry(destination, enqueuedAt, retryCount, row);
  }
}
