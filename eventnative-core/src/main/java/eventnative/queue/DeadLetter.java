package eventnative.queue;

import java.time.Instant;
import java.util.Objects;

/**
 * An entry that exhausted its retries or failed permanently, kept in {@code dead.log}.
 */
public record DeadLetter(QueueEntry entry, String error, Instant deadAt) {
  public DeadLetter {
    Objects.requireNonNull(entry, "entry");
    Objects.requireNonNull(deadAt, "deadAt");
  }
}
