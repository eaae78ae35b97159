package eventnative.queue;

import java.util.Objects;

/**
 * One dequeued entry awaiting resolution. Exactly one of {@link #ack()}, {@link #nack(String)}
 * or {@link #deadLetter(String)} must be called; until then the entry counts as in flight and
 * is redelivered if the process stops.
 */
public final class QueueDelivery {
  private final PersistentQueue queue;
  private final QueueEntry entry;
  private final PersistentQueue.InFlight slot;

  QueueDelivery(PersistentQueue queue, QueueEntry entry, PersistentQueue.InFlight slot) {
    this.queue = queue;
    this.entry = entry;
    this.slot = slot;
  }

  public QueueEntry entry() {
    return entry;
  }

  /** Marks the entry delivered. */
  public void ack() {
    queue.acknowledge(slot);
  }

  /**
   * Marks the attempt failed. The entry is re-appended at the tail with its retry count
   * incremented, or moved to the dead-letter log once the retry cap is reached.
   *
   * @param error failure description kept with a dead letter
   * @return {@code true} if the entry will be redelivered, {@code false} if it was dead-lettered
   */
  public boolean nack(String error) {
    return queue.retry(slot, entry, error);
  }

  /** Moves the entry straight to the dead-letter log. */
  public void deadLetter(String error) {
    queue.deadLetter(slot, entry, Objects.requireNonNullElse(error, "unknown error"));
  }
}
