package eventnative.queue;

import eventnative.BackpressureException;

/**
 * Thrown by {@link PersistentQueue#enqueue} when the entry would exceed the queue's byte bound.
 * Nothing is written.
 */
public class QueueFullException extends BackpressureException {
  private final String destination;

  public QueueFullException(String destination, long pendingBytes, long recordBytes, long maxBytes) {
    super("Queue for destination [" + destination + "] is full: " + pendingBytes + " pending bytes + "
        + recordBytes + " > maxBytes " + maxBytes);
    this.destination = destination;
  }

  public String destination() {
    return destination;
  }
}
