package eventnative.queue;

import eventnative.util.JsonCodec;

/**
 * Serializes queue records. Implementations must round-trip every value they encode.
 */
public interface QueueEntryCodec {

  /** JSON encoding through the default {@link JsonCodec}. */
  static QueueEntryCodec json() {
    return new JsonQueueEntryCodec(JsonCodec.getDefault());
  }

  byte[] encode(QueueEntry entry);

  /**
   * @throws IllegalArgumentException if the payload is not a valid entry
   */
  QueueEntry decode(byte[] payload);

  byte[] encodeDeadLetter(DeadLetter deadLetter);

  /**
   * @throws IllegalArgumentException if the payload is not a valid dead letter
   */
  DeadLetter decodeDeadLetter(byte[] payload);
}
