package eventnative;

import java.util.Optional;

/**
 * How a destination receives rows.
 */
public enum DeliveryMode {
  /** Rows are buffered in memory and written in batches on a timer or size threshold. */
  BATCH("batch"),
  /** Rows are persisted to a durable queue and written one by one by a retrying worker. */
  STREAM("stream");

  private final String id;

  DeliveryMode(String id) {
    this.id = id;
  }

  /** Configuration identifier, e.g. {@code "stream"}. */
  public String id() {
    return id;
  }

  /**
   * Looks up a mode by its configuration identifier.
   *
   * @param id the identifier, matched exactly
   * @return the mode, or empty if unknown
   */
  public static Optional<DeliveryMode> fromId(String id) {
    for (DeliveryMode mode : values()) {
      if (mode.id.equals(id)) {
        return Optional.of(mode);
      }
    }
    return Optional.empty();
  }
}
