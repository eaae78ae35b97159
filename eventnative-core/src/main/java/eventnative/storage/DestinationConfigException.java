package eventnative.storage;

/**
 * Thrown when a destination cannot be constructed. The destination never activates.
 */
public class DestinationConfigException extends RuntimeException {

  /** Category of construction failure. */
  public enum Kind {
    UNKNOWN_TYPE,
    INVALID_MODE,
    INVALID_ENRICHMENT,
    INVALID_MAPPING,
    ADAPTER_INIT,
    QUEUE_INIT
  }

  private final Kind kind;
  private final String destination;

  public DestinationConfigException(Kind kind, String destination, String message) {
    this(kind, destination, message, null);
  }

  public DestinationConfigException(Kind kind, String destination, String message, Throwable cause) {
    super("[" + destination + "] " + message, cause);
    this.kind = kind;
    this.destination = destination;
  }

  public Kind kind() {
    return kind;
  }

  public String destination() {
    return destination;
  }
}
