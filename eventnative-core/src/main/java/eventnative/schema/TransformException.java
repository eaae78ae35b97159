package eventnative.schema;

/**
 * Thrown when a single event cannot be turned into a row. Never retried.
 */
public class TransformException extends Exception {
  private final String eventId;

  public TransformException(String eventId, String message) {
    super(message);
    this.eventId = eventId;
  }

  public TransformException(String eventId, String message, Throwable cause) {
    super(message, cause);
    this.eventId = eventId;
  }

  public String eventId() {
    return eventId;
  }
}
