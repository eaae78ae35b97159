package eventnative;

/**
 * Thrown when a destination cannot accept more rows because its buffer or durable queue is
 * saturated. Callers should slow down or reject the event upstream.
 */
public class BackpressureException extends RuntimeException {
  public BackpressureException(String message) {
    super(message);
  }
}
