package eventnative.spi;

/**
 * A delivery failure with an explicit retry classification.
 *
 * <p>Adapters throw {@link #permanent} for failures that retrying cannot fix. Any exception that
 * is not a {@code DeliveryException} is treated as retryable.
 */
public class DeliveryException extends Exception {
  private final boolean retryable;

  public DeliveryException(String message, Throwable cause, boolean retryable) {
    super(message, cause);
    this.retryable = retryable;
  }

  public static DeliveryException retryable(String message, Throwable cause) {
    return new DeliveryException(message, cause, true);
  }

  public static DeliveryException permanent(String message, Throwable cause) {
    return new DeliveryException(message, cause, false);
  }

  public boolean isRetryable() {
    return retryable;
  }

  /** Classification of an arbitrary failure. */
  public static boolean isRetryable(Throwable failure) {
    return !(failure instanceof DeliveryException d) || d.retryable;
  }
}
