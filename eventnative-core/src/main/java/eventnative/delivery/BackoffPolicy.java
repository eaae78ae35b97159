package eventnative.delivery;

/**
 * Delay before the next attempt after a failed write.
 *
 * @see ExponentialBackoff
 */
@FunctionalInterface
public interface BackoffPolicy {

  /** No delay between attempts. */
  BackoffPolicy NONE = failedAttempts -> 0L;

  /**
   * @param failedAttempts failed attempts so far, starting at 1
   * @return delay in milliseconds, never negative
   */
  long delayMs(int failedAttempts);
}
