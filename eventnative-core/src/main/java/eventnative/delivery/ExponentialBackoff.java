package eventnative.delivery;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Doubling backoff: {@code initialDelay * 2^(failedAttempts-1)}, capped at {@code maxDelay},
 * then spread by a random factor in {@code [1 - jitter, 1 + jitter)} and capped again.
 *
 * <p>A jitter of {@code 0} makes delays deterministic.
 */
public final class ExponentialBackoff implements BackoffPolicy {
  private final long initialDelayMs;
  private final long maxDelayMs;
  private final double jitter;

  public ExponentialBackoff(long initialDelayMs, long maxDelayMs) {
    this(initialDelayMs, maxDelayMs, 0.5);
  }

  /**
   * @param initialDelayMs delay after the first failure
   * @param maxDelayMs     upper bound of any delay
   * @param jitter         spread ratio in {@code [0, 1)}
   */
  public ExponentialBackoff(long initialDelayMs, long maxDelayMs, double jitter) {
    if (initialDelayMs <= 0) {
      throw new IllegalArgumentException("initialDelayMs must be > 0, got: " + initialDelayMs);
    }
    if (maxDelayMs < initialDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= initialDelayMs, got: " + maxDelayMs);
    }
    if (jitter < 0 || jitter >= 1) {
      throw new IllegalArgumentException("jitter must be in [0, 1), got: " + jitter);
    }
    this.initialDelayMs = initialDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.jitter = jitter;
  }

  @Override
  public long delayMs(int failedAttempts) {
    if (failedAttempts <= 0) {
      return 0L;
    }
    long delay = initialDelayMs;
    for (int i = 1; i < failedAttempts && delay < maxDelayMs; i++) {
      delay *= 2;
    }
    delay = Math.min(delay, maxDelayMs);
    if (jitter == 0) {
      return delay;
    }
    double factor = ThreadLocalRandom.current().nextDouble(1 - jitter, 1 + jitter);
    return Math.min(maxDelayMs, Math.max(0L, (long) (delay * factor)));
  }
}
