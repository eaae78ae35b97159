package eventnative.delivery;

/**
 * Tuning shared by the storage proxies of one process.
 *
 * @see Builder
 */
public final class DeliverySettings {
  private final int maxAttempts;
  private final BackoffPolicy backoff;
  private final int batchSize;
  private final int bufferCapacity;
  private final long flushIntervalMs;
  private final long drainTimeoutMs;
  private final long pollTimeoutMs;
  private final long queueMaxBytes;
  private final long queueSegmentBytes;

  private DeliverySettings(Builder builder) {
    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.bufferCapacity < builder.batchSize) {
      throw new IllegalArgumentException("bufferCapacity must be >= batchSize");
    }
    if (builder.flushIntervalMs <= 0) {
      throw new IllegalArgumentException("flushIntervalMs must be > 0");
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    if (builder.pollTimeoutMs <= 0) {
      throw new IllegalArgumentException("pollTimeoutMs must be > 0");
    }
    if (builder.queueMaxBytes <= 0 || builder.queueSegmentBytes <= 0) {
      throw new IllegalArgumentException("queue byte limits must be > 0");
    }
    this.maxAttempts = builder.maxAttempts;
    this.backoff = builder.backoff != null ? builder.backoff : new ExponentialBackoff(200, 60_000);
    this.batchSize = builder.batchSize;
    this.bufferCapacity = builder.bufferCapacity;
    this.flushIntervalMs = builder.flushIntervalMs;
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.pollTimeoutMs = builder.pollTimeoutMs;
    this.queueMaxBytes = builder.queueMaxBytes;
    this.queueSegmentBytes = builder.queueSegmentBytes;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static DeliverySettings defaults() {
    return builder().build();
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  /** Queue redeliveries allowed after the first attempt. */
  public int maxRetries() {
    return maxAttempts - 1;
  }

  public BackoffPolicy backoff() {
    return backoff;
  }

  public int batchSize() {
    return batchSize;
  }

  public int bufferCapacity() {
    return bufferCapacity;
  }

  public long flushIntervalMs() {
    return flushIntervalMs;
  }

  public long drainTimeoutMs() {
    return drainTimeoutMs;
  }

  public long pollTimeoutMs() {
    return pollTimeoutMs;
  }

  public long queueMaxBytes() {
    return queueMaxBytes;
  }

  public long queueSegmentBytes() {
    return queueSegmentBytes;
  }

  /** Builder for {@link DeliverySettings}. */
  public static final class Builder {
    private int maxAttempts = 10;
    private BackoffPolicy backoff;
    private int batchSize = 1000;
    private int bufferCapacity = 10_000;
    private long flushIntervalMs = 60_000;
    private long drainTimeoutMs = 5000;
    private long pollTimeoutMs = 100;
    private long queueMaxBytes = 1L << 30;
    private long queueSegmentBytes = 16L << 20;

    private Builder() {}

    /**
     * Sets the number of write attempts per batch or queue entry, first attempt included.
     *
     * <p>Optional. Defaults to {@code 10}. Must be &ge; 1.
     *
     * @return this builder
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Sets the delay policy between attempts.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoff} from 200 ms up to 60 s.
     *
     * @return this builder
     */
    public Builder backoff(BackoffPolicy backoff) {
      this.backoff = backoff;
      return this;
    }

    /**
     * Sets the buffered row count that triggers an early batch flush.
     *
     * <p>Optional. Defaults to {@code 1000}.
     *
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the maximum rows buffered by a batch destination before ingestion is rejected.
     *
     * <p>Optional. Defaults to {@code 10000}. Must be &ge; {@code batchSize}.
     *
     * @return this builder
     */
    public Builder bufferCapacity(int bufferCapacity) {
      this.bufferCapacity = bufferCapacity;
      return this;
    }

    /**
     * Sets the period of the batch flush timer.
     *
     * <p>Optional. Defaults to {@code 60000}.
     *
     * @return this builder
     */
    public Builder flushIntervalMs(long flushIntervalMs) {
      this.flushIntervalMs = flushIntervalMs;
      return this;
    }

    /**
     * Sets how long {@code close()} waits for the final flush or the in-flight entry.
     *
     * <p>Optional. Defaults to {@code 5000}.
     *
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Sets how long a stream worker waits on an empty queue before rechecking for shutdown.
     *
     * <p>Optional. Defaults to {@code 100}.
     *
     * @return this builder
     */
    public Builder pollTimeoutMs(long pollTimeoutMs) {
      this.pollTimeoutMs = pollTimeoutMs;
      return this;
    }

    /**
     * <p>Optional. Defaults to 1 GiB per stream destination.
     *
     * @return this builder
     */
    public Builder queueMaxBytes(long queueMaxBytes) {
      this.queueMaxBytes = queueMaxBytes;
      return this;
    }

    /**
     * <p>Optional. Defaults to 16 MiB.
     *
     * @return this builder
     */
    public Builder queueSegmentBytes(long queueSegmentBytes) {
      this.queueSegmentBytes = queueSegmentBytes;
      return this;
    }

    public DeliverySettings build() {
      return new DeliverySettings(this);
    }
  }
}
