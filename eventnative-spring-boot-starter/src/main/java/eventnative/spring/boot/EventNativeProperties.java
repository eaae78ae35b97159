package eventnative.spring.boot;

import eventnative.storage.DestinationConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for event delivery.
 *
 * <pre>
 * eventnative:
 *   log-path: /var/lib/eventnative
 *   destinations:
 *     pg:
 *       type: postgres
 *       mode: stream
 *       parameters:
 *         host: db
 *         db: events
 * </pre>
 *
 * @see EventNativeAutoConfiguration
 */
@ConfigurationProperties(prefix = "eventnative")
public class EventNativeProperties {

  /**
   * Directory holding the durable queues of stream destinations.
   */
  private String logPath = "./logs/events";

  /**
   * Outcomes kept per destination for diagnostics.
   */
  private int outcomeCacheCapacity = 100;

  /**
   * Destination name to configuration, started in declaration order.
   */
  private Map<String, DestinationConfig> destinations = new LinkedHashMap<>();

  private final Delivery delivery = new Delivery();
  private final Retry retry = new Retry();
  private final Metrics metrics = new Metrics();

  public String getLogPath() {
    return logPath;
  }

  public void setLogPath(String logPath) {
    this.logPath = logPath;
  }

  public int getOutcomeCacheCapacity() {
    return outcomeCacheCapacity;
  }

  public void setOutcomeCacheCapacity(int outcomeCacheCapacity) {
    this.outcomeCacheCapacity = outcomeCacheCapacity;
  }

  public Map<String, DestinationConfig> getDestinations() {
    return destinations;
  }

  public void setDestinations(Map<String, DestinationConfig> destinations) {
    this.destinations = destinations;
  }

  public Delivery getDelivery() {
    return delivery;
  }

  public Retry getRetry() {
    return retry;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Delivery {
    private int maxAttempts = 10;
    private int batchSize = 1000;
    private int bufferCapacity = 10_000;
    private long flushIntervalMs = 60_000;
    private long drainTimeoutMs = 5000;
    private long pollTimeoutMs = 100;
    private long queueMaxBytes = 1L << 30;
    private long queueSegmentBytes = 16L << 20;

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }

    public int getBufferCapacity() {
      return bufferCapacity;
    }

    public void setBufferCapacity(int bufferCapacity) {
      this.bufferCapacity = bufferCapacity;
    }

    public long getFlushIntervalMs() {
      return flushIntervalMs;
    }

    public void setFlushIntervalMs(long flushIntervalMs) {
      this.flushIntervalMs = flushIntervalMs;
    }

    public long getDrainTimeoutMs() {
      return drainTimeoutMs;
    }

    public void setDrainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
    }

    public long getPollTimeoutMs() {
      return pollTimeoutMs;
    }

    public void setPollTimeoutMs(long pollTimeoutMs) {
      this.pollTimeoutMs = pollTimeoutMs;
    }

    public long getQueueMaxBytes() {
      return queueMaxBytes;
    }

    public void setQueueMaxBytes(long queueMaxBytes) {
      this.queueMaxBytes = queueMaxBytes;
    }

    public long getQueueSegmentBytes() {
      return queueSegmentBytes;
    }

    public void setQueueSegmentBytes(long queueSegmentBytes) {
      this.queueSegmentBytes = queueSegmentBytes;
    }
  }

  public static class Retry {
    private long baseDelayMs = 200;
    private long maxDelayMs = 60_000;

    public long getBaseDelayMs() {
      return baseDelayMs;
    }

    public void setBaseDelayMs(long baseDelayMs) {
      this.baseDelayMs = baseDelayMs;
    }

    public long getMaxDelayMs() {
      return maxDelayMs;
    }

    public void setMaxDelayMs(long maxDelayMs) {
      this.maxDelayMs = maxDelayMs;
    }
  }

  public static class Metrics {
    /**
     * Whether to register a Micrometer exporter when Micrometer is on the classpath.
     */
    private boolean enabled = true;

    /**
     * Prefix of every meter name.
     */
    private String namePrefix = "eventnative";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
