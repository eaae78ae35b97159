package eventnative.micrometer;

import eventnative.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Every meter carries a {@code destination} tag. Meters are registered on first use per
 * destination.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code eventnative.rows.accepted} rows accepted into a buffer or queue</li>
 *   <li>{@code eventnative.rows.backpressure} rows rejected because the buffer or queue was full</li>
 *   <li>{@code eventnative.events.skipped} events dropped by the transform pipeline</li>
 *   <li>{@code eventnative.rows.delivered} rows written</li>
 *   <li>{@code eventnative.writes.retried} failed writes that will be retried</li>
 *   <li>{@code eventnative.rows.failed} rows given up on</li>
 * </ul>
 *
 * <h3>Gauges and timers</h3>
 * <ul>
 *   <li>{@code eventnative.queue.depth} unresolved entries in a stream destination's queue</li>
 *   <li>{@code eventnative.write.duration} adapter write time</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {
  static final String DESTINATION_TAG = "destination";

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Map<String, Counter> counters = new ConcurrentHashMap<>();
  private final Map<String, Timer> timers = new ConcurrentHashMap<>();
  private final Map<String, AtomicLong> depths = new ConcurrentHashMap<>();
  private final List<Meter> meters = new ArrayList<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "eventnative"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "eventnative");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param namePrefix prefix for all meter names (e.g. {@code "tracking.eventnative"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.registry = registry;
    this.namePrefix = namePrefix;
  }

  @Override
  public void incrementAccepted(String destination) {
    increment("rows.accepted", "Rows accepted into a buffer or queue", destination, 1);
  }

  @Override
  public void incrementBackpressure(String destination) {
    increment("rows.backpressure", "Rows rejected because the buffer or queue was full",
        destination, 1);
  }

  @Override
  public void incrementSkipped(String destination) {
    increment("events.skipped", "Events dropped by the transform pipeline", destination, 1);
  }

  @Override
  public void incrementDelivered(String destination, int rows) {
    increment("rows.delivered", "Rows written", destination, rows);
  }

  @Override
  public void incrementRetried(String destination) {
    increment("writes.retried", "Failed writes that will be retried", destination, 1);
  }

  @Override
  public void incrementFailed(String destination, int rows) {
    increment("rows.failed", "Rows given up on", destination, rows);
  }

  @Override
  public void recordQueueDepth(String destination, long depth) {
    if (closed) return;
    depths.computeIfAbsent(destination, d -> {
      AtomicLong value = new AtomicLong();
      track(Gauge.builder(namePrefix + ".queue.depth", value, AtomicLong::get)
          .description("Unresolved entries in the durable queue")
          .tag(DESTINATION_TAG, d)
          .register(registry));
      return value;
    }).set(depth);
  }

  @Override
  public void recordWriteDurationMs(String destination, long durationMs) {
    if (closed) return;
    timers.computeIfAbsent(destination, d -> track(Timer.builder(namePrefix + ".write.duration")
        .description("Destination adapter write time")
        .tag(DESTINATION_TAG, d)
        .register(registry)))
        .record(durationMs, TimeUnit.MILLISECONDS);
  }

  private void increment(String name, String description, String destination, int amount) {
    if (closed) return;
    counters.computeIfAbsent(name + '|' + destination, key -> track(
        Counter.builder(namePrefix + "." + name)
            .description(description)
            .tag(DESTINATION_TAG, destination)
            .register(registry)))
        .increment(amount);
  }

  private <M extends Meter> M track(M meter) {
    synchronized (meters) {
      meters.add(meter);
    }
    return meter;
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the destinations are closed to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> registered;
    synchronized (meters) {
      registered = new ArrayList<>(meters);
      meters.clear();
    }
    RuntimeException first = null;
    for (Meter meter : registered) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
