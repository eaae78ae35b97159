package eventnative.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void countersAreTaggedPerDestination() {
    exporter.incrementAccepted("pg");
    exporter.incrementAccepted("pg");
    exporter.incrementAccepted("ch");

    assertEquals(2.0, counter("eventnative.rows.accepted", "pg").count());
    assertEquals(1.0, counter("eventnative.rows.accepted", "ch").count());
  }

  @Test
  void rowCountersAddBatchSizes() {
    exporter.incrementDelivered("pg", 100);
    exporter.incrementDelivered("pg", 5);
    exporter.incrementFailed("pg", 7);

    assertEquals(105.0, counter("eventnative.rows.delivered", "pg").count());
    assertEquals(7.0, counter("eventnative.rows.failed", "pg").count());
  }

  @Test
  void eventCounters() {
    exporter.incrementBackpressure("pg");
    exporter.incrementSkipped("pg");
    exporter.incrementRetried("pg");

    assertEquals(1.0, counter("eventnative.rows.backpressure", "pg").count());
    assertEquals(1.0, counter("eventnative.events.skipped", "pg").count());
    assertEquals(1.0, counter("eventnative.writes.retried", "pg").count());
  }

  @Test
  void recordQueueDepth() {
    exporter.recordQueueDepth("pg", 42);
    assertEquals(42.0, gauge("eventnative.queue.depth", "pg").value());

    exporter.recordQueueDepth("pg", 0);
    assertEquals(0.0, gauge("eventnative.queue.depth", "pg").value());
  }

  @Test
  void recordWriteDuration() {
    exporter.recordWriteDurationMs("pg", 15);
    exporter.recordWriteDurationMs("pg", 25);

    Timer timer = registry.find("eventnative.write.duration").tag("destination", "pg").timer();
    assertNotNull(timer);
    assertEquals(2, timer.count());
    assertEquals(40.0, timer.totalTime(TimeUnit.MILLISECONDS));
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "tracking.eventnative");
    custom.incrementAccepted("pg");
    custom.recordQueueDepth("pg", 10);

    assertEquals(1.0, counter("tracking.eventnative.rows.accepted", "pg").count());
    assertEquals(10.0, gauge("tracking.eventnative.queue.depth", "pg").value());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterCalls() {
    exporter.incrementAccepted("pg");
    exporter.recordQueueDepth("pg", 3);

    exporter.close();
    exporter.incrementAccepted("pg");

    assertNull(registry.find("eventnative.rows.accepted").counter());
    assertNull(registry.find("eventnative.queue.depth").gauge());
  }

  @Test
  void invalidPrefixThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "x."));
  }

  private Counter counter(String name, String destination) {
    Counter c = registry.find(name).tag("destination", destination).counter();
    assertNotNull(c, "Counter not found: " + name + " " + destination);
    return c;
  }

  private Gauge gauge(String name, String destination) {
    Gauge g = registry.find(name).tag("destination", destination).gauge();
    assertNotNull(g, "Gauge not found: " + name + " " + destination);
    return g;
  }
}
