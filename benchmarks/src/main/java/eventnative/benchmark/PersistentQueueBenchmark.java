package eventnative.benchmark;

import eventnative.ProcessedRow;
import eventnative.queue.PersistentQueue;
import eventnative.queue.QueueDelivery;
import eventnative.queue.QueueEntry;
import org.openjdk.jmh.annotations.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Measures durable queue round trips: enqueue, dequeue and ack of one row.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar PersistentQueueBenchmark}
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class PersistentQueueBenchmark {

  @Param({"100", "1000", "10000"})
  private int payloadSize;

  private Path directory;
  private PersistentQueue queue;
  private ProcessedRow row;

  @Setup(Level.Trial)
  public void setup() throws IOException {
    directory = Files.createTempDirectory("eventnative-bench");
    queue = PersistentQueue.builder(directory, "bench").open();
    row = new ProcessedRow("evt-1", "events",
        Map.of("eventn_ctx_event_id", "evt-1", "payload", "x".repeat(payloadSize)), Set.of());
  }

  @Benchmark
  public QueueEntry enqueueDequeueAck() throws InterruptedException {
    queue.enqueue(QueueEntry.of("bench", row));
    QueueDelivery delivery = queue.dequeue(1, TimeUnit.SECONDS);
    delivery.ack();
    return delivery.entry();
  }

  @TearDown(Level.Trial)
  public void tearDown() throws IOException {
    queue.close();
    try (Stream<Path> paths = Files.walk(directory)) {
      paths.sorted(Comparator.reverseOrder()).forEach(path -> path.toFile().delete());
    }
  }
}
