package eventnative.delivery;

import eventnative.BackpressureException;
import eventnative.DeliveryMode;
import eventnative.ProcessedRow;
import eventnative.RawEvent;
import eventnative.TestSupport;
import eventnative.outcome.DeliveryOutcome;
import eventnative.outcome.DeliveryStatus;
import eventnative.outcome.OutcomeCache;
import eventnative.queue.PersistentQueue;
import eventnative.queue.QueueEntry;
import eventnative.schema.TransformPipeline;
import eventnative.spi.DeliveryException;
import eventnative.spi.MonitorKeeper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StreamStorageProxyTest {

    private static final String DEST = "events_stream";

    @TempDir
    Path dir;

    private final OutcomeCache outcomes = new OutcomeCache();
    private final RecordingMetrics metrics = new RecordingMetrics();
    private final RecordingAdapter adapter = new RecordingAdapter();

    private PersistentQueue openQueue(DeliverySettings settings) {
        return PersistentQueue.builder(dir, DEST).maxRetries(settings.maxRetries()).open();
    }

    private StreamStorageProxy newProxy(DeliverySettings settings) {
        return newProxy(openQueue(settings), settings);
    }

    private StreamStorageProxy newProxy(PersistentQueue queue, DeliverySettings settings) {
        return new StreamStorageProxy(DEST, TransformPipeline.builder(DEST).build(), adapter, queue,
                new DeliveryContext(outcomes, MonitorKeeper.NOOP, metrics, settings));
    }

    private static RawEvent event(String id) {
        return RawEvent.of("token", id, Map.of("id", id));
    }

    private boolean hasStatus(String eventId, DeliveryStatus status) {
        return outcomes.lookup(DEST, eventId).map(o -> o.status() == status).orElse(false);
    }

    @Test
    void queueMustBelongToDestination() {
        DeliverySettings settings = TestSupport.fastSettings().build();
        try (PersistentQueue foreign = PersistentQueue.builder(dir, "other").open()) {
            assertThrows(IllegalArgumentException.class, () -> newProxy(foreign, settings));
        }
    }

    // ── Delivery ────────────────────────────────────────────────────

    @Test
    void rowsWrittenOneAtATimeInOrder() throws Exception {
        try (StreamStorageProxy proxy = newProxy(TestSupport.fastSettings().build())) {
            assertEquals(DeliveryMode.STREAM, proxy.mode());
            for (int i = 0; i < 3; i++) {
                assertTrue(proxy.consume(event("e" + i)));
            }
            TestSupport.awaitTrue(() -> hasStatus("e2", DeliveryStatus.SUCCESS), "stream delivery");

            assertEquals(3, adapter.writes().size());
            for (int i = 0; i < 3; i++) {
                assertEquals(1, adapter.writes().get(i).size());
                assertEquals("e" + i, adapter.writes().get(i).get(0).eventId());
            }
            TestSupport.awaitTrue(() -> proxy.queue().get().size() == 0, "queue drained");
            assertEquals(3, metrics.get("delivered", DEST));
        }
    }

    @Test
    void transientFailureRetriedThenDeliveredOnce() throws Exception {
        adapter.failNext(new RuntimeException("connection refused"));
        try (StreamStorageProxy proxy = newProxy(TestSupport.fastSettings().build())) {
            proxy.consume(event("e1"));
            TestSupport.awaitTrue(() -> hasStatus("e1", DeliveryStatus.SUCCESS), "delivery after retry");

            DeliveryOutcome outcome = outcomes.lookup(DEST, "e1").get();
            assertEquals(1, outcome.retries());
            assertEquals(1, adapter.writes().size());
            assertEquals(2, adapter.attempts());
            assertEquals(1, outcomes.recent(DEST, 10).size());
            assertEquals(1, metrics.get("retried", DEST));
        }
    }

    @Test
    void permanentFailureDeadLettersImmediately() throws Exception {
        adapter.failNext(DeliveryException.permanent("relation does not exist", null));
        try (StreamStorageProxy proxy = newProxy(TestSupport.fastSettings().build())) {
            proxy.consume(event("e1"));
            proxy.consume(event("e2"));
            TestSupport.awaitTrue(() -> hasStatus("e2", DeliveryStatus.SUCCESS), "next entry delivered");

            assertEquals(DeliveryStatus.PERMANENT_ERROR, outcomes.lookup(DEST, "e1").get().status());
            PersistentQueue queue = proxy.queue().get();
            assertEquals(1, queue.deadLetterCount());
            assertEquals("relation does not exist", queue.deadLetters(1).get(0).error());
            assertEquals(1, metrics.get("failed", DEST));
        }
    }

    @Test
    void retriesExhaustedDeadLetters() throws Exception {
        adapter.failAlways(new RuntimeException("timeout"));
        try (StreamStorageProxy proxy = newProxy(TestSupport.fastSettings().maxAttempts(2).build())) {
            proxy.consume(event("e1"));
            TestSupport.awaitTrue(() -> hasStatus("e1", DeliveryStatus.PERMANENT_ERROR), "dead letter");

            DeliveryOutcome outcome = outcomes.lookup(DEST, "e1").get();
            assertTrue(outcome.error().startsWith("retries exhausted"));
            assertEquals(2, adapter.attempts());
            assertEquals(1, proxy.queue().get().deadLetterCount());
        }
    }

    // ── Durability ──────────────────────────────────────────────────

    @Test
    void undeliveredEntriesSurviveRestart() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        CountDownLatch entered = new CountDownLatch(1);
        adapter.blockOn(gate, entered);
        DeliverySettings settings = TestSupport.fastSettings().drainTimeoutMs(50).build();
        StreamStorageProxy proxy = newProxy(settings);
        proxy.consume(event("e1"));
        proxy.consume(event("e2"));
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        proxy.close();
        gate.countDown();

        RecordingAdapter second = new RecordingAdapter();
        try (StreamStorageProxy restarted = new StreamStorageProxy(DEST, TransformPipeline.builder(DEST).build(),
                second, openQueue(settings), TestSupport.context(outcomes, settings))) {
            TestSupport.awaitTrue(() -> second.rows().size() == 2, "redelivery after restart");
            assertEquals("e1", second.rows().get(0).eventId());
        }
    }

    @Test
    void fullQueueRejectsEvents() throws Exception {
        DeliverySettings settings = TestSupport.fastSettings().build();
        CountDownLatch gate = new CountDownLatch(1);
        CountDownLatch entered = new CountDownLatch(1);
        adapter.blockOn(gate, entered);
        PersistentQueue queue = PersistentQueue.builder(dir, DEST).maxBytes(400).open();
        try (StreamStorageProxy proxy = newProxy(queue, settings)) {
            proxy.consume(event("e1"));
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            assertThrows(BackpressureException.class, () -> {
                for (int i = 0; i < 10; i++) {
                    proxy.consume(event("x" + i));
                }
            });
            assertEquals(1, metrics.get("backpressure", DEST));
            gate.countDown();
        }
    }

    @Test
    void unreadableQueuePausesBetweenAttempts() throws Exception {
        DeliverySettings settings = TestSupport.fastSettings().pollTimeoutMs(100).build();
        PersistentQueue queue = openQueue(settings);
        queue.enqueue(QueueEntry.of(DEST, new ProcessedRow("e1", "events", Map.of("id", "e1"), null)));
        Path segment = queue.directory().resolve("segment-1.log");
        byte[] bytes = Files.readAllBytes(segment);
        bytes[bytes.length - 1] ^= 0x7f;
        Files.write(segment, bytes);

        AtomicInteger errors = new AtomicInteger();
        Handler counter = new Handler() {
            @Override
            public void publish(LogRecord record) {
                if (record.getLevel() == Level.SEVERE) {
                    errors.incrementAndGet();
                }
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        Logger logger = Logger.getLogger(StreamStorageProxy.class.getName());
        logger.addHandler(counter);
        try (StreamStorageProxy proxy = newProxy(queue, settings)) {
            TestSupport.awaitTrue(() -> errors.get() > 0, "consumer error logged");
            Thread.sleep(500);
            assertTrue(errors.get() <= 10, "errors logged in 500 ms: " + errors.get());
            assertFalse(hasStatus("e1", DeliveryStatus.SUCCESS));
        } finally {
            logger.removeHandler(counter);
        }
    }

    // ── Close ───────────────────────────────────────────────────────

    @Test
    void closeReleasesQueueAndAdapter() throws Exception {
        StreamStorageProxy proxy = newProxy(TestSupport.fastSettings().build());
        PersistentQueue queue = proxy.queue().get();
        proxy.close();
        proxy.close();

        assertTrue(queue.isClosed());
        assertTrue(adapter.isClosed());
        assertEquals(ProxyState.CLOSED, proxy.state());
        assertThrows(IllegalStateException.class, () -> proxy.consume(event("e1")));
        openQueue(TestSupport.fastSettings().build()).close();
    }
}
