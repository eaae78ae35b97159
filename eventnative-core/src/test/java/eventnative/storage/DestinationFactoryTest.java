package eventnative.storage;

import eventnative.DeliveryMode;
import eventnative.RawEvent;
import eventnative.TestSupport;
import eventnative.delivery.BatchStorageProxy;
import eventnative.delivery.DeliverySettings;
import eventnative.delivery.RecordingAdapter;
import eventnative.delivery.StorageProxy;
import eventnative.delivery.StreamStorageProxy;
import eventnative.enrichment.EnrichmentRules;
import eventnative.enrichment.GeoResolver;
import eventnative.enrichment.RuleConfig;
import eventnative.enrichment.UserAgentResolver;
import eventnative.outcome.DeliveryOutcome;
import eventnative.outcome.DeliveryStatus;
import eventnative.outcome.OutcomeCache;
import eventnative.queue.PersistentQueue;
import eventnative.schema.FieldMappingType;
import eventnative.schema.Mapping;
import eventnative.schema.MappingRule;
import eventnative.schema.TransformException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DestinationFactoryTest {

    @TempDir
    Path dir;

    private final RecordingAdapter adapter = new RecordingAdapter();
    private final AtomicReference<DestinationSpec> lastSpec = new AtomicReference<>();
    private final OutcomeCache outcomes = new OutcomeCache();
    private final DeliverySettings settings = TestSupport.fastSettings().build();

    private DestinationFactory newFactory() {
        DestinationRegistry registry = new DestinationRegistry()
                .register(DestinationTypes.POSTGRES, spec -> {
                    lastSpec.set(spec);
                    return adapter;
                })
                .register(DestinationTypes.CLICKHOUSE, spec -> {
                    throw new IllegalArgumentException("parameter 'dsn' is required");
                });
        return DestinationFactory.builder()
                .logEventPath(dir)
                .registry(registry)
                .enrichmentRules(new EnrichmentRules(GeoResolver.NOOP, UserAgentResolver.NOOP))
                .context(TestSupport.context(outcomes, settings))
                .build();
    }

    private static DestinationConfig config(String type, String mode) {
        DestinationConfig config = new DestinationConfig();
        config.setType(type);
        config.setMode(mode);
        return config;
    }

    private static DestinationConfigException.Kind kindOf(Runnable action) {
        return assertThrows(DestinationConfigException.class, action::run).kind();
    }

    // ── Builder validation ──────────────────────────────────────────

    @Test
    void requiresPathAndRegistry() {
        assertThrows(NullPointerException.class,
                () -> DestinationFactory.builder().registry(new DestinationRegistry()).build());
        assertThrows(NullPointerException.class,
                () -> DestinationFactory.builder().logEventPath(dir).build());
    }

    // ── Defaults ────────────────────────────────────────────────────

    @Test
    void typeDefaultsToNameAndModeToBatch() {
        try (StorageProxy proxy = newFactory().create("postgres", new DestinationConfig())) {
            assertInstanceOf(BatchStorageProxy.class, proxy);
            assertEquals(DeliveryMode.BATCH, proxy.mode());
            DestinationSpec spec = lastSpec.get();
            assertEquals("postgres", spec.type());
            assertEquals("events", spec.tableNameTemplate());
            assertEquals(FieldMappingType.DEFAULT, spec.mappingType());
        }
    }

    @Test
    void resolveDoesNotOpenAnything() {
        DestinationSpec spec = newFactory().resolve("clicks", config("postgres", "stream"));
        assertEquals(DeliveryMode.STREAM, spec.mode());
        assertFalse(Files.exists(dir.resolve(PersistentQueue.directoryName("clicks"))));
        assertNull(lastSpec.get());
    }

    @Test
    void castsExposedOnSpec() {
        DestinationConfig config = config("postgres", null);
        DataLayout layout = new DataLayout();
        layout.setMappings(new Mapping(true, List.of(MappingRule.cast("/eventn_ctx/utc_time", "timestamp"))));
        layout.setPrimaryKeyFields(List.of("eventn_ctx_event_id"));
        config.setDataLayout(layout);
        config.setParameters(Map.of("host", "localhost"));

        DestinationSpec spec = newFactory().resolve("pg", config);

        assertEquals(Map.of("eventn_ctx_utc_time", "timestamp"), spec.sqlTypeCasts());
        assertEquals(List.of("eventn_ctx_event_id"), spec.primaryKeyFields());
        assertEquals("localhost", spec.requiredParameter("host"));
        assertEquals("5432", spec.parameter("port", "5432"));
        assertThrows(IllegalArgumentException.class, () -> spec.requiredParameter("db"));
    }

    // ── Validation ──────────────────────────────────────────────────

    @Test
    void unknownModeListsAvailableModes() {
        DestinationConfigException e = assertThrows(DestinationConfigException.class,
                () -> newFactory().create("pg", config("postgres", "realtime")));
        assertEquals(DestinationConfigException.Kind.INVALID_MODE, e.kind());
        assertEquals("pg", e.destination());
        assertTrue(e.getMessage().contains("batch"));
        assertTrue(e.getMessage().contains("stream"));
    }

    @Test
    void invalidEnrichmentRuleRejected() {
        DestinationConfig config = config("postgres", "batch");
        config.setEnrichment(List.of(new RuleConfig("weather_lookup", "/a", "/b")));

        DestinationConfigException e = assertThrows(DestinationConfigException.class,
                () -> newFactory().create("pg", config));
        assertEquals(DestinationConfigException.Kind.INVALID_ENRICHMENT, e.kind());
        assertTrue(e.getMessage().contains("Name: weather_lookup"));
    }

    @Test
    void bothMappingStylesRejected() {
        DestinationConfig config = config("postgres", "batch");
        DataLayout layout = new DataLayout();
        layout.setMapping(List.of("/a -> /b"));
        layout.setMappings(new Mapping(false, List.of(MappingRule.move("/c", "/d"))));
        config.setDataLayout(layout);

        assertEquals(DestinationConfigException.Kind.INVALID_MAPPING, kindOf(() -> newFactory().create("pg", config)));
    }

    @Test
    void malformedTableTemplateRejected() {
        DestinationConfig config = config("postgres", "batch");
        DataLayout layout = new DataLayout();
        layout.setTableNameTemplate("events_{{event_type");
        config.setDataLayout(layout);

        assertEquals(DestinationConfigException.Kind.INVALID_MAPPING, kindOf(() -> newFactory().create("pg", config)));
    }

    @Test
    void unknownTypeReleasesQueue() {
        DestinationConfigException e = assertThrows(DestinationConfigException.class,
                () -> newFactory().create("lake", config("parquet", "stream")));
        assertEquals(DestinationConfigException.Kind.UNKNOWN_TYPE, e.kind());
        assertTrue(e.getMessage().contains("parquet"));

        PersistentQueue.builder(dir, "lake").open().close();
    }

    @Test
    void adapterInitFailureReleasesQueue() {
        DestinationConfigException e = assertThrows(DestinationConfigException.class,
                () -> newFactory().create("ch", config("clickhouse", "stream")));
        assertEquals(DestinationConfigException.Kind.ADAPTER_INIT, e.kind());
        assertTrue(e.getMessage().contains("dsn"));

        PersistentQueue.builder(dir, "ch").open().close();
    }

    @Test
    void lockedQueueDirectoryFailsQueueInit() {
        try (PersistentQueue held = PersistentQueue.builder(dir, "pg").open()) {
            assertEquals(DestinationConfigException.Kind.QUEUE_INIT,
                    kindOf(() -> newFactory().create("pg", config("postgres", "stream"))));
        }
    }

    // ── End to end ──────────────────────────────────────────────────

    @Test
    void streamDestinationWithoutLayoutDeliversToEventsTable() throws Exception {
        adapter.failNext(new RuntimeException("connection refused"));
        try (StorageProxy proxy = newFactory().create("pg_stream", config("postgres", "stream"))) {
            assertInstanceOf(StreamStorageProxy.class, proxy);
            assertTrue(Files.isDirectory(dir.resolve("queue.dst=pg_stream")));

            RawEvent event = RawEvent.of("token", Map.of(
                    "eventn_ctx", Map.of("event_id", "evt-1", "user_agent", "curl/8.0"),
                    "source_ip", "1.2.3.4",
                    "amount", 3));
            assertTrue(proxy.consume(event));

            TestSupport.awaitTrue(() -> outcomes.lookup("pg_stream", "evt-1")
                    .map(o -> o.status() == DeliveryStatus.SUCCESS).orElse(false), "delivery");

            DeliveryOutcome outcome = outcomes.lookup("pg_stream", "evt-1").get();
            assertEquals(1, outcome.retries());
            assertEquals("events", outcome.tableName());
            assertEquals(1, outcomes.recent("pg_stream", 10).stream()
                    .filter(o -> o.status() == DeliveryStatus.SUCCESS).count());

            assertEquals(1, adapter.rows().size());
            Map<String, Object> columns = adapter.rows().get(0).columns();
            assertEquals("evt-1", columns.get("eventn_ctx_event_id"));
            assertEquals(3L, columns.get("amount"));
            assertNotNull(columns.get("source_ip"));
        }
    }

    @Test
    void breakOnErrorRejectsOnlyFailingEvent() throws Exception {
        DestinationFactory factory = DestinationFactory.builder()
                .logEventPath(dir)
                .registry(new DestinationRegistry().register(DestinationTypes.POSTGRES, spec -> adapter))
                .enrichmentRules(new EnrichmentRules(ip -> {
                    if ("6.6.6.6".equals(ip)) {
                        throw new IllegalStateException("lookup failed");
                    }
                    return null;
                }, UserAgentResolver.NOOP))
                .context(TestSupport.context(outcomes, settings))
                .build();
        DestinationConfig config = config("postgres", "batch");
        config.setBreakOnError(true);

        try (StorageProxy proxy = factory.create("pg", config)) {
            assertThrows(TransformException.class,
                    () -> proxy.consume(RawEvent.of("t", "bad", Map.of("source_ip", "6.6.6.6"))));
            assertTrue(proxy.consume(RawEvent.of("t", "good", Map.of("source_ip", "8.8.8.8"))));
            ((BatchStorageProxy) proxy).flush();

            assertEquals(List.of("good"), adapter.rows().stream().map(r -> r.eventId()).toList());
            assertEquals(DeliveryStatus.SKIPPED, outcomes.lookup("pg", "bad").get().status());
        }
    }
}
