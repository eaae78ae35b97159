package eventnative.storage;

import eventnative.BackpressureException;
import eventnative.RawEvent;
import eventnative.TestSupport;
import eventnative.delivery.BatchStorageProxy;
import eventnative.delivery.ProxyState;
import eventnative.delivery.RecordingAdapter;
import eventnative.enrichment.EnrichmentRules;
import eventnative.enrichment.GeoResolver;
import eventnative.enrichment.UserAgentResolver;
import eventnative.outcome.OutcomeCache;
import eventnative.schema.TransformException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DestinationServiceTest {

    @TempDir
    Path dir;

    private final Map<String, RecordingAdapter> adapters = new LinkedHashMap<>();

    private DestinationService newService(Map<String, DestinationConfig> configs, int bufferCapacity) {
        DestinationRegistry registry = new DestinationRegistry().register(DestinationTypes.POSTGRES, spec -> {
            RecordingAdapter adapter = new RecordingAdapter();
            adapters.put(spec.name(), adapter);
            return adapter;
        });
        DestinationFactory factory = DestinationFactory.builder()
                .logEventPath(dir)
                .registry(registry)
                .enrichmentRules(new EnrichmentRules(GeoResolver.NOOP, UserAgentResolver.NOOP))
                .context(TestSupport.context(new OutcomeCache(),
                        TestSupport.fastSettings().batchSize(bufferCapacity).bufferCapacity(bufferCapacity).build()))
                .build();
        return DestinationService.create(factory, configs);
    }

    private static DestinationConfig postgres(String... tokens) {
        DestinationConfig config = new DestinationConfig();
        config.setType(DestinationTypes.POSTGRES);
        config.setOnlyTokens(List.of(tokens));
        return config;
    }

    @Test
    void failedDestinationDoesNotStopOthers() {
        Map<String, DestinationConfig> configs = new LinkedHashMap<>();
        configs.put("good", postgres());
        DestinationConfig broken = postgres();
        broken.setMode("realtime");
        configs.put("broken", broken);
        configs.put("unknown", new DestinationConfig());

        try (DestinationService service = newService(configs, 100)) {
            assertEquals(List.of("good"), List.copyOf(service.proxies().keySet()));
            assertEquals(DestinationConfigException.Kind.INVALID_MODE, service.failures().get("broken").kind());
            assertEquals(DestinationConfigException.Kind.UNKNOWN_TYPE, service.failures().get("unknown").kind());
            assertTrue(service.proxy("broken").isEmpty());
        }
    }

    @Test
    void routesByToken() {
        Map<String, DestinationConfig> configs = new LinkedHashMap<>();
        configs.put("all", postgres());
        configs.put("web_only", postgres("web"));
        configs.put("api_only", postgres("api"));

        try (DestinationService service = newService(configs, 100)) {
            RoutingResult web = service.route(RawEvent.of("web", Map.of("a", 1)));
            assertEquals(List.of("all", "web_only"), web.accepted());
            assertTrue(web.isFullyAccepted());

            RoutingResult anonymous = service.route(RawEvent.of(null, Map.of("a", 1)));
            assertEquals(List.of("all"), anonymous.accepted());
        }
    }

    @Test
    void rejectionByOneDestinationDoesNotBlockOthers() throws Exception {
        Map<String, DestinationConfig> configs = new LinkedHashMap<>();
        configs.put("strict", postgres());
        configs.get("strict").setBreakOnError(true);
        DataLayout layout = new DataLayout();
        layout.setTableNameTemplate("{{.event_type}}");
        configs.get("strict").setDataLayout(layout);
        configs.put("lenient", postgres());

        try (DestinationService service = newService(configs, 100)) {
            RoutingResult result = service.route(RawEvent.of("t", Map.of("a", 1)));

            assertEquals(List.of("lenient"), result.accepted());
            assertInstanceOf(TransformException.class, result.rejected().get("strict"));
        }
    }

    @Test
    void backpressureReportedPerDestination() throws Exception {
        Map<String, DestinationConfig> configs = new LinkedHashMap<>();
        configs.put("pg", postgres());

        try (DestinationService service = newService(configs, 1)) {
            CountDownLatch gate = new CountDownLatch(1);
            CountDownLatch entered = new CountDownLatch(1);
            adapters.get("pg").blockOn(gate, entered);

            assertEquals(List.of("pg"), service.route(RawEvent.of("t", Map.of("i", 1))).accepted());
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            assertEquals(List.of("pg"), service.route(RawEvent.of("t", Map.of("i", 2))).accepted());

            RoutingResult rejected = service.route(RawEvent.of("t", Map.of("i", 3)));
            assertFalse(rejected.isFullyAccepted());
            assertInstanceOf(BackpressureException.class, rejected.rejected().get("pg"));
            gate.countDown();
        }
    }

    @Test
    void closeClosesEveryDestination() {
        Map<String, DestinationConfig> configs = new LinkedHashMap<>();
        configs.put("a", postgres());
        configs.put("b", postgres());

        DestinationService service = newService(configs, 100);
        service.route(RawEvent.of("t", "e1", Map.of("x", 1)));
        service.close();

        assertTrue(adapters.get("a").isClosed());
        assertTrue(adapters.get("b").isClosed());
        assertEquals(1, adapters.get("a").rows().size());
        assertEquals(ProxyState.CLOSED, service.proxy("b").get().state());
        assertInstanceOf(BatchStorageProxy.class, service.proxy("a").get());
    }
}
