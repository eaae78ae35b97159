package eventnative.schema;

import eventnative.ProcessedRow;
import eventnative.RawEvent;
import eventnative.enrichment.EnrichmentException;
import eventnative.enrichment.EnrichmentRule;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TransformPipelineTest {

    private static final EnrichmentRule FAILING = new EnrichmentRule() {
        @Override
        public String name() {
            return "failing";
        }

        @Override
        public void execute(Map<String, Object> event) throws EnrichmentException {
            throw new EnrichmentException("boom");
        }
    };

    private static final EnrichmentRule TAGGING = new EnrichmentRule() {
        @Override
        public String name() {
            return "tagging";
        }

        @Override
        public void execute(Map<String, Object> event) {
            event.put("tag", "seen");
        }
    };

    private static RawEvent event() {
        return RawEvent.of("t", "e1", Map.of("id", 7, "event_type", "click", "ctx", Map.of("ip", "1.1.1.1")));
    }

    @Test
    void identityPipelineFlattensIntoDefaultTable() throws Exception {
        ProcessedRow row = TransformPipeline.builder("d").build().process(event());

        assertEquals("e1", row.eventId());
        assertEquals("events", row.tableName());
        assertEquals(Map.of("id", 7L, "event_type", "click", "ctx_ip", "1.1.1.1"), row.columns());
        assertTrue(row.primaryKeyFields().isEmpty());
    }

    @Test
    void rulesRunInOrderBeforeTableResolution() throws Exception {
        ProcessedRow row = TransformPipeline.builder("d")
                .rules(List.of(TAGGING))
                .tableNames(new TableNameExtractor("t_{{.tag}}"))
                .build()
                .process(event());

        assertEquals("t_seen", row.tableName());
        assertEquals("seen", row.columns().get("tag"));
    }

    @Test
    void enrichmentFailureIgnoredWithoutBreakOnError() throws Exception {
        ProcessedRow row = TransformPipeline.builder("d")
                .rules(List.of(FAILING, TAGGING))
                .build()
                .process(event());

        assertEquals("seen", row.columns().get("tag"));
    }

    @Test
    void enrichmentFailureRejectsEventWithBreakOnError() {
        TransformPipeline pipeline = TransformPipeline.builder("d")
                .rules(List.of(FAILING))
                .breakOnError(true)
                .build();

        TransformException e = assertThrows(TransformException.class, () -> pipeline.process(event()));
        assertEquals("e1", e.eventId());
        assertTrue(e.getMessage().contains("failing"));
    }

    @Test
    void emptyTableNameRejected() {
        TransformPipeline pipeline = TransformPipeline.builder("d")
                .tableNames(new TableNameExtractor("{{.missing}}"))
                .build();
        assertThrows(TransformException.class, () -> pipeline.process(event()));
    }

    @Test
    void primaryKeysLimitedToPresentColumns() throws Exception {
        ProcessedRow row = TransformPipeline.builder("d")
                .primaryKeyFields(List.of("id", "absent", "ctx_ip"))
                .build()
                .process(event());

        assertEquals(Set.of("id", "ctx_ip"), row.primaryKeyFields());
        assertFalse(row.primaryKeyFields().contains("absent"));
    }

    @Test
    void mappingAppliedBeforeFlattening() throws Exception {
        ProcessedRow row = TransformPipeline.builder("d")
                .mapper(new LegacyFieldMapper(List.of("/ctx/ip -> /client_ip"), FieldMappingType.STRICT))
                .build()
                .process(event());

        assertEquals(Map.of("client_ip", "1.1.1.1"), row.columns());
    }

    @Test
    void sourceEventIsNotModified() throws Exception {
        RawEvent event = event();
        TransformPipeline.builder("d").rules(List.of(TAGGING)).build().process(event);
        assertFalse(event.fields().containsKey("tag"));
    }
}
