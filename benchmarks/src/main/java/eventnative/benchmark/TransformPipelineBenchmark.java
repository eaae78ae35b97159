package eventnative.benchmark;

import eventnative.ProcessedRow;
import eventnative.RawEvent;
import eventnative.enrichment.EnrichmentRules;
import eventnative.enrichment.GeoResolver;
import eventnative.enrichment.UapUserAgentResolver;
import eventnative.schema.FieldMappers;
import eventnative.schema.FieldMappingType;
import eventnative.schema.TableNameExtractor;
import eventnative.schema.TransformException;
import eventnative.schema.TransformPipeline;
import org.openjdk.jmh.annotations.*;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Measures per-event transform cost: default enrichment, legacy mapping, table name
 * extraction and flattening.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar TransformPipelineBenchmark}
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class TransformPipelineBenchmark {

  private TransformPipeline pipeline;
  private Map<String, Object> fields;

  @Setup(Level.Trial)
  public void setup() {
    EnrichmentRules rules = new EnrichmentRules(GeoResolver.NOOP, UapUserAgentResolver.create());
    pipeline = TransformPipeline.builder("bench")
        .rules(rules.defaults())
        .mapper(FieldMappers.create(FieldMappingType.DEFAULT,
            List.of("/eventn_ctx/user_agent ->", "/page/url -> /url"), null).mapper())
        .tableNames(new TableNameExtractor("{{.event_type}}_events"))
        .build();
    fields = Map.of(
        "event_type", "pageview",
        "source_ip", "10.0.0.1",
        "page", Map.of("url", "https://example.com/pricing", "title", "Pricing"),
        "eventn_ctx", Map.of(
            "event_id", "evt-1",
            "user_agent", "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 "
                + "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
            "screen", Map.of("width", 1920, "height", 1080)));
  }

  @Benchmark
  public ProcessedRow process() throws TransformException {
    return pipeline.process(RawEvent.of("token", fields));
  }
}
