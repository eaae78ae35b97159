package eventnative.spring.boot;

import eventnative.storage.DestinationConfig;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventNativePropertiesTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(PropsConfig.class);

  @Test
  void defaultValues() {
    runner.run(ctx -> {
      var props = ctx.getBean(EventNativeProperties.class);
      assertEquals("./logs/events", props.getLogPath());
      assertEquals(100, props.getOutcomeCacheCapacity());
      assertTrue(props.getDestinations().isEmpty());
      assertEquals(10, props.getDelivery().getMaxAttempts());
      assertEquals(1000, props.getDelivery().getBatchSize());
      assertEquals(10_000, props.getDelivery().getBufferCapacity());
      assertEquals(60_000, props.getDelivery().getFlushIntervalMs());
      assertEquals(5000, props.getDelivery().getDrainTimeoutMs());
      assertEquals(100, props.getDelivery().getPollTimeoutMs());
      assertEquals(1L << 30, props.getDelivery().getQueueMaxBytes());
      assertEquals(16L << 20, props.getDelivery().getQueueSegmentBytes());
      assertEquals(200, props.getRetry().getBaseDelayMs());
      assertEquals(60_000, props.getRetry().getMaxDelayMs());
      assertTrue(props.getMetrics().isEnabled());
      assertEquals("eventnative", props.getMetrics().getNamePrefix());
    });
  }

  @Test
  void destinationBinding() {
    runner.withPropertyValues(
        "eventnative.destinations.pg.type=postgres",
        "eventnative.destinations.pg.mode=stream",
        "eventnative.destinations.pg.break-on-error=true",
        "eventnative.destinations.pg.only-tokens=a,b",
        "eventnative.destinations.pg.parameters.host=db",
        "eventnative.destinations.pg.data-layout.primary-key-fields[0]=eventn_ctx_event_id",
        "eventnative.destinations.pg.data-layout.mappings.keep-unmapped=false",
        "eventnative.destinations.pg.data-layout.mappings.fields[0].src=/amount",
        "eventnative.destinations.pg.data-layout.mappings.fields[0].dst=/amount",
        "eventnative.destinations.pg.data-layout.mappings.fields[0].action=move",
        "eventnative.destinations.pg.enrichment[0].name=ip_lookup",
        "eventnative.destinations.pg.enrichment[0].from=/ip",
        "eventnative.destinations.pg.enrichment[0].to=/geo",
        "eventnative.metrics.enabled=false"
    ).run(ctx -> {
      var props = ctx.getBean(EventNativeProperties.class);
      DestinationConfig pg = props.getDestinations().get("pg");
      assertEquals("postgres", pg.getType());
      assertEquals("stream", pg.getMode());
      assertTrue(pg.isBreakOnError());
      assertEquals(List.of("a", "b"), pg.getOnlyTokens());
      assertEquals("db", pg.getParameters().get("host"));
      assertEquals(List.of("eventn_ctx_event_id"), pg.getDataLayout().getPrimaryKeyFields());
      assertFalse(pg.getDataLayout().getMappings().keepsUnmapped());
      assertEquals("move", pg.getDataLayout().getMappings().getFields().get(0).getAction());
      assertEquals("ip_lookup", pg.getEnrichment().get(0).getName());
      assertFalse(props.getMetrics().isEnabled());
    });
  }

  @Configuration
  @EnableConfigurationProperties(EventNativeProperties.class)
  static class PropsConfig {
  }
}
