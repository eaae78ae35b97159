package eventnative.spring.boot;

import eventnative.delivery.DeliveryContext;
import eventnative.enrichment.UserAgentResolver;
import eventnative.micrometer.MicrometerMetricsExporter;
import eventnative.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.*;

class EventNativeMicrometerAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(EventNativeMicrometerAutoConfiguration.class))
      .withUserConfiguration(MeterRegistryConfig.class);

  @Test
  void createsMicrometerExporterByDefault() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("micrometerMetricsExporter"));
      assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
    });
  }

  @Test
  void respectsCustomNamePrefix() {
    runner.withPropertyValues("eventnative.metrics.name-prefix=tracking").run(ctx -> {
      ctx.getBean(MetricsExporter.class).incrementAccepted("pg");
      var registry = ctx.getBean(MeterRegistry.class);
      assertNotNull(registry.find("tracking.rows.accepted").tag("destination", "pg").counter());
    });
  }

  @Test
  void disabledWhenPropertyFalse() {
    runner.withPropertyValues("eventnative.metrics.enabled=false").run(ctx -> {
      assertFalse(ctx.containsBean("micrometerMetricsExporter"));
    });
  }

  @Test
  void backsOffWhenCustomMetricsExporterPresent() {
    runner.withUserConfiguration(CustomExporterConfig.class).run(ctx -> {
      assertFalse(ctx.getBean(MetricsExporter.class) instanceof MicrometerMetricsExporter);
    });
  }

  @Test
  void notLoadedWithoutMeterRegistry() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(EventNativeMicrometerAutoConfiguration.class))
        .run(ctx -> assertFalse(ctx.containsBean("micrometerMetricsExporter")));
  }

  @Test
  void exporterReachesDeliveryContext() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(
            EventNativeMicrometerAutoConfiguration.class, EventNativeAutoConfiguration.class))
        .withUserConfiguration(MeterRegistryConfig.class)
        .withBean(UserAgentResolver.class, () -> UserAgentResolver.NOOP)
        .withPropertyValues("eventnative.log-path=" + System.getProperty("java.io.tmpdir"))
        .run(ctx -> assertInstanceOf(MicrometerMetricsExporter.class,
            ctx.getBean(DeliveryContext.class).metrics()));
  }

  @Configuration
  static class MeterRegistryConfig {
    @Bean
    MeterRegistry meterRegistry() {
      return new SimpleMeterRegistry();
    }
  }

  @Configuration
  static class CustomExporterConfig {
    @Bean
    MetricsExporter customExporter() {
      return MetricsExporter.NOOP;
    }
  }
}
