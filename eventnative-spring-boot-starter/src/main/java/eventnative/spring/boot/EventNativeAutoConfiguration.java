package eventnative.spring.boot;

import eventnative.dead.DeadLetterManager;
import eventnative.delivery.DeliveryContext;
import eventnative.delivery.DeliverySettings;
import eventnative.delivery.ExponentialBackoff;
import eventnative.enrichment.EnrichmentRules;
import eventnative.enrichment.GeoResolver;
import eventnative.enrichment.UapUserAgentResolver;
import eventnative.enrichment.UserAgentResolver;
import eventnative.monitor.LocalMonitorKeeper;
import eventnative.outcome.OutcomeCache;
import eventnative.spi.MetricsExporter;
import eventnative.spi.MonitorKeeper;
import eventnative.storage.DestinationFactory;
import eventnative.storage.DestinationProvider;
import eventnative.storage.DestinationRegistry;
import eventnative.storage.DestinationService;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Auto-configuration for event delivery.
 *
 * <p>Builds a {@link DestinationService} from {@link EventNativeProperties}. Destination types
 * come from {@code ServiceLoader} discovery plus any {@link DestinationProvider} beans; geo and
 * user agent resolvers, the monitor keeper and the metrics exporter may be replaced by beans.
 *
 * @see EventNativeProperties
 * @see EventNativeMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(DestinationService.class)
@EnableConfigurationProperties(EventNativeProperties.class)
public class EventNativeAutoConfiguration {
  private static final Logger logger = Logger.getLogger(EventNativeAutoConfiguration.class.getName());

  @Bean
  @ConditionalOnMissingBean
  public OutcomeCache outcomeCache(EventNativeProperties props) {
    return new OutcomeCache(props.getOutcomeCacheCapacity());
  }

  @Bean
  @ConditionalOnMissingBean(MonitorKeeper.class)
  public LocalMonitorKeeper monitorKeeper() {
    return new LocalMonitorKeeper();
  }

  @Bean
  @ConditionalOnMissingBean
  public DeliverySettings deliverySettings(EventNativeProperties props) {
    EventNativeProperties.Delivery delivery = props.getDelivery();
    return DeliverySettings.builder()
        .maxAttempts(delivery.getMaxAttempts())
        .backoff(new ExponentialBackoff(props.getRetry().getBaseDelayMs(), props.getRetry().getMaxDelayMs()))
        .batchSize(delivery.getBatchSize())
        .bufferCapacity(delivery.getBufferCapacity())
        .flushIntervalMs(delivery.getFlushIntervalMs())
        .drainTimeoutMs(delivery.getDrainTimeoutMs())
        .pollTimeoutMs(delivery.getPollTimeoutMs())
        .queueMaxBytes(delivery.getQueueMaxBytes())
        .queueSegmentBytes(delivery.getQueueSegmentBytes())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public DeliveryContext deliveryContext(OutcomeCache outcomeCache, MonitorKeeper monitorKeeper,
      ObjectProvider<MetricsExporter> metricsProvider, DeliverySettings settings) {
    return new DeliveryContext(outcomeCache, monitorKeeper,
        metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP), settings);
  }

  @Bean
  @ConditionalOnMissingBean
  public DestinationRegistry destinationRegistry(ObjectProvider<DestinationProvider> providers) {
    DestinationRegistry registry = DestinationRegistry.discover(getClass().getClassLoader());
    providers.orderedStream().forEach(provider -> {
      if (registry.find(provider.type()).isPresent()) {
        logger.log(Level.WARNING, "Destination type {0} is already registered, ignoring bean {1}",
            new Object[]{provider.type(), provider.getClass().getName()});
      } else {
        registry.register(provider);
      }
    });
    return registry;
  }

  @Bean
  @ConditionalOnMissingBean
  public EnrichmentRules enrichmentRules(ObjectProvider<GeoResolver> geoResolver,
      ObjectProvider<UserAgentResolver> userAgentResolver) {
    return new EnrichmentRules(
        geoResolver.getIfAvailable(() -> GeoResolver.NOOP),
        userAgentResolver.getIfAvailable(UapUserAgentResolver::create));
  }

  @Bean
  @ConditionalOnMissingBean
  public DestinationFactory destinationFactory(EventNativeProperties props,
      DestinationRegistry destinationRegistry, EnrichmentRules enrichmentRules,
      DeliveryContext deliveryContext) {
    return DestinationFactory.builder()
        .logEventPath(Path.of(props.getLogPath()))
        .registry(destinationRegistry)
        .enrichmentRules(enrichmentRules)
        .context(deliveryContext)
        .build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public DestinationService destinationService(DestinationFactory destinationFactory,
      EventNativeProperties props) {
    return DestinationService.create(destinationFactory, props.getDestinations());
  }

  @Bean
  @ConditionalOnMissingBean
  public DeadLetterManager deadLetterManager(DestinationService destinationService) {
    return new DeadLetterManager(destinationService);
  }
}
