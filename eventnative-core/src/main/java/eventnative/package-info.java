/**
 * Root API of the event delivery core: reliable delivery of ingested analytics events to
 * independently configured destinations.
 *
 * <h2>Core Design</h2>
 * <p>Every destination owns a {@linkplain eventnative.schema.TransformPipeline transform
 * pipeline} turning a {@link eventnative.RawEvent} into a {@link eventnative.ProcessedRow}, and a
 * {@linkplain eventnative.delivery.StorageProxy storage proxy} delivering rows through its
 * {@linkplain eventnative.spi.DestinationAdapter adapter}. In {@code batch} mode rows are
 * buffered in memory and flushed on a timer or size threshold. In {@code stream} mode rows go
 * to a {@linkplain eventnative.queue.PersistentQueue durable queue} and are written one by one
 * by a retrying worker; queued rows survive restarts and delivery is at-least-once, so
 * destinations should deduplicate by {@link eventnative.ProcessedRow#eventId() eventId}.
 *
 * <p>Every terminal result lands in the {@linkplain eventnative.outcome.OutcomeCache outcome
 * cache}; nothing is dropped without a log line and an outcome.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>eventnative-core</b>: pipeline, queue, proxies, registry and factory</li>
 *   <li><b>eventnative-jdbc</b>: PostgreSQL, Redshift and H2 adapters</li>
 *   <li><b>eventnative-micrometer</b>: {@link eventnative.spi.MetricsExporter} for Micrometer</li>
 *   <li><b>eventnative-spring-boot-starter</b>: auto-configuration from {@code eventnative.*}
 *       properties</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var factory = DestinationFactory.builder()
 *     .logEventPath(Path.of("/var/lib/eventnative/events"))
 *     .registry(DestinationRegistry.discover())
 *     .build();
 *
 * var clicks = new DestinationConfig();
 * clicks.setType("postgres");
 * clicks.setMode("stream");
 * clicks.setParameters(Map.of("url", "jdbc:postgresql://db/analytics"));
 *
 * try (var service = DestinationService.create(factory, Map.of("clicks", clicks))) {
 *   service.route(RawEvent.of("js-token", Map.of("event_type", "click")));
 * }
 * }</pre>
 */
package eventnative;
