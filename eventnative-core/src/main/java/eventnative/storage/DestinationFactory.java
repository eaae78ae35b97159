package eventnative.storage;

import eventnative.DeliveryMode;
import eventnative.delivery.BatchStorageProxy;
import eventnative.delivery.DeliveryContext;
import eventnative.delivery.DeliverySettings;
import eventnative.delivery.StorageProxy;
import eventnative.delivery.StreamStorageProxy;
import eventnative.enrichment.EnrichmentRule;
import eventnative.enrichment.EnrichmentRules;
import eventnative.enrichment.GeoResolver;
import eventnative.enrichment.RuleConfig;
import eventnative.enrichment.UapUserAgentResolver;
import eventnative.outcome.OutcomeCache;
import eventnative.queue.PersistentQueue;
import eventnative.queue.QueueStorageException;
import eventnative.schema.FieldMapper;
import eventnative.schema.FieldMappers;
import eventnative.schema.FieldMappingType;
import eventnative.schema.MapperSetup;
import eventnative.schema.Mapping;
import eventnative.schema.TableNameExtractor;
import eventnative.schema.TransformPipeline;
import eventnative.spi.DestinationAdapter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds a ready {@link StorageProxy} from a destination's configuration.
 *
 * <p>Construction resolves defaults (type from the name, {@code batch} mode, {@code events}
 * table), validates the mode, enrichment rules and field mapping, assembles the transform
 * pipeline, opens the durable queue for stream mode, then creates the adapter through the
 * {@link DestinationRegistry}. Any failure throws {@link DestinationConfigException} after
 * releasing the queue, so a rejected destination leaves nothing open.
 *
 * @see Builder
 */
public final class DestinationFactory {
  private static final Logger logger = Logger.getLogger(DestinationFactory.class.getName());

  private final Path logEventPath;
  private final DestinationRegistry registry;
  private final EnrichmentRules enrichmentRules;
  private final DeliveryContext context;

  private DestinationFactory(Builder builder) {
    this.logEventPath = Objects.requireNonNull(builder.logEventPath, "logEventPath");
    this.registry = Objects.requireNonNull(builder.registry, "registry");
    this.enrichmentRules = builder.enrichmentRules != null
        ? builder.enrichmentRules
        : new EnrichmentRules(GeoResolver.NOOP, UapUserAgentResolver.create());
    this.context = builder.context != null
        ? builder.context
        : DeliveryContext.of(new OutcomeCache(), DeliverySettings.defaults());
  }

  public static Builder builder() {
    return new Builder();
  }

  public DeliveryContext context() {
    return context;
  }

  /**
   * Resolves and validates a configuration without opening any resource.
   *
   * @throws DestinationConfigException with kind {@code INVALID_MODE}, {@code INVALID_ENRICHMENT}
   *                                    or {@code INVALID_MAPPING}
   */
  public DestinationSpec resolve(String name, DestinationConfig config) {
    return prepare(name, config).spec;
  }

  /**
   * Builds the destination.
   *
   * @param name   destination name, unique per process
   * @param config its configuration
   * @return a started proxy
   * @throws DestinationConfigException if the configuration is invalid or a resource cannot be
   *                                    created
   */
  public StorageProxy create(String name, DestinationConfig config) {
    Prepared prepared = prepare(name, config);
    DestinationSpec spec = prepared.spec;

    PersistentQueue queue = null;
    if (spec.mode() == DeliveryMode.STREAM) {
      try {
        queue = PersistentQueue.builder(logEventPath, name)
            .maxBytes(context.settings().queueMaxBytes())
            .segmentBytes(context.settings().queueSegmentBytes())
            .maxRetries(context.settings().maxRetries())
            .open();
      } catch (QueueStorageException e) {
        throw new DestinationConfigException(DestinationConfigException.Kind.QUEUE_INIT, name,
            "Error creating queue: " + e.getMessage(), e);
      }
    }

    AdapterFactory factory = registry.find(spec.type()).orElse(null);
    if (factory == null) {
      DestinationConfigException error = new DestinationConfigException(
          DestinationConfigException.Kind.UNKNOWN_TYPE, name,
          "Unknown destination type: " + spec.type() + ". Available types: " + registry.types());
      closeQueue(queue, error);
      throw error;
    }

    DestinationAdapter adapter;
    try {
      adapter = factory.create(spec);
      if (adapter == null) {
        throw new IllegalStateException("adapter factory returned null");
      }
    } catch (Exception e) {
      DestinationConfigException error = new DestinationConfigException(
          DestinationConfigException.Kind.ADAPTER_INIT, name,
          "Error initializing " + spec.type() + " adapter: " + e.getMessage(), e);
      closeQueue(queue, error);
      throw error;
    }

    StorageProxy proxy = queue != null
        ? new StreamStorageProxy(name, prepared.pipeline, adapter, queue, context)
        : new BatchStorageProxy(name, prepared.pipeline, adapter, context);
    logger.log(Level.INFO, "[{0}] Destination of type {1} initialized in {2} mode",
        new Object[]{name, spec.type(), spec.mode().id()});
    return proxy;
  }

  private Prepared prepare(String name, DestinationConfig config) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(config, "config");

    String type = isBlank(config.getType()) ? name : config.getType().trim();
    String modeId = isBlank(config.getMode()) ? DeliveryMode.BATCH.id() : config.getMode().trim();
    logger.log(Level.INFO, "[{0}] Initializing destination of type: {1} in mode: {2}",
        new Object[]{name, type, modeId});

    DeliveryMode mode = DeliveryMode.fromId(modeId).orElseThrow(() ->
        new DestinationConfigException(DestinationConfigException.Kind.INVALID_MODE, name,
            "Unknown destination mode: " + modeId + ". Available mode: ["
                + DeliveryMode.BATCH.id() + ", " + DeliveryMode.STREAM.id() + "]"));

    DataLayout layout = config.getDataLayout() != null ? config.getDataLayout() : new DataLayout();
    String tableTemplate = layout.getTableNameTemplate();
    if (isBlank(tableTemplate)) {
      logger.log(Level.INFO, "[{0}] uses default table name: {1}",
          new Object[]{name, TableNameExtractor.DEFAULT_TABLE_NAME});
      tableTemplate = TableNameExtractor.DEFAULT_TABLE_NAME;
    }

    List<EnrichmentRule> rules = new ArrayList<>(enrichmentRules.defaults());
    List<RuleConfig> ruleConfigs = config.getEnrichment();
    if (ruleConfigs.isEmpty()) {
      logger.log(Level.WARNING, "[{0}] doesn't have enrichment rules", name);
    } else {
      logger.log(Level.INFO, "[{0}] Configured enrichment rules:", name);
    }
    for (RuleConfig ruleConfig : ruleConfigs) {
      logger.log(Level.INFO, "[{0}] {1}", new Object[]{name, ruleConfig});
      try {
        rules.add(enrichmentRules.create(ruleConfig));
      } catch (IllegalArgumentException e) {
        throw new DestinationConfigException(DestinationConfigException.Kind.INVALID_ENRICHMENT, name,
            "Error creating enrichment rule [" + ruleConfig + "]: " + e.getMessage(), e);
      }
    }

    FieldMappingType mappingType;
    MapperSetup mapper;
    TableNameExtractor tableNames;
    try {
      mappingType = FieldMappingType.parse(layout.getMappingType());
      mapper = FieldMappers.create(mappingType, layout.getMapping(), layout.getMappings());
      tableNames = new TableNameExtractor(tableTemplate);
    } catch (IllegalArgumentException e) {
      throw new DestinationConfigException(DestinationConfigException.Kind.INVALID_MAPPING, name,
          e.getMessage(), e);
    }
    if (mapper.mapper() == FieldMapper.IDENTITY) {
      logger.log(Level.WARNING, "[{0}] doesn't have mapping rules", name);
    } else {
      logger.log(Level.INFO, "[{0}] Configured field mapping rules: {1}", new Object[]{name, mapper.description()});
    }
    if (!mapper.sqlTypeCasts().isEmpty()) {
      logger.log(Level.INFO, "[{0}] SQL type casts: {1}", new Object[]{name, mapper.sqlTypeCasts()});
    }

    TransformPipeline pipeline = TransformPipeline.builder(name)
        .rules(rules)
        .mapper(mapper.mapper())
        .tableNames(tableNames)
        .primaryKeyFields(layout.getPrimaryKeyFields())
        .breakOnError(config.isBreakOnError())
        .build();

    Mapping structured = layout.getMappings() != null && layout.getMappings().isConfigured()
        ? layout.getMappings() : null;
    DestinationSpec spec = new DestinationSpec(name, type, mode, tableTemplate, mappingType,
        layout.getMapping(), structured, ruleConfigs, config.isBreakOnError(),
        layout.getPrimaryKeyFields(), config.getOnlyTokens(), config.getParameters(),
        mapper.sqlTypeCasts());
    return new Prepared(spec, pipeline);
  }

  private static void closeQueue(PersistentQueue queue, DestinationConfigException error) {
    if (queue == null) {
      return;
    }
    try {
      queue.close();
    } catch (RuntimeException e) {
      error.addSuppressed(e);
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private record Prepared(DestinationSpec spec, TransformPipeline pipeline) {
  }

  /** Builder for {@link DestinationFactory}. */
  public static final class Builder {
    private Path logEventPath;
    private DestinationRegistry registry;
    private EnrichmentRules enrichmentRules;
    private DeliveryContext context;

    private Builder() {}

    /**
     * Sets the directory holding the {@code queue.dst=<name>} directories of stream
     * destinations.
     *
     * <p><b>Required.</b>
     *
     * @return this builder
     */
    public Builder logEventPath(Path logEventPath) {
      this.logEventPath = logEventPath;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @return this builder
     */
    public Builder registry(DestinationRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Sets the source of default and configured enrichment rules.
     *
     * <p>Optional. Defaults to no geo resolution and uap-java user agent parsing.
     *
     * @return this builder
     */
    public Builder enrichmentRules(EnrichmentRules enrichmentRules) {
      this.enrichmentRules = enrichmentRules;
      return this;
    }

    /**
     * Sets the outcome cache, monitor keeper, metrics and delivery settings shared by every
     * destination built by this factory.
     *
     * <p>Optional. Defaults to a fresh {@link OutcomeCache}, no locking, no metrics and
     * {@link DeliverySettings#defaults()}.
     *
     * @return this builder
     */
    public Builder context(DeliveryContext context) {
      this.context = context;
      return this;
    }

    public DestinationFactory build() {
      return new DestinationFactory(this);
    }
  }
}
