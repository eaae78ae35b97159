package eventnative.schema;

import eventnative.ProcessedRow;
import eventnative.RawEvent;
import eventnative.enrichment.EnrichmentException;
import eventnative.enrichment.EnrichmentRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns raw events into rows for one destination: enrichment, table name, field mapping,
 * flattening, then primary keys.
 *
 * <p>Processing is a pure function of the event and the pipeline configuration. Instances are
 * immutable and safe to share across ingestion threads.
 */
public final class TransformPipeline {
  private static final Logger logger = Logger.getLogger(TransformPipeline.class.getName());

  private final String destination;
  private final List<EnrichmentRule> rules;
  private final FieldMapper mapper;
  private final TableNameExtractor tableNames;
  private final Flattener flattener;
  private final List<String> primaryKeyFields;
  private final boolean breakOnError;

  private TransformPipeline(Builder builder) {
    this.destination = Objects.requireNonNull(builder.destination, "destination");
    this.rules = Collections.unmodifiableList(new ArrayList<>(builder.rules));
    this.mapper = builder.mapper != null ? builder.mapper : FieldMapper.IDENTITY;
    this.tableNames = builder.tableNames != null ? builder.tableNames : new TableNameExtractor(null);
    this.flattener = builder.flattener != null ? builder.flattener : new Flattener();
    this.primaryKeyFields = List.copyOf(builder.primaryKeyFields);
    this.breakOnError = builder.breakOnError;
  }

  public static Builder builder(String destination) {
    return new Builder(destination);
  }

  public boolean breakOnError() {
    return breakOnError;
  }

  public List<EnrichmentRule> rules() {
    return rules;
  }

  /**
   * Transforms one event.
   *
   * @throws TransformException if an enrichment rule fails while {@code break_on_error} is set,
   *                            or mapping, table resolution or flattening fails
   */
  public ProcessedRow process(RawEvent event) throws TransformException {
    String eventId = event.eventId();
    Map<String, Object> document = event.mutableFields();

    for (EnrichmentRule rule : rules) {
      try {
        rule.execute(document);
      } catch (EnrichmentException | RuntimeException e) {
        if (breakOnError) {
          throw new TransformException(eventId, "[" + destination + "] Enrichment rule "
              + rule.name() + " failed: " + e.getMessage(), e);
        }
        logger.log(Level.WARNING, "[{0}] Enrichment rule {1} failed for event {2}: {3}",
            new Object[]{destination, rule.name(), eventId, e.getMessage()});
      }
    }

    String table;
    Map<String, Object> columns;
    try {
      table = tableNames.extract(document);
      columns = flattener.flatten(mapper.map(document));
    } catch (RuntimeException e) {
      throw new TransformException(eventId, "[" + destination + "] Event " + eventId
          + " cannot be mapped: " + e.getMessage(), e);
    }
    if (table.isEmpty()) {
      throw new TransformException(eventId, "[" + destination + "] Table name template '"
          + tableNames.template() + "' rendered an empty name for event " + eventId);
    }

    Set<String> keys = new LinkedHashSet<>();
    for (String field : primaryKeyFields) {
      if (columns.containsKey(field)) {
        keys.add(field);
      }
    }
    return new ProcessedRow(eventId, table, columns, keys);
  }

  /** Builder for {@link TransformPipeline}. */
  public static final class Builder {
    private final String destination;
    private final List<EnrichmentRule> rules = new ArrayList<>();
    private FieldMapper mapper;
    private TableNameExtractor tableNames;
    private Flattener flattener;
    private final List<String> primaryKeyFields = new ArrayList<>();
    private boolean breakOnError;

    private Builder(String destination) {
      this.destination = destination;
    }

    /** Appends rules; they run in the order added. */
    public Builder rules(List<? extends EnrichmentRule> rules) {
      this.rules.addAll(rules);
      return this;
    }

    /** Optional. Defaults to {@link FieldMapper#IDENTITY}. */
    public Builder mapper(FieldMapper mapper) {
      this.mapper = mapper;
      return this;
    }

    /** Optional. Defaults to the constant table {@value TableNameExtractor#DEFAULT_TABLE_NAME}. */
    public Builder tableNames(TableNameExtractor tableNames) {
      this.tableNames = tableNames;
      return this;
    }

    public Builder flattener(Flattener flattener) {
      this.flattener = flattener;
      return this;
    }

    /** Column names forming the primary key, matched after flattening. */
    public Builder primaryKeyFields(List<String> primaryKeyFields) {
      if (primaryKeyFields != null) {
        for (String field : primaryKeyFields) {
          this.primaryKeyFields.add(Flattener.columnName(field));
        }
      }
      return this;
    }

    /**
     * When set, an enrichment failure fails the event instead of being logged and ignored.
     *
     * <p>Optional. Defaults to {@code false}.
     */
    public Builder breakOnError(boolean breakOnError) {
      this.breakOnError = breakOnError;
      return this;
    }

    public TransformPipeline build() {
      return new TransformPipeline(this);
    }
  }
}
