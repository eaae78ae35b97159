package eventnative.storage;

import eventnative.DeliveryMode;
import eventnative.enrichment.RuleConfig;
import eventnative.schema.FieldMappingType;
import eventnative.schema.Mapping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Resolved, validated configuration of one destination. Created once at startup.
 *
 * @param sqlTypeCasts column name to SQL type declared by structured {@code cast} rules
 */
public record DestinationSpec(
    String name,
    String type,
    DeliveryMode mode,
    String tableNameTemplate,
    FieldMappingType mappingType,
    List<String> legacyMapping,
    Mapping structuredMapping,
    List<RuleConfig> enrichment,
    boolean breakOnError,
    List<String> primaryKeyFields,
    List<String> onlyTokens,
    Map<String, String> parameters,
    Map<String, String> sqlTypeCasts
) {
  public DestinationSpec {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(tableNameTemplate, "tableNameTemplate");
    Objects.requireNonNull(mappingType, "mappingType");
    legacyMapping = List.copyOf(legacyMapping);
    enrichment = List.copyOf(enrichment);
    primaryKeyFields = List.copyOf(primaryKeyFields);
    onlyTokens = List.copyOf(onlyTokens);
    parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    sqlTypeCasts = Map.copyOf(sqlTypeCasts);
  }

  /** Returns a connection parameter, or {@code null}. */
  public String parameter(String key) {
    return parameters.get(key);
  }

  /**
   * @throws IllegalArgumentException if the parameter is missing or blank
   */
  public String requiredParameter(String key) {
    String value = parameters.get(key);
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("[" + name + "] parameter '" + key + "' is required");
    }
    return value;
  }

  public String parameter(String key, String defaultValue) {
    String value = parameters.get(key);
    return value == null || value.isBlank() ? defaultValue : value;
  }
}
