package eventnative.schema;

import java.util.List;
import java.util.Map;

/**
 * Chooses the single active field mapper for a destination.
 */
public final class FieldMappers {

  private FieldMappers() {
  }

  /**
   * Builds a mapper from legacy rules or a structured mapping, never both.
   *
   * @param mappingType    legacy unmapped-field policy
   * @param legacyRules    legacy string rules, may be {@code null}
   * @param structured     structured mapping, may be {@code null}
   * @return the mapper and its SQL type casts; identity when nothing is configured
   * @throws IllegalArgumentException if both styles are configured or a rule is malformed
   */
  public static MapperSetup create(FieldMappingType mappingType, List<String> legacyRules, Mapping structured) {
    boolean hasLegacy = legacyRules != null && !legacyRules.isEmpty();
    boolean hasStructured = structured != null && structured.isConfigured();
    if (hasLegacy && hasStructured) {
      throw new IllegalArgumentException(
          "Both 'mapping' and 'mappings' are configured; use either legacy or structured mapping rules");
    }
    if (hasStructured) {
      StructuredFieldMapper mapper = new StructuredFieldMapper(structured);
      String policy = structured.keepsUnmapped() ? "keep unmapped fields" : "remove unmapped fields";
      return new MapperSetup(mapper, mapper.sqlTypeCasts(),
          structured.getFields().size() + " structured rules, " + policy);
    }
    if (hasLegacy) {
      FieldMappingType type = mappingType == null ? FieldMappingType.DEFAULT : mappingType;
      String policy = type.keepsUnmapped() ? "keep unmapped fields" : "remove unmapped fields";
      return new MapperSetup(new LegacyFieldMapper(legacyRules, type), Map.of(),
          legacyRules.size() + " legacy rules, " + policy);
    }
    return new MapperSetup(FieldMapper.IDENTITY, Map.of(), "identity");
  }
}
