package eventnative.schema;

import java.util.Map;

/**
 * The active field mapper of a destination and the SQL type casts it declares.
 *
 * @param mapper       mapper to apply to every event
 * @param sqlTypeCasts column name to SQL type, empty for legacy and identity mapping
 * @param description  human readable summary for startup logs
 */
public record MapperSetup(FieldMapper mapper, Map<String, String> sqlTypeCasts, String description) {
  public MapperSetup {
    sqlTypeCasts = Map.copyOf(sqlTypeCasts);
  }
}
