package eventnative;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A raw event after enrichment, field mapping and flattening: the unit handed to a
 * destination adapter.
 *
 * @param eventId          id of the source event
 * @param tableName        target table, never empty
 * @param columns          ordered column name to typed value mapping
 * @param primaryKeyFields configured primary-key columns present in {@code columns}
 */
public record ProcessedRow(
    String eventId,
    String tableName,
    Map<String, Object> columns,
    Set<String> primaryKeyFields
) {
  public ProcessedRow {
    Objects.requireNonNull(eventId, "eventId");
    Objects.requireNonNull(tableName, "tableName");
    Objects.requireNonNull(columns, "columns");
    if (tableName.isEmpty()) {
      throw new IllegalArgumentException("tableName must not be empty");
    }
    columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    primaryKeyFields = primaryKeyFields == null
        ? Set.of()
        : Collections.unmodifiableSet(new LinkedHashSet<>(primaryKeyFields));
  }
}
