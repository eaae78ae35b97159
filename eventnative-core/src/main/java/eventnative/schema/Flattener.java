package eventnative.schema;

import eventnative.util.JsonCodec;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a nested event document into a flat column map.
 *
 * <p>Nested objects become {@code parent_child} columns, arrays are serialized to JSON strings,
 * and {@code null} values are dropped. Column names are lower-cased with every character
 * outside {@code [a-z0-9_]} replaced by {@code _}. Integral numbers widen to {@code Long} and
 * {@code Float} widens to {@code Double}.
 */
public final class Flattener {
  private final JsonCodec json;

  public Flattener() {
    this(JsonCodec.getDefault());
  }

  public Flattener(JsonCodec json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  public Map<String, Object> flatten(Map<String, Object> document) {
    Map<String, Object> columns = new LinkedHashMap<>();
    flatten("", document, columns);
    return columns;
  }

  private void flatten(String prefix, Map<?, ?> object, Map<String, Object> columns) {
    for (Map.Entry<?, ?> entry : object.entrySet()) {
      String key = prefix.isEmpty()
          ? columnName(String.valueOf(entry.getKey()))
          : prefix + "_" + columnName(String.valueOf(entry.getKey()));
      Object value = entry.getValue();
      if (value == null) {
        continue;
      }
      if (value instanceof Map<?, ?> nested) {
        flatten(key, nested, columns);
      } else if (value instanceof List<?> || value.getClass().isArray()) {
        columns.put(key, json.toJson(value));
      } else {
        columns.put(key, normalize(value));
      }
    }
  }

  private static Object normalize(Object value) {
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value instanceof Float f) {
      return f.doubleValue();
    }
    return value;
  }

  /** Sanitizes one key. */
  public static String columnName(String key) {
    String lower = key.toLowerCase(Locale.ROOT);
    StringBuilder sb = new StringBuilder(lower.length());
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      sb.append((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_' ? c : '_');
    }
    return sb.toString();
  }

  /** Column name a nested path flattens to, e.g. {@code [eventn_ctx, user_agent]}. */
  public static String columnName(List<String> path) {
    StringBuilder sb = new StringBuilder();
    for (String segment : path) {
      if (sb.length() > 0) {
        sb.append('_');
      }
      sb.append(columnName(segment));
    }
    return sb.toString();
  }
}
