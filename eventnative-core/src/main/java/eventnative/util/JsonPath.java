package eventnative.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Slash-separated path into a nested event document, e.g. {@code /eventn_ctx/user_agent}.
 *
 * <p>Paths are parsed once at configuration time and then applied to many events.
 */
public final class JsonPath {
  private final String raw;
  private final List<String> segments;

  private JsonPath(String raw, List<String> segments) {
    this.raw = raw;
    this.segments = segments;
  }

  /**
   * Parses a path. A leading slash is optional; empty segments are rejected.
   *
   * @throws IllegalArgumentException if the path is blank or contains an empty segment
   */
  public static JsonPath parse(String path) {
    Objects.requireNonNull(path, "path");
    String trimmed = path.trim();
    if (trimmed.isEmpty() || trimmed.equals("/")) {
      throw new IllegalArgumentException("JSON path must not be empty: '" + path + "'");
    }
    String body = trimmed.startsWith("/") ? trimmed.substring(1) : trimmed;
    List<String> segments = new ArrayList<>();
    for (String segment : body.split("/", -1)) {
      if (segment.isEmpty()) {
        throw new IllegalArgumentException("JSON path has an empty segment: '" + path + "'");
      }
      segments.add(segment);
    }
    return new JsonPath("/" + body, Collections.unmodifiableList(segments));
  }

  public List<String> segments() {
    return segments;
  }

  /** Returns the value at this path, or {@code null} if any segment is missing. */
  public Object get(Map<String, Object> document) {
    Object current = document;
    for (String segment : segments) {
      if (!(current instanceof Map<?, ?> map)) {
        return null;
      }
      current = map.get(segment);
    }
    return current;
  }

  /**
   * Sets the value at this path, creating intermediate objects as needed.
   *
   * @throws IllegalStateException if an intermediate segment holds a non-object value
   */
  public void set(Map<String, Object> document, Object value) {
    Map<String, Object> parent = parent(document, true);
    parent.put(segments.get(segments.size() - 1), value);
  }

  /** Removes and returns the value at this path, or {@code null} if absent. */
  public Object remove(Map<String, Object> document) {
    Map<String, Object> parent = parent(document, false);
    return parent == null ? null : parent.remove(segments.get(segments.size() - 1));
  }

  @SuppressWarnings("unchecked")
  private Map<String, Object> parent(Map<String, Object> document, boolean create) {
    Map<String, Object> current = document;
    for (int i = 0; i < segments.size() - 1; i++) {
      String segment = segments.get(i);
      Object next = current.get(segment);
      if (next == null) {
        if (!create) {
          return null;
        }
        Map<String, Object> created = new LinkedHashMap<>();
        current.put(segment, created);
        current = created;
      } else if (next instanceof Map<?, ?>) {
        current = (Map<String, Object>) next;
      } else if (create) {
        throw new IllegalStateException("Cannot set " + raw + ": '" + segment + "' is not an object");
      } else {
        return null;
      }
    }
    return current;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof JsonPath other && raw.equals(other.raw);
  }

  @Override
  public int hashCode() {
    return raw.hashCode();
  }

  @Override
  public String toString() {
    return raw;
  }
}
