package eventnative;

import com.github.f4b6a3.ulid.UlidCreator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An ingested analytics event: an opaque key/value document plus the ingestion token that
 * identifies its source.
 *
 * <p>Instances are immutable. The field tree is deep-copied on construction and exposed as an
 * unmodifiable view; transform steps work on {@link #mutableFields()}, a fresh deep copy.
 *
 * <p>The event id is taken from {@code eventn_ctx/event_id} or the flattened
 * {@code eventn_ctx_event_id} field when present, otherwise a monotonic ULID is generated.
 */
public final class RawEvent {
  static final String CONTEXT_FIELD = "eventn_ctx";
  static final String EVENT_ID_FIELD = "event_id";
  static final String FLAT_EVENT_ID_FIELD = "eventn_ctx_event_id";

  private final String token;
  private final String eventId;
  private final Map<String, Object> fields;

  private RawEvent(String token, String eventId, Map<String, Object> fields) {
    this.token = token;
    this.eventId = eventId;
    this.fields = fields;
  }

  /**
   * Creates an event, resolving its id from the payload or generating one.
   *
   * @param token  ingestion token, may be {@code null} for internal sources
   * @param fields the event payload
   * @return an immutable event
   */
  public static RawEvent of(String token, Map<String, ?> fields) {
    Objects.requireNonNull(fields, "fields");
    Map<String, Object> copy = freeze(fields);
    String eventId = resolveEventId(copy);
    return new RawEvent(token, eventId != null ? eventId : UlidCreator.getMonotonicUlid().toString(), copy);
  }

  /**
   * Creates an event with an explicit id, ignoring any id present in the payload.
   */
  public static RawEvent of(String token, String eventId, Map<String, ?> fields) {
    Objects.requireNonNull(eventId, "eventId");
    Objects.requireNonNull(fields, "fields");
    if (eventId.isEmpty()) {
      throw new IllegalArgumentException("eventId must not be empty");
    }
    return new RawEvent(token, eventId, freeze(fields));
  }

  public String token() {
    return token;
  }

  public String eventId() {
    return eventId;
  }

  /** Unmodifiable view of the payload. Nested maps and lists are unmodifiable too. */
  public Map<String, Object> fields() {
    return fields;
  }

  /** Returns a mutable deep copy of the payload. */
  public Map<String, Object> mutableFields() {
    @SuppressWarnings("unchecked")
    Map<String, Object> copy = (Map<String, Object>) thaw(fields);
    return copy;
  }

  private static String resolveEventId(Map<String, Object> fields) {
    Object context = fields.get(CONTEXT_FIELD);
    if (context instanceof Map<?, ?> map) {
      Object id = map.get(EVENT_ID_FIELD);
      if (id != null && !id.toString().isEmpty()) {
        return id.toString();
      }
    }
    Object flat = fields.get(FLAT_EVENT_ID_FIELD);
    if (flat != null && !flat.toString().isEmpty()) {
      return flat.toString();
    }
    return null;
  }

  private static Map<String, Object> freeze(Map<String, ?> source) {
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : source.entrySet()) {
      copy.put(Objects.requireNonNull(entry.getKey(), "field name"), freezeValue(entry.getValue()));
    }
    return Collections.unmodifiableMap(copy);
  }

  @SuppressWarnings("unchecked")
  private static Object freezeValue(Object value) {
    if (value instanceof Map<?, ?> map) {
      return freeze((Map<String, ?>) map);
    }
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      for (Object item : list) {
        copy.add(freezeValue(item));
      }
      return Collections.unmodifiableList(copy);
    }
    return value;
  }

  private static Object thaw(Object value) {
    if (value instanceof Map<?, ?> map) {
      Map<String, Object> copy = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        copy.put((String) entry.getKey(), thaw(entry.getValue()));
      }
      return copy;
    }
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      for (Object item : list) {
        copy.add(thaw(item));
      }
      return copy;
    }
    return value;
  }

  @Override
  public String toString() {
    return "RawEvent{eventId=" + eventId + ", token=" + token + "}";
  }
}
