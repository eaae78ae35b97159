package eventnative.queue;

import eventnative.util.JsonCodec;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

/**
 * Column values as stored in queue records: each value carries a type tag and its exact
 * string form, so a row read back holds values equal to, and of the same class as, those
 * enqueued. Values of other classes are kept as plain JSON under the {@code json} tag.
 */
final class TypedColumns {
  static final String NULL = "null";
  static final String JSON = "json";

  private static final Map<Class<?>, Scalar> BY_CLASS = new HashMap<>();
  private static final Map<String, Scalar> BY_TAG = new HashMap<>();

  static {
    scalar("string", String.class, Function.identity(), s -> s);
    scalar("long", Long.class, String::valueOf, Long::valueOf);
    scalar("int", Integer.class, String::valueOf, Integer::valueOf);
    scalar("short", Short.class, String::valueOf, Short::valueOf);
    scalar("byte", Byte.class, String::valueOf, Byte::valueOf);
    scalar("double", Double.class, String::valueOf, Double::valueOf);
    scalar("float", Float.class, String::valueOf, Float::valueOf);
    scalar("boolean", Boolean.class, String::valueOf, Boolean::valueOf);
    scalar("decimal", BigDecimal.class, BigDecimal::toString, BigDecimal::new);
    scalar("bigint", BigInteger.class, BigInteger::toString, BigInteger::new);
    scalar("instant", Instant.class, Instant::toString, Instant::parse);
    scalar("offset_datetime", OffsetDateTime.class, OffsetDateTime::toString, OffsetDateTime::parse);
    scalar("zoned_datetime", ZonedDateTime.class, ZonedDateTime::toString, ZonedDateTime::parse);
    scalar("local_datetime", LocalDateTime.class, LocalDateTime::toString, LocalDateTime::parse);
    scalar("local_date", LocalDate.class, LocalDate::toString, LocalDate::parse);
    scalar("local_time", LocalTime.class, LocalTime::toString, LocalTime::parse);
    scalar("date", Date.class, d -> String.valueOf(d.getTime()), s -> new Date(Long.parseLong(s)));
    scalar("uuid", UUID.class, UUID::toString, UUID::fromString);
  }

  private TypedColumns() {}

  /** One stored column. {@code value} is null only for the {@code null} tag. */
  record Column(String name, String type, String value) {}

  static List<Column> encode(Map<String, Object> columns, JsonCodec json) {
    List<Column> encoded = new ArrayList<>(columns.size());
    for (Map.Entry<String, Object> column : columns.entrySet()) {
      Object value = column.getValue();
      if (value == null) {
        encoded.add(new Column(column.getKey(), NULL, null));
        continue;
      }
      Scalar scalar = BY_CLASS.get(value.getClass());
      if (scalar != null) {
        encoded.add(new Column(column.getKey(), scalar.tag, scalar.write(value)));
      } else {
        encoded.add(new Column(column.getKey(), JSON, json.toJson(value)));
      }
    }
    return encoded;
  }

  /**
   * @throws IllegalArgumentException on an unknown type tag or a malformed value
   */
  static Map<String, Object> decode(List<Column> columns, JsonCodec json) {
    Map<String, Object> decoded = new LinkedHashMap<>();
    for (Column column : columns) {
      decoded.put(column.name(), decodeValue(column, json));
    }
    return decoded;
  }

  private static Object decodeValue(Column column, JsonCodec json) {
    if (NULL.equals(column.type())) {
      return null;
    }
    if (column.value() == null) {
      throw new IllegalArgumentException("Column " + column.name() + " has no value");
    }
    if (JSON.equals(column.type())) {
      return json.fromBytes(column.value().getBytes(StandardCharsets.UTF_8), Object.class);
    }
    Scalar scalar = BY_TAG.get(column.type());
    if (scalar == null) {
      throw new IllegalArgumentException("Unknown column type " + column.type() + " for " + column.name());
    }
    try {
      return scalar.reader.apply(column.value());
    } catch (RuntimeException e) {
      throw new IllegalArgumentException("Malformed " + column.type() + " value for " + column.name(), e);
    }
  }

  private static <T> void scalar(String tag, Class<T> type, Function<T, String> writer,
                                 Function<String, T> reader) {
    Scalar scalar = new Scalar(tag, type, writer, reader);
    BY_CLASS.put(type, scalar);
    BY_TAG.put(tag, scalar);
  }

  private static final class Scalar {
    final String tag;
    final Class<?> type;
    final Function<Object, String> writer;
    final Function<String, ?> reader;

    @SuppressWarnings("unchecked")
    <T> Scalar(String tag, Class<T> type, Function<T, String> writer, Function<String, T> reader) {
      this.tag = tag;
      this.type = type;
      this.writer = (Function<Object, String>) writer;
      this.reader = reader;
    }

    String write(Object value) {
      return writer.apply(type.cast(value));
    }
  }
}
