package eventnative.util;

/**
 * JSON encoding used for array columns and queue records.
 *
 * @see #getDefault()
 * @see JacksonJsonCodec
 */
public interface JsonCodec {

  /**
   * Returns the shared Jackson-backed instance.
   *
   * @return the default {@link JsonCodec}
   */
  static JsonCodec getDefault() {
    return JacksonJsonCodec.INSTANCE;
  }

  /**
   * Serializes a value as a JSON string.
   *
   * @throws IllegalArgumentException if the value cannot be serialized
   */
  String toJson(Object value);

  /**
   * Serializes a value as UTF-8 JSON bytes.
   *
   * @throws IllegalArgumentException if the value cannot be serialized
   */
  byte[] toBytes(Object value);

  /**
   * Parses UTF-8 JSON bytes into the given type.
   *
   * @throws IllegalArgumentException if the input is not valid JSON for {@code type}
   */
  <T> T fromBytes(byte[] json, Class<T> type);
}
