package eventnative.schema;

import java.util.Map;

/**
 * Rewrites the shape of an event document before flattening.
 */
@FunctionalInterface
public interface FieldMapper {

  /** Returns the event unchanged. Used when no mapping is configured. */
  FieldMapper IDENTITY = event -> event;

  /**
   * Maps an event. Implementations may modify and return {@code event} itself.
   *
   * @param event mutable event document
   * @return the mapped document
   * @throws IllegalStateException if the event's shape conflicts with a rule
   */
  Map<String, Object> map(Map<String, Object> event);
}
