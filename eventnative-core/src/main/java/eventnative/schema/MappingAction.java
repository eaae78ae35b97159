package eventnative.schema;

import java.util.Locale;

/** Action of a structured mapping rule. */
public enum MappingAction {
  MOVE,
  REMOVE,
  CAST,
  CONSTANT;

  public static MappingAction parse(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("mapping action is required");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown mapping action: " + value
          + ". Available actions: [move, remove, cast, constant]");
    }
  }
}
