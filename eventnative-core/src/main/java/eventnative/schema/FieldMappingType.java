package eventnative.schema;

import java.util.Locale;

/**
 * What legacy mapping does with fields no rule mentions.
 */
public enum FieldMappingType {
  /** Unmapped fields are kept as they are. */
  DEFAULT,
  /** Only fields produced by a rule survive. */
  STRICT;

  public boolean keepsUnmapped() {
    return this == DEFAULT;
  }

  /**
   * Parses a configured mapping type. {@code null} or blank means {@link #DEFAULT}.
   *
   * @throws IllegalArgumentException on any other value
   */
  public static FieldMappingType parse(String value) {
    if (value == null || value.isBlank()) {
      return DEFAULT;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown mapping type: " + value + ". Available types: [default, strict]");
    }
  }
}
