package eventnative.jdbc;

import java.util.Objects;

/**
 * Validation of table, schema and column names before they are quoted into SQL.
 */
public final class Identifiers {
  private static final String IDENTIFIER_PATTERN = "[a-zA-Z0-9_]+";

  private Identifiers() {}

  public static String validate(String identifier) {
    Objects.requireNonNull(identifier, "identifier");
    if (!identifier.matches(IDENTIFIER_PATTERN)) {
      throw new IllegalArgumentException("Invalid identifier: " + identifier);
    }
    return identifier;
  }
}
