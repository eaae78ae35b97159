package eventnative.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves the target table of an event from {@code table_name_template}.
 *
 * <p>A template is either a constant ({@code clicks}) or contains placeholders such as
 * {@code events_{{.event_type}}} or {@code {{.eventn_ctx.src}}}, resolved against the enriched
 * event before field mapping. The result is sanitized like a column name.
 */
public final class TableNameExtractor {
  public static final String DEFAULT_TABLE_NAME = "events";

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*\\.([A-Za-z0-9_]+(?:\\.[A-Za-z0-9_]+)*)\\s*}}");

  private final String template;
  private final List<Part> parts;

  /**
   * @param template the template; {@code null} or blank falls back to {@value #DEFAULT_TABLE_NAME}
   * @throws IllegalArgumentException if the template contains an unbalanced or unsupported
   *                                  placeholder
   */
  public TableNameExtractor(String template) {
    this.template = template == null || template.isBlank() ? DEFAULT_TABLE_NAME : template.trim();
    this.parts = compile(this.template);
  }

  private static List<Part> compile(String template) {
    List<Part> parts = new ArrayList<>();
    Matcher matcher = PLACEHOLDER.matcher(template);
    int last = 0;
    while (matcher.find()) {
      parts.add(literal(template, template.substring(last, matcher.start())));
      parts.add(new Part(null, matcher.group(1).split("\\.")));
      last = matcher.end();
    }
    parts.add(literal(template, template.substring(last)));
    parts.removeIf(p -> p.literal != null && p.literal.isEmpty());
    return List.copyOf(parts);
  }

  private static Part literal(String template, String text) {
    if (text.contains("{{") || text.contains("}}")) {
      throw new IllegalArgumentException("Malformed table name template '" + template
          + "': placeholders must look like {{.field}} or {{.parent.child}}");
    }
    return new Part(text, null);
  }

  public String template() {
    return template;
  }

  public boolean isConstant() {
    return parts.stream().allMatch(p -> p.literal != null);
  }

  /**
   * Renders the table name for one event.
   *
   * @return the sanitized table name; empty when the template renders nothing
   */
  public String extract(Map<String, Object> event) {
    StringBuilder sb = new StringBuilder();
    for (Part part : parts) {
      if (part.literal != null) {
        sb.append(part.literal);
      } else {
        Object value = lookup(event, part.path);
        if (value != null) {
          sb.append(value);
        }
      }
    }
    return Flattener.columnName(sb.toString().trim());
  }

  private static Object lookup(Map<String, Object> event, String[] path) {
    Object current = event;
    for (String segment : path) {
      if (!(current instanceof Map<?, ?> map)) {
        return null;
      }
      current = map.get(segment);
    }
    return current instanceof Map<?, ?> || current instanceof List<?> ? null : current;
  }

  private record Part(String literal, String[] path) {
  }
}
