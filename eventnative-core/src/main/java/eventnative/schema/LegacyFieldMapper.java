package eventnative.schema;

import eventnative.util.JsonPath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mapper for string rules: {@code "/src -> /dst"} moves a field, {@code "/src ->"} removes it.
 *
 * <p>With {@link FieldMappingType#DEFAULT} rules edit the event in place and unmapped fields
 * survive. With {@link FieldMappingType#STRICT} the result holds only the moved fields.
 */
public final class LegacyFieldMapper implements FieldMapper {
  private static final String ARROW = "->";

  private final List<Rule> rules;
  private final FieldMappingType type;

  /**
   * @throws IllegalArgumentException if a rule is malformed
   */
  public LegacyFieldMapper(List<String> rules, FieldMappingType type) {
    this.type = type;
    List<Rule> parsed = new ArrayList<>(rules.size());
    for (String rule : rules) {
      parsed.add(parse(rule));
    }
    this.rules = Collections.unmodifiableList(parsed);
  }

  private static Rule parse(String rule) {
    if (rule == null) {
      throw new IllegalArgumentException("mapping rule must not be null");
    }
    int arrow = rule.indexOf(ARROW);
    if (arrow < 0 || rule.indexOf(ARROW, arrow + ARROW.length()) >= 0) {
      throw new IllegalArgumentException("Malformed mapping rule '" + rule
          + "': expected '/src -> /dst' or '/src ->'");
    }
    String src = rule.substring(0, arrow).trim();
    String dst = rule.substring(arrow + ARROW.length()).trim();
    if (src.isEmpty()) {
      throw new IllegalArgumentException("Malformed mapping rule '" + rule + "': source path is empty");
    }
    try {
      return new Rule(JsonPath.parse(src), dst.isEmpty() ? null : JsonPath.parse(dst));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Malformed mapping rule '" + rule + "': " + e.getMessage(), e);
    }
  }

  @Override
  public Map<String, Object> map(Map<String, Object> event) {
    if (type.keepsUnmapped()) {
      for (Rule rule : rules) {
        Object value = rule.src.remove(event);
        if (rule.dst != null && value != null) {
          rule.dst.set(event, value);
        }
      }
      return event;
    }
    Map<String, Object> result = new LinkedHashMap<>();
    for (Rule rule : rules) {
      if (rule.dst == null) {
        continue;
      }
      Object value = rule.src.get(event);
      if (value != null) {
        rule.dst.set(result, value);
      }
    }
    return result;
  }

  List<Rule> rules() {
    return rules;
  }

  record Rule(JsonPath src, JsonPath dst) {
  }
}
