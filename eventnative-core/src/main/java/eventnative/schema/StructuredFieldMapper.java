package eventnative.schema;

import eventnative.util.JsonPath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mapper for structured rules with {@code move}, {@code remove}, {@code cast} and
 * {@code constant} actions.
 *
 * <p>{@code cast} does not touch data; it contributes a column type to
 * {@link #sqlTypeCasts()}. When unmapped fields are dropped, a cast column is still carried
 * over so the declared type has a value to apply to.
 */
public final class StructuredFieldMapper implements FieldMapper {
  private final List<Step> steps;
  private final boolean keepUnmapped;
  private final Map<String, String> sqlTypeCasts;

  /**
   * @throws IllegalArgumentException if a rule is malformed
   */
  public StructuredFieldMapper(Mapping mapping) {
    this.keepUnmapped = mapping.keepsUnmapped();
    List<Step> steps = new ArrayList<>();
    Map<String, String> casts = new LinkedHashMap<>();
    for (MappingRule rule : mapping.getFields()) {
      Step step = compile(rule);
      steps.add(step);
      if (step.action == MappingAction.CAST) {
        casts.put(Flattener.columnName(step.dst.segments()), rule.getType().trim());
      }
    }
    this.steps = Collections.unmodifiableList(steps);
    this.sqlTypeCasts = Collections.unmodifiableMap(casts);
  }

  private static Step compile(MappingRule rule) {
    if (rule == null) {
      throw new IllegalArgumentException("mapping rule must not be null");
    }
    try {
      MappingAction action = MappingAction.parse(rule.getAction());
      switch (action) {
        case MOVE:
          return new Step(action, required("src", rule.getSrc()), required("dst", rule.getDst()), null);
        case REMOVE:
          return new Step(action, required("src", rule.getSrc()), null, null);
        case CAST:
          if (rule.getType() == null || rule.getType().isBlank()) {
            throw new IllegalArgumentException("'type' is required");
          }
          return new Step(action, null, required("dst", rule.getDst()), null);
        case CONSTANT:
          return new Step(action, null, required("dst", rule.getDst()), rule.getValue());
        default:
          throw new IllegalArgumentException("Unsupported action " + action);
      }
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Malformed mapping rule [" + rule + "]: " + e.getMessage(), e);
    }
  }

  private static JsonPath required(String field, String path) {
    if (path == null || path.isBlank()) {
      throw new IllegalArgumentException("'" + field + "' is required");
    }
    return JsonPath.parse(path);
  }

  /** Column name to SQL type, from {@code cast} rules. */
  public Map<String, String> sqlTypeCasts() {
    return sqlTypeCasts;
  }

  @Override
  public Map<String, Object> map(Map<String, Object> event) {
    return keepUnmapped ? mapInPlace(event) : mapInto(event, new LinkedHashMap<>());
  }

  private Map<String, Object> mapInPlace(Map<String, Object> event) {
    for (Step step : steps) {
      switch (step.action) {
        case MOVE: {
          Object value = step.src.remove(event);
          if (value != null) {
            step.dst.set(event, value);
          }
          break;
        }
        case REMOVE:
          step.src.remove(event);
          break;
        case CONSTANT:
          step.dst.set(event, step.value);
          break;
        default:
          break;
      }
    }
    return event;
  }

  private Map<String, Object> mapInto(Map<String, Object> event, Map<String, Object> result) {
    for (Step step : steps) {
      switch (step.action) {
        case MOVE: {
          Object value = step.src.get(event);
          if (value != null) {
            step.dst.set(result, value);
          }
          break;
        }
        case CAST: {
          Object value = step.dst.get(event);
          if (value != null) {
            step.dst.set(result, value);
          }
          break;
        }
        case CONSTANT:
          step.dst.set(result, step.value);
          break;
        default:
          break;
      }
    }
    return result;
  }

  private record Step(MappingAction action, JsonPath src, JsonPath dst, Object value) {
  }
}
