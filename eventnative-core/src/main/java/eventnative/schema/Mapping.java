package eventnative.schema;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured mapping configuration ({@code data_layout.mappings}).
 */
public class Mapping {
  private Boolean keepUnmapped;
  private List<MappingRule> fields = new ArrayList<>();

  public Mapping() {
  }

  public Mapping(Boolean keepUnmapped, List<MappingRule> fields) {
    this.keepUnmapped = keepUnmapped;
    this.fields = fields == null ? new ArrayList<>() : new ArrayList<>(fields);
  }

  /** Unset means keep. */
  public boolean keepsUnmapped() {
    return keepUnmapped == null || keepUnmapped;
  }

  public Boolean getKeepUnmapped() {
    return keepUnmapped;
  }

  public void setKeepUnmapped(Boolean keepUnmapped) {
    this.keepUnmapped = keepUnmapped;
  }

  public List<MappingRule> getFields() {
    return fields;
  }

  public void setFields(List<MappingRule> fields) {
    this.fields = fields == null ? new ArrayList<>() : fields;
  }

  /** A mapping counts as configured once it names a rule or an explicit unmapped-field policy. */
  public boolean isConfigured() {
    return keepUnmapped != null || (fields != null && !fields.isEmpty());
  }
}
