package eventnative.storage;

import eventnative.schema.Mapping;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code data_layout} block of a destination: field mapping, table name and primary keys.
 */
public class DataLayout {
  private String mappingType;
  private List<String> mapping = new ArrayList<>();
  private Mapping mappings;
  private String tableNameTemplate;
  private List<String> primaryKeyFields = new ArrayList<>();

  public String getMappingType() {
    return mappingType;
  }

  public void setMappingType(String mappingType) {
    this.mappingType = mappingType;
  }

  /** Legacy string rules such as {@code "/src -> /dst"}. */
  public List<String> getMapping() {
    return mapping;
  }

  public void setMapping(List<String> mapping) {
    this.mapping = mapping == null ? new ArrayList<>() : mapping;
  }

  /** Structured rules. Mutually exclusive with {@link #getMapping()}. */
  public Mapping getMappings() {
    return mappings;
  }

  public void setMappings(Mapping mappings) {
    this.mappings = mappings;
  }

  public String getTableNameTemplate() {
    return tableNameTemplate;
  }

  public void setTableNameTemplate(String tableNameTemplate) {
    this.tableNameTemplate = tableNameTemplate;
  }

  public List<String> getPrimaryKeyFields() {
    return primaryKeyFields;
  }

  public void setPrimaryKeyFields(List<String> primaryKeyFields) {
    this.primaryKeyFields = primaryKeyFields == null ? new ArrayList<>() : primaryKeyFields;
  }
}
