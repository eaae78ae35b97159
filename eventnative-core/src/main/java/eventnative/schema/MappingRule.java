package eventnative.schema;

/**
 * One structured mapping rule.
 *
 * <ul>
 *   <li>{@code move}: {@code src} to {@code dst}</li>
 *   <li>{@code remove}: drop {@code src}</li>
 *   <li>{@code cast}: declare the SQL {@code type} of column {@code dst}</li>
 *   <li>{@code constant}: write {@code value} to {@code dst}</li>
 * </ul>
 */
public class MappingRule {
  private String src;
  private String dst;
  private String action;
  private String type;
  private Object value;

  public MappingRule() {
  }

  public MappingRule(String src, String dst, String action, String type, Object value) {
    this.src = src;
    this.dst = dst;
    this.action = action;
    this.type = type;
    this.value = value;
  }

  public static MappingRule move(String src, String dst) {
    return new MappingRule(src, dst, "move", null, null);
  }

  public static MappingRule remove(String src) {
    return new MappingRule(src, null, "remove", null, null);
  }

  public static MappingRule cast(String dst, String type) {
    return new MappingRule(null, dst, "cast", type, null);
  }

  public static MappingRule constant(String dst, Object value) {
    return new MappingRule(null, dst, "constant", null, value);
  }

  public String getSrc() {
    return src;
  }

  public void setSrc(String src) {
    this.src = src;
  }

  public String getDst() {
    return dst;
  }

  public void setDst(String dst) {
    this.dst = dst;
  }

  public String getAction() {
    return action;
  }

  public void setAction(String action) {
    this.action = action;
  }

  public String getType() {
    return type;
  }

  public void setType(String type) {
    this.type = type;
  }

  public Object getValue() {
    return value;
  }

  public void setValue(Object value) {
    this.value = value;
  }

  @Override
  public String toString() {
    return "src: " + src + ", dst: " + dst + ", action: " + action + ", type: " + type + ", value: " + value;
  }
}
