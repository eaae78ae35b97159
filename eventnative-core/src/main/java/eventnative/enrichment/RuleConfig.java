package eventnative.enrichment;

/**
 * Configured enrichment rule: {@code name}, source path {@code from}, target path {@code to}.
 */
public class RuleConfig {
  private String name;
  private String from;
  private String to;

  public RuleConfig() {
  }

  public RuleConfig(String name, String from, String to) {
    this.name = name;
    this.from = from;
    this.to = to;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getFrom() {
    return from;
  }

  public void setFrom(String from) {
    this.from = from;
  }

  public String getTo() {
    return to;
  }

  public void setTo(String to) {
    this.to = to;
  }

  @Override
  public String toString() {
    return "Name: " + name + ", From: " + from + ", To: " + to;
  }
}
