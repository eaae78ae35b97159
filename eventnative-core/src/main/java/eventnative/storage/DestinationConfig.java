package eventnative.storage;

import eventnative.enrichment.RuleConfig;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw configuration of one destination, as bound from configuration files.
 *
 * <p>Everything is optional: the type defaults to the destination name and the mode to
 * {@code batch}. {@link DestinationFactory} validates and resolves it into a
 * {@link DestinationSpec}.
 */
public class DestinationConfig {
  private String type;
  private String mode;
  private boolean breakOnError;
  private List<String> onlyTokens = new ArrayList<>();
  private DataLayout dataLayout;
  private List<RuleConfig> enrichment = new ArrayList<>();
  private Map<String, String> parameters = new LinkedHashMap<>();

  public String getType() {
    return type;
  }

  public void setType(String type) {
    this.type = type;
  }

  public String getMode() {
    return mode;
  }

  public void setMode(String mode) {
    this.mode = mode;
  }

  public boolean isBreakOnError() {
    return breakOnError;
  }

  public void setBreakOnError(boolean breakOnError) {
    this.breakOnError = breakOnError;
  }

  /** Ingestion tokens routed to this destination. Empty routes every token. */
  public List<String> getOnlyTokens() {
    return onlyTokens;
  }

  public void setOnlyTokens(List<String> onlyTokens) {
    this.onlyTokens = onlyTokens == null ? new ArrayList<>() : onlyTokens;
  }

  public DataLayout getDataLayout() {
    return dataLayout;
  }

  public void setDataLayout(DataLayout dataLayout) {
    this.dataLayout = dataLayout;
  }

  public List<RuleConfig> getEnrichment() {
    return enrichment;
  }

  public void setEnrichment(List<RuleConfig> enrichment) {
    this.enrichment = enrichment == null ? new ArrayList<>() : enrichment;
  }

  /** Adapter connection block, e.g. {@code url}, {@code username}, {@code schema}. */
  public Map<String, String> getParameters() {
    return parameters;
  }

  public void setParameters(Map<String, String> parameters) {
    this.parameters = parameters == null ? new LinkedHashMap<>() : parameters;
  }
}
