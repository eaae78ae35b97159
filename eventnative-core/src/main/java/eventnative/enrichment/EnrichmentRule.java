package eventnative.enrichment;

import java.util.Map;

/**
 * A step that reads one field of an event and writes derived data to another.
 *
 * <p>Rules run against the mutable copy of a raw event before field mapping.
 */
public interface EnrichmentRule {

  /** Rule type, e.g. {@code ip_lookup}. */
  String name();

  /**
   * Applies the rule in place. Events lacking the source field are left untouched.
   *
   * @param event mutable event document
   * @throws EnrichmentException if the source value is present but cannot be enriched
   */
  void execute(Map<String, Object> event) throws EnrichmentException;
}
