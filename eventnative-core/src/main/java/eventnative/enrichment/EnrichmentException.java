package eventnative.enrichment;

/**
 * Thrown when an enrichment rule fails for a single event.
 */
public class EnrichmentException extends Exception {
  public EnrichmentException(String message) {
    super(message);
  }

  public EnrichmentException(String message, Throwable cause) {
    super(message, cause);
  }
}
