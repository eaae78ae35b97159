package eventnative.storage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What happened to one event at each destination it was routed to.
 *
 * @param accepted destinations that buffered or queued the row
 * @param skipped  destinations whose pipeline dropped the event
 * @param rejected destinations that refused the event, with the reason (backpressure,
 *                 {@code break_on_error} transform failure, closed destination)
 */
public record RoutingResult(List<String> accepted, List<String> skipped, Map<String, Exception> rejected) {
  public RoutingResult {
    accepted = List.copyOf(accepted);
    skipped = List.copyOf(skipped);
    rejected = Collections.unmodifiableMap(new LinkedHashMap<>(rejected));
  }

  /** Whether no destination rejected the event. */
  public boolean isFullyAccepted() {
    return rejected.isEmpty();
  }
}
