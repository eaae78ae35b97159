package eventnative.outcome;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded in-memory record of recent delivery outcomes, per destination.
 *
 * <p>Each destination keeps at most {@code capacity} outcomes keyed by event id; the oldest is
 * evicted first. Re-recording an event id replaces its outcome and makes it the newest.
 * Recording is O(1) and never blocks delivery beyond a short per-destination monitor.
 *
 * <p>The cache is informational: it backs status queries and duplicate checks but is never
 * consulted to decide whether a row is delivered.
 */
public final class OutcomeCache {
  public static final int DEFAULT_CAPACITY = 100;

  private final int capacity;
  private final Map<String, DestinationOutcomes> destinations = new ConcurrentHashMap<>();

  public OutcomeCache() {
    this(DEFAULT_CAPACITY);
  }

  public OutcomeCache(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    this.capacity = capacity;
  }

  public int capacity() {
    return capacity;
  }

  public void record(DeliveryOutcome outcome) {
    Objects.requireNonNull(outcome, "outcome");
    destinations.computeIfAbsent(outcome.destination(), d -> new DestinationOutcomes(capacity))
        .put(outcome);
  }

  /**
   * Most recent outcomes of a destination, newest first.
   *
   * @param limit maximum number returned
   */
  public List<DeliveryOutcome> recent(String destination, int limit) {
    if (limit < 0) {
      throw new IllegalArgumentException("limit must be >= 0");
    }
    DestinationOutcomes outcomes = destinations.get(destination);
    return outcomes == null ? List.of() : outcomes.newestFirst(limit);
  }

  public Optional<DeliveryOutcome> lookup(String destination, String eventId) {
    DestinationOutcomes outcomes = destinations.get(destination);
    return outcomes == null ? Optional.empty() : Optional.ofNullable(outcomes.get(eventId));
  }

  public int size(String destination) {
    DestinationOutcomes outcomes = destinations.get(destination);
    return outcomes == null ? 0 : outcomes.size();
  }

  public Set<String> destinations() {
    return Set.copyOf(destinations.keySet());
  }

  private static final class DestinationOutcomes {
    private final LinkedHashMap<String, DeliveryOutcome> byEventId;

    DestinationOutcomes(int capacity) {
      this.byEventId = new LinkedHashMap<>(Math.min(capacity, 1024) * 2) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, DeliveryOutcome> eldest) {
          return size() > capacity;
        }
      };
    }

    synchronized void put(DeliveryOutcome outcome) {
      byEventId.remove(outcome.eventId());
      byEventId.put(outcome.eventId(), outcome);
    }

    synchronized DeliveryOutcome get(String eventId) {
      return byEventId.get(eventId);
    }

    synchronized int size() {
      return byEventId.size();
    }

    synchronized List<DeliveryOutcome> newestFirst(int limit) {
      List<DeliveryOutcome> all = new ArrayList<>(byEventId.values());
      List<DeliveryOutcome> result = new ArrayList<>(Math.min(limit, all.size()));
      for (int i = all.size() - 1; i >= 0 && result.size() < limit; i--) {
        result.add(all.get(i));
      }
      return result;
    }
  }
}
