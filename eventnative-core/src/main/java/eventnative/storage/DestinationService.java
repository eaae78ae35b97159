package eventnative.storage;

import eventnative.RawEvent;
import eventnative.delivery.StorageProxy;
import eventnative.outcome.OutcomeCache;
import eventnative.schema.TransformException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * All destinations of a process: builds them, routes events to them and closes them.
 *
 * <p>Destinations are built independently; one that fails to build is logged, recorded in
 * {@link #failures()} and left out while the others start. Each event goes to every destination
 * whose {@code only_tokens} list is empty or contains the event's token. A rejection by one
 * destination never prevents delivery to the others.
 */
public final class DestinationService implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(DestinationService.class.getName());

  private final Map<String, StorageProxy> proxies;
  private final Map<String, Set<String>> tokenFilters;
  private final Map<String, DestinationConfigException> failures;
  private final OutcomeCache outcomes;

  private DestinationService(Map<String, StorageProxy> proxies, Map<String, Set<String>> tokenFilters,
                             Map<String, DestinationConfigException> failures, OutcomeCache outcomes) {
    this.proxies = Collections.unmodifiableMap(proxies);
    this.tokenFilters = Collections.unmodifiableMap(tokenFilters);
    this.failures = Collections.unmodifiableMap(failures);
    this.outcomes = outcomes;
  }

  /**
   * Builds every configured destination.
   *
   * @param factory destination factory
   * @param configs destination name to configuration, in start order
   */
  public static DestinationService create(DestinationFactory factory, Map<String, DestinationConfig> configs) {
    Objects.requireNonNull(factory, "factory");
    Objects.requireNonNull(configs, "configs");
    Map<String, StorageProxy> proxies = new LinkedHashMap<>();
    Map<String, Set<String>> tokenFilters = new LinkedHashMap<>();
    Map<String, DestinationConfigException> failures = new LinkedHashMap<>();
    for (Map.Entry<String, DestinationConfig> entry : configs.entrySet()) {
      String name = entry.getKey();
      try {
        proxies.put(name, factory.create(name, entry.getValue()));
        tokenFilters.put(name, Set.copyOf(entry.getValue().getOnlyTokens()));
      } catch (DestinationConfigException e) {
        logger.log(Level.SEVERE, "Destination " + name + " is not started", e);
        failures.put(name, e);
      }
    }
    logger.log(Level.INFO, "Started {0} of {1} destinations", new Object[]{proxies.size(), configs.size()});
    return new DestinationService(proxies, tokenFilters, failures, factory.context().outcomes());
  }

  /**
   * Routes an event to every matching destination.
   *
   * @return per-destination results; never throws for a single destination's failure
   */
  public RoutingResult route(RawEvent event) {
    Objects.requireNonNull(event, "event");
    List<String> accepted = new ArrayList<>();
    List<String> skipped = new ArrayList<>();
    Map<String, Exception> rejected = new LinkedHashMap<>();
    for (Map.Entry<String, StorageProxy> entry : proxies.entrySet()) {
      String name = entry.getKey();
      if (!matches(name, event.token())) {
        continue;
      }
      try {
        if (entry.getValue().consume(event)) {
          accepted.add(name);
        } else {
          skipped.add(name);
        }
      } catch (TransformException | RuntimeException e) {
        logger.log(Level.WARNING, "[{0}] Event {1} rejected: {2}",
            new Object[]{name, event.eventId(), e.getMessage()});
        rejected.put(name, e);
      }
    }
    return new RoutingResult(accepted, skipped, rejected);
  }

  private boolean matches(String destination, String token) {
    Set<String> tokens = tokenFilters.get(destination);
    return tokens == null || tokens.isEmpty() || (token != null && tokens.contains(token));
  }

  public Optional<StorageProxy> proxy(String name) {
    return Optional.ofNullable(proxies.get(name));
  }

  /** Started destinations, in start order. */
  public Map<String, StorageProxy> proxies() {
    return proxies;
  }

  /** Destinations that failed to build, with the reason. */
  public Map<String, DestinationConfigException> failures() {
    return failures;
  }

  public OutcomeCache outcomes() {
    return outcomes;
  }

  /**
   * Closes every destination in start order. All are closed even if some fail; the first
   * failure is rethrown with the others suppressed.
   */
  @Override
  public void close() {
    RuntimeException failure = null;
    for (StorageProxy proxy : proxies.values()) {
      try {
        proxy.close();
      } catch (RuntimeException e) {
        if (failure == null) {
          failure = e;
        } else {
          failure.addSuppressed(e);
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
  }
}
