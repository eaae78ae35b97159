package eventnative.storage;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Maps destination type ids to adapter factories. Populated once at startup, then read-only
 * in practice.
 */
public final class DestinationRegistry {
  private static final Logger logger = Logger.getLogger(DestinationRegistry.class.getName());

  private final Map<String, AdapterFactory> factories = new ConcurrentHashMap<>();

  /**
   * Registry holding every {@link DestinationProvider} found on the context class path.
   */
  public static DestinationRegistry discover() {
    return discover(Thread.currentThread().getContextClassLoader());
  }

  public static DestinationRegistry discover(ClassLoader classLoader) {
    DestinationRegistry registry = new DestinationRegistry();
    for (DestinationProvider provider : ServiceLoader.load(DestinationProvider.class, classLoader)) {
      registry.register(provider);
      logger.log(Level.INFO, "Registered destination type: {0}", provider.type());
    }
    return registry;
  }

  /**
   * @throws IllegalArgumentException if the type is already registered
   */
  public DestinationRegistry register(String type, AdapterFactory factory) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(factory, "factory");
    if (type.isBlank()) {
      throw new IllegalArgumentException("type must not be blank");
    }
    if (factories.putIfAbsent(type, factory) != null) {
      throw new IllegalArgumentException("Destination type already registered: " + type);
    }
    return this;
  }

  public DestinationRegistry register(DestinationProvider provider) {
    Objects.requireNonNull(provider, "provider");
    return register(provider.type(), provider);
  }

  public Optional<AdapterFactory> find(String type) {
    return Optional.ofNullable(factories.get(type));
  }

  /** Registered type ids, sorted. */
  public Set<String> types() {
    return new TreeSet<>(factories.keySet());
  }
}
