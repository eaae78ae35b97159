/**
 * Destination configuration, the type registry, construction and routing.
 *
 * <p>{@link eventnative.storage.DestinationRegistry} maps type ids to adapter factories, filled
 * by {@link java.util.ServiceLoader} discovery of {@link eventnative.storage.DestinationProvider}s
 * and explicit registration. {@link eventnative.storage.DestinationFactory} validates a
 * {@link eventnative.storage.DestinationConfig} and builds its proxy;
 * {@link eventnative.storage.DestinationService} owns all proxies of a process.
 */
package eventnative.storage;
