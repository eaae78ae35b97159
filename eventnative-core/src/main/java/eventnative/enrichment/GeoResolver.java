package eventnative.enrichment;

/**
 * Resolves an IP address to a location, typically backed by a MaxMind-style database.
 *
 * <p>The {@link #NOOP} instance resolves nothing, which leaves {@code ip_lookup} a no-op.
 */
@FunctionalInterface
public interface GeoResolver {

  GeoResolver NOOP = ip -> null;

  /**
   * @param ip textual IPv4 or IPv6 address
   * @return the location, or {@code null} if unknown
   * @throws Exception if the lookup itself fails
   */
  GeoData resolve(String ip) throws Exception;
}
