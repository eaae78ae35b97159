package eventnative.enrichment;

/**
 * Parses user agent strings.
 *
 * @see UapUserAgentResolver
 */
@FunctionalInterface
public interface UserAgentResolver {

  UserAgentResolver NOOP = userAgent -> null;

  /**
   * @param userAgent raw {@code User-Agent} header value
   * @return parsed data, or {@code null} if nothing could be recognized
   */
  ParsedUserAgent resolve(String userAgent);
}
