package eventnative.enrichment;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import ua_parser.Client;
import ua_parser.Parser;

import java.util.Objects;

/**
 * {@link UserAgentResolver} backed by the uap-java regex database. Parsed agents are kept in a
 * size-bounded Caffeine cache; user agents repeat heavily across events.
 */
public final class UapUserAgentResolver implements UserAgentResolver {
  static final int DEFAULT_CACHE_SIZE = 10_000;
  private static final String SPIDER = "Spider";

  private final Parser parser;
  private final Cache<String, ParsedUserAgent> cache;

  public UapUserAgentResolver(Parser parser, int cacheSize) {
    this.parser = Objects.requireNonNull(parser, "parser");
    if (cacheSize <= 0) {
      throw new IllegalArgumentException("cacheSize must be > 0");
    }
    this.cache = Caffeine.newBuilder()
        .maximumSize(cacheSize)
        .build();
  }

  /**
   * Creates a resolver using the regexes bundled with uap-java.
   *
   * @throws IllegalStateException if the bundled regexes cannot be loaded
   */
  public static UapUserAgentResolver create() {
    try {
      return new UapUserAgentResolver(new Parser(), DEFAULT_CACHE_SIZE);
    } catch (Exception e) {
      throw new IllegalStateException("Failed to load user agent regexes", e);
    }
  }

  @Override
  public ParsedUserAgent resolve(String userAgent) {
    if (userAgent == null || userAgent.isBlank()) {
      return null;
    }
    return cache.get(userAgent, this::parse);
  }

  private ParsedUserAgent parse(String userAgent) {
    Client client = parser.parse(userAgent);
    return new ParsedUserAgent(
        client.userAgent.family,
        version(client.userAgent.major, client.userAgent.minor, client.userAgent.patch),
        client.os.family,
        version(client.os.major, client.os.minor, client.os.patch),
        client.device.family,
        SPIDER.equals(client.device.family));
  }

  long cachedCount() {
    cache.cleanUp();
    return cache.estimatedSize();
  }

  private static String version(String major, String minor, String patch) {
    if (major == null) {
      return null;
    }
    StringBuilder sb = new StringBuilder(major);
    if (minor != null) {
      sb.append('.').append(minor);
      if (patch != null) {
        sb.append('.').append(patch);
      }
    }
    return sb.toString();
  }
}
