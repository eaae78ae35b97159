package eventnative.enrichment;

import eventnative.util.JsonPath;

import java.util.List;
import java.util.Objects;

/**
 * Builds enrichment rules from configuration.
 *
 * <p>Every destination runs the two {@link #defaults() default rules} first, then its
 * configured rules in declaration order.
 */
public final class EnrichmentRules {
  public static final String IP_LOOKUP = "ip_lookup";
  public static final String USER_AGENT_PARSE = "user_agent_parse";

  public static final String DEFAULT_IP_FROM = "/source_ip";
  public static final String DEFAULT_IP_TO = "/eventn_ctx/location";
  public static final String DEFAULT_UA_FROM = "/eventn_ctx/user_agent";
  public static final String DEFAULT_UA_TO = "/eventn_ctx/parsed_ua";

  private final GeoResolver geoResolver;
  private final UserAgentResolver userAgentResolver;

  public EnrichmentRules(GeoResolver geoResolver, UserAgentResolver userAgentResolver) {
    this.geoResolver = Objects.requireNonNull(geoResolver, "geoResolver");
    this.userAgentResolver = Objects.requireNonNull(userAgentResolver, "userAgentResolver");
  }

  /**
   * The unconditional rules: {@code ip_lookup} from {@code /source_ip} to
   * {@code /eventn_ctx/location}, then {@code user_agent_parse} from
   * {@code /eventn_ctx/user_agent} to {@code /eventn_ctx/parsed_ua}.
   */
  public List<EnrichmentRule> defaults() {
    return List.of(
        new IpLookupRule(JsonPath.parse(DEFAULT_IP_FROM), JsonPath.parse(DEFAULT_IP_TO), geoResolver),
        new UserAgentParseRule(JsonPath.parse(DEFAULT_UA_FROM), JsonPath.parse(DEFAULT_UA_TO), userAgentResolver));
  }

  /**
   * Creates a configured rule.
   *
   * @throws IllegalArgumentException on an unknown rule name or a missing/invalid path
   */
  public EnrichmentRule create(RuleConfig config) {
    Objects.requireNonNull(config, "config");
    String name = config.getName();
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("rule name is required");
    }
    JsonPath from = path("from", config.getFrom());
    JsonPath to = path("to", config.getTo());
    switch (name.trim()) {
      case IP_LOOKUP:
        return new IpLookupRule(from, to, geoResolver);
      case USER_AGENT_PARSE:
        return new UserAgentParseRule(from, to, userAgentResolver);
      default:
        throw new IllegalArgumentException("Unknown enrichment rule name: " + name
            + ". Available rules: [" + IP_LOOKUP + ", " + USER_AGENT_PARSE + "]");
    }
  }

  private static JsonPath path(String field, String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("'" + field + "' is required");
    }
    return JsonPath.parse(value);
  }
}
