package eventnative.enrichment;

import eventnative.util.JsonPath;

import java.util.Map;

final class UserAgentParseRule implements EnrichmentRule {
  private final JsonPath from;
  private final JsonPath to;
  private final UserAgentResolver resolver;

  UserAgentParseRule(JsonPath from, JsonPath to, UserAgentResolver resolver) {
    this.from = from;
    this.to = to;
    this.resolver = resolver;
  }

  @Override
  public String name() {
    return EnrichmentRules.USER_AGENT_PARSE;
  }

  @Override
  public void execute(Map<String, Object> event) throws EnrichmentException {
    Object value = from.get(event);
    if (value == null) {
      return;
    }
    if (!(value instanceof String userAgent)) {
      throw new EnrichmentException("user_agent_parse expects a string at " + from
          + " but got " + value.getClass().getSimpleName());
    }
    ParsedUserAgent parsed;
    try {
      parsed = resolver.resolve(userAgent);
    } catch (RuntimeException e) {
      throw new EnrichmentException("user_agent_parse failed for " + from + ": " + e.getMessage(), e);
    }
    if (parsed == null) {
      return;
    }
    try {
      to.set(event, parsed.toMap());
    } catch (IllegalStateException e) {
      throw new EnrichmentException(e.getMessage(), e);
    }
  }

  @Override
  public String toString() {
    return name() + "[" + from + " -> " + to + "]";
  }
}
