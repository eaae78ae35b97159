package eventnative.enrichment;

import eventnative.util.JsonPath;

import java.util.Map;

final class IpLookupRule implements EnrichmentRule {
  private final JsonPath from;
  private final JsonPath to;
  private final GeoResolver resolver;

  IpLookupRule(JsonPath from, JsonPath to, GeoResolver resolver) {
    this.from = from;
    this.to = to;
    this.resolver = resolver;
  }

  @Override
  public String name() {
    return EnrichmentRules.IP_LOOKUP;
  }

  @Override
  public void execute(Map<String, Object> event) throws EnrichmentException {
    Object value = from.get(event);
    if (!(value instanceof String ip) || ip.isBlank()) {
      return;
    }
    GeoData geo;
    try {
      geo = resolver.resolve(ip.trim());
    } catch (Exception e) {
      throw new EnrichmentException("ip_lookup failed for " + from + "=" + ip + ": " + e.getMessage(), e);
    }
    if (geo == null) {
      return;
    }
    try {
      to.set(event, geo.toMap());
    } catch (IllegalStateException e) {
      throw new EnrichmentException(e.getMessage(), e);
    }
  }

  @Override
  public String toString() {
    return name() + "[" + from + " -> " + to + "]";
  }
}
