package eventnative.enrichment;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Location resolved for an IP address. Any component may be {@code null}.
 */
public record GeoData(
    String country,
    String region,
    String city,
    String zip,
    Double latitude,
    Double longitude
) {

  /** Non-null components keyed by their column names. */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    putIfPresent(map, "country", country);
    putIfPresent(map, "region", region);
    putIfPresent(map, "city", city);
    putIfPresent(map, "zip", zip);
    putIfPresent(map, "latitude", latitude);
    putIfPresent(map, "longitude", longitude);
    return map;
  }

  private static void putIfPresent(Map<String, Object> map, String key, Object value) {
    if (value != null) {
      map.put(key, value);
    }
  }
}
