package eventnative.enrichment;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Browser, OS and device parsed from a user agent string.
 */
public record ParsedUserAgent(
    String uaFamily,
    String uaVersion,
    String osFamily,
    String osVersion,
    String deviceFamily,
    boolean bot
) {

  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("ua_family", uaFamily);
    if (uaVersion != null) {
      map.put("ua_version", uaVersion);
    }
    map.put("os_family", osFamily);
    if (osVersion != null) {
      map.put("os_version", osVersion);
    }
    map.put("device_family", deviceFamily);
    map.put("bot", bot);
    return map;
  }
}
