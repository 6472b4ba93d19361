package org.monetdb.client.common.util;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

public class StringUtil {

  /**
   * Extracts the query options of a MAPI URL, e.g. {@code
   * mapi:monetdb://host:50000/db?replysize=200&binary=off}. Anything that is not a URL with a query
   * part yields an empty map.
   */
  public static Map<String, String> parseUrlOptions(String url) {
    if (url == null) {
      return Collections.emptyMap();
    }
    int queryStart = url.indexOf('?');
    if (queryStart < 0 || queryStart == url.length() - 1) {
      return Collections.emptyMap();
    }
    Map<String, String> options = new LinkedHashMap<>();
    for (String pair : url.substring(queryStart + 1).split("&")) {
      if (pair.isEmpty()) {
        continue;
      }
      int eq = pair.indexOf('=');
      String key = eq < 0 ? pair : pair.substring(0, eq);
      String value = eq < 0 ? "" : pair.substring(eq + 1);
      options.put(
          URLDecoder.decode(key, StandardCharsets.UTF_8),
          URLDecoder.decode(value, StandardCharsets.UTF_8));
    }
    return options;
  }

  /**
   * Maps the boolean spellings accepted for the {@code binary} option to a level: true/on to "1",
   * false/off to "0". Other values are returned unchanged.
   */
  public static String normalizeBinaryLevel(String value) {
    if (value == null) {
      return null;
    }
    switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "true":
      case "on":
        return "1";
      case "false":
      case "off":
        return "0";
      default:
        return value.trim();
    }
  }

  /** Formats an offset east of UTC as a signed {@code +HH:MM} interval literal. */
  public static String formatTimeZoneOffset(int secondsEastOfUtc) {
    int hours = secondsEastOfUtc / 3600;
    int minutes = Math.abs((secondsEastOfUtc - 3600 * hours) / 60);
    String sign = secondsEastOfUtc < 0 ? "-" : "+";
    return String.format("%s%02d:%02d", sign, Math.abs(hours), minutes);
  }
}
