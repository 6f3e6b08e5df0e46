package io.webber.logging;

import java.nio.charset.StandardCharsets;

/**
 * Keeps user-supplied values (URLs, titles) bounded in log lines.
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {

  private Logs() {}

  /**
   * Cuts {@code value} down to at most {@code maxBytes} UTF-8 bytes without splitting a character.
   *
   * @param value text to log; {@code null} yields {@code "<null>"}
   * @param maxBytes byte budget; must be positive
   * @return {@code value} when it fits, otherwise a prefix followed by {@code "... (truncated, N of M)"}
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    if (value == null) {
      return "<null>";
    }
    int total = value.getBytes(StandardCharsets.UTF_8).length;
    if (total <= maxBytes) {
      return value;
    }
    int used = 0;
    int end = 0;
    while (end < value.length()) {
      int cp = value.codePointAt(end);
      int width = utf8Width(cp);
      if (used + width > maxBytes) {
        break;
      }
      used += width;
      end += Character.charCount(cp);
    }
    return value.substring(0, end) + "... (truncated, " + maxBytes + " of " + total + ")";
  }

  private static int utf8Width(int codePoint) {
    if (codePoint < 0x80) {
      return 1;
    }
    if (codePoint < 0x800) {
      return 2;
    }
    return codePoint < 0x10000 ? 3 : 4;
  }
}
