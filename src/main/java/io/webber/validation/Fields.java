package io.webber.validation;

import java.util.Map;
import java.util.Objects;

/**
 * Reads single-line settings such as {@code url}, {@code name} and {@code iconUrl} out of a merged
 * configuration map.
 *
 * <p>Values end up in line-oriented files (the control file, the desktop entry), so any ISO control
 * character is rejected. Every failure is an {@link IllegalArgumentException} naming the key.</p>
 *
 * @since 0.1.0
 * @see Paths
 */
public final class Fields {

  private Fields() {
    // Utility
  }

  /**
   * Returns the trimmed value stored under {@code key}.
   *
   * @param settings merged configuration
   * @param key setting name
   * @return trimmed, non-empty value
   * @throws IllegalArgumentException if the setting is absent, blank or spans lines
   */
  public static String required(Map<String, String> settings, String key) {
    String value = optional(settings, key);
    if (value.isEmpty()) {
      throw new IllegalArgumentException(key + " is required");
    }
    return value;
  }

  /**
   * Returns the trimmed value stored under {@code key}, or an empty string when it is absent.
   *
   * @param settings merged configuration
   * @param key setting name
   * @return trimmed value; never {@code null}
   * @throws IllegalArgumentException if the value spans lines
   */
  public static String optional(Map<String, String> settings, String key) {
    Objects.requireNonNull(settings, "settings");
    String value = settings.get(key);
    return value == null ? "" : singleLine(key, value).trim();
  }

  /**
   * Rejects values containing ISO control characters.
   *
   * @param key setting name used in the message
   * @param value candidate text
   * @return {@code value} unchanged
   * @throws IllegalArgumentException if a control character is present
   */
  public static String singleLine(String key, String value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        throw new IllegalArgumentException(key + " must not contain control characters");
      }
    }
    return value;
  }
}
