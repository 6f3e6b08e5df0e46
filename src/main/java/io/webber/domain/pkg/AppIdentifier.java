package io.webber.domain.pkg;

import java.util.Objects;

/**
 * <strong>What:</strong> Package-safe application identifier derived from a web site URL.
 * <p><strong>Role:</strong> Domain value used as the click package machine name and in generated metadata.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Pick the URL host, or the raw URL when no host can be extracted.</li>
 *   <li>Reduce the text to lowercase letters, digits and hyphens, prefixed with {@code webapp-}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @implNote The retained letter range is {@code a} through {@code y}: {@code z} is dropped. Installed
 * packages already carry identifiers derived this way, so the range must not be widened.
 * @param value full identifier, e.g. {@code webapp-example-com}
 * @since 0.1.0
 */
public record AppIdentifier(String value) {
  /** Prefix shared by every generated identifier. */
  public static final String PREFIX = "webapp-";
  /** Suffix appended to form the click package name. */
  public static final String PACKAGE_SUFFIX = ".webber";

  public AppIdentifier {
    Objects.requireNonNull(value, "value");
  }

  /**
   * Derives the identifier for {@code url}. Never throws for malformed input.
   *
   * @param url web site address; {@code null} is treated as empty
   * @return sanitized identifier
   */
  public static AppIdentifier fromUrl(String url) {
    return new AppIdentifier(PREFIX + sanitize(HostResolution.of(url).value()));
  }

  /**
   * Lower-cases ASCII letters, maps {@code .} and {@code _} to {@code -}, keeps {@code a-y} and ASCII
   * digits, and drops every other character.
   *
   * @param text host or raw URL text
   * @return sanitized text; may be empty
   */
  static String sanitize(String text) {
    StringBuilder out = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c >= 'A' && c <= 'Z') {
        c = (char) (c + ('a' - 'A'));
      }
      if (c == '.' || c == '_') {
        out.append('-');
      } else if ((c >= 'a' && c < 'z') || (c >= '0' && c <= '9')) {
        out.append(c);
      }
    }
    return out.toString();
  }

  /**
   * Returns the click package name, {@code <identifier>.webber}.
   *
   * @return package name used in the control file, manifest name and hooks table
   */
  public String packageName() {
    return value + PACKAGE_SUFFIX;
  }

  @Override
  public String toString() {
    return value;
  }
}
