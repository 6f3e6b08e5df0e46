package io.webber.config;

import io.webber.domain.pkg.HostResolution;
import io.webber.domain.pkg.PackageRequest;
import io.webber.validation.Fields;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable settings for one {@code build} invocation.
 *
 * @param url web site address
 * @param name display title
 * @param themeColor splash color token
 * @param iconUrl icon URL; empty selects the bundled icon
 * @param urlPatterns URL pattern expression handed to the launcher
 * @param stagingRoot directory the package is assembled in
 * @param iconTimeout icon fetch timeout; empty means no timeout
 * @since 0.1.0
 */
public record BuildConfig(
    String url,
    String name,
    String themeColor,
    String iconUrl,
    String urlPatterns,
    Path stagingRoot,
    Optional<Duration> iconTimeout) {

  /** Splash color used when none is configured. */
  public static final String DEFAULT_THEME_COLOR = "#FFFFFF";
  /** Icon timeout used when none is configured. */
  public static final int DEFAULT_ICON_TIMEOUT_SECONDS = 30;
  private static final int MAX_ICON_TIMEOUT_SECONDS = 3_600;

  public BuildConfig {
    Objects.requireNonNull(url, "url");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(themeColor, "themeColor");
    Objects.requireNonNull(iconUrl, "iconUrl");
    Objects.requireNonNull(urlPatterns, "urlPatterns");
    Objects.requireNonNull(stagingRoot, "stagingRoot");
    Objects.requireNonNull(iconTimeout, "iconTimeout");
  }

  /**
   * Builds a configuration from a flattened key/value map.
   *
   * <p>{@code url} and {@code name} are required. A blank {@code urlPatterns} is derived from the URL
   * host as {@code https?://<host>/*}; a blank {@code stagingRoot} resolves to
   * {@link StagingRoots#defaultRoot()}.</p>
   *
   * @param options merged configuration
   * @return validated configuration
   * @throws IllegalArgumentException when {@code url} or {@code name} is missing or a value is malformed
   */
  public static BuildConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String url = Fields.required(options, "url");
    String name = Fields.required(options, "name");
    String themeColor = Fields.optional(options, "themeColor");
    if (themeColor.isEmpty()) {
      themeColor = DEFAULT_THEME_COLOR;
    }
    String iconUrl = Fields.optional(options, "iconUrl");
    String urlPatterns = Fields.optional(options, "urlPatterns");
    if (urlPatterns.isEmpty()) {
      urlPatterns = defaultUrlPatterns(url);
    }
    String rootValue = Fields.optional(options, "stagingRoot");
    Path stagingRoot = rootValue.isEmpty() ? StagingRoots.defaultRoot() : Path.of(rootValue);
    Optional<Duration> timeout = parseTimeout(options.get("iconTimeoutSeconds"));
    return new BuildConfig(url, name, themeColor, iconUrl, urlPatterns, stagingRoot, timeout);
  }

  /**
   * Derives the pattern admitting both schemes on the URL's host.
   *
   * @param url web site address
   * @return {@code https?://<host>/*}
   */
  public static String defaultUrlPatterns(String url) {
    return "https?://" + HostResolution.of(url).value() + "/*";
  }

  /** Converts this configuration to the request accepted by the build pipeline. */
  public PackageRequest toRequest() {
    return new PackageRequest(url, name, themeColor, iconUrl, urlPatterns);
  }

  private static Optional<Duration> parseTimeout(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.of(Duration.ofSeconds(DEFAULT_ICON_TIMEOUT_SECONDS));
    }
    int seconds;
    try {
      seconds = Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("iconTimeoutSeconds must be an integer (was '" + raw + "')", ex);
    }
    if (seconds < 0 || seconds > MAX_ICON_TIMEOUT_SECONDS) {
      throw new IllegalArgumentException(
          "iconTimeoutSeconds must be between 0 and " + MAX_ICON_TIMEOUT_SECONDS);
    }
    return seconds == 0 ? Optional.empty() : Optional.of(Duration.ofSeconds(seconds));
  }
}
