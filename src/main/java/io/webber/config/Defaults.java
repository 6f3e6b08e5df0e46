package io.webber.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lowest-precedence settings for the {@code build} command.
 *
 * <p>Every optional key a YAML file or the command line may set has an entry here, so the merged
 * map always carries a value for it.</p>
 *
 * @since 0.1.0
 */
public final class Defaults {

  private Defaults() {}

  /**
   * Returns the build defaults.
   *
   * @return unmodifiable map without {@code url} or {@code name}
   */
  public static Map<String, String> forBuild() {
    Map<String, String> defaults = new LinkedHashMap<>();
    defaults.put("themeColor", BuildConfig.DEFAULT_THEME_COLOR);
    defaults.put("iconUrl", "");
    defaults.put("urlPatterns", "");
    defaults.put("stagingRoot", StagingRoots.defaultRoot().toString());
    defaults.put("iconTimeoutSeconds", Integer.toString(BuildConfig.DEFAULT_ICON_TIMEOUT_SECONDS));
    defaults.put("dryRun", "false");
    defaults.put("metricsExporter", MetricsSettings.NONE);
    defaults.put("otelEndpoint", "");
    return Map.copyOf(defaults);
  }
}
