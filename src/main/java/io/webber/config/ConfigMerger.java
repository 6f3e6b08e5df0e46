package io.webber.config;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Layers build settings: command line over YAML over defaults.
 *
 * @since 0.1.0
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Merges the three layers.
   *
   * @param defaults embedded defaults
   * @param yaml settings read from the configuration file; empty when none was given
   * @param cli {@code key=value} arguments
   * @param yamlOverridden receives each key whose YAML value the command line replaced
   * @return unmodifiable merged settings
   */
  public static Map<String, String> merge(
      Map<String, String> defaults,
      Map<String, String> yaml,
      Map<String, String> cli,
      Consumer<String> yamlOverridden) {
    Objects.requireNonNull(yamlOverridden, "yamlOverridden");
    Map<String, String> merged = new HashMap<>(defaults);
    merged.putAll(yaml);
    cli.forEach((key, value) -> {
      if (yaml.containsKey(key)) {
        yamlOverridden.accept(key);
      }
      merged.put(key, value);
    });
    return Map.copyOf(merged);
  }
}
