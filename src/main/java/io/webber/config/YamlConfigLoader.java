package io.webber.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads build settings from a YAML file.
 *
 * <p>The file holds up to two mappings of plain settings: {@code common}, then the command section
 * (for example {@code build}), whose entries win. Other top-level sections are ignored.</p>
 *
 * <pre>{@code
 * common:
 *   stagingRoot: /tmp/webber
 * build:
 *   url: https://example.com
 *   name: Example
 *   iconUrl: https://example.com/logo.png
 * }</pre>
 *
 * @since 0.1.0
 */
public final class YamlConfigLoader {

  private YamlConfigLoader() {}

  /**
   * Loads the settings of {@code command} from {@code path}.
   *
   * @param path YAML file
   * @param command section name
   * @return settings keyed by name; an empty or section-less file yields an empty map
   * @throws java.nio.file.NoSuchFileException when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or a setting is not a scalar
   */
  public static Map<String, String> load(Path path, String command) throws IOException {
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("malformed YAML in " + path + ": " + ex.getMessage(), ex);
    }
    if (document == null) {
      return Map.of();
    }
    if (!(document instanceof Map<?, ?> sections)) {
      throw new IllegalArgumentException(path + " must contain a mapping of sections");
    }
    Map<String, String> settings = new LinkedHashMap<>();
    readSection(sections.get("common"), "common", settings);
    readSection(sections.get(command), command, settings);
    return Map.copyOf(settings);
  }

  private static void readSection(Object section, String name, Map<String, String> settings) {
    if (section == null) {
      return;
    }
    if (!(section instanceof Map<?, ?> entries)) {
      throw new IllegalArgumentException("section '" + name + "' must be a mapping");
    }
    for (Map.Entry<?, ?> entry : entries.entrySet()) {
      String key = String.valueOf(entry.getKey());
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
        throw new IllegalArgumentException("setting '" + name + "." + key + "' must be a single value");
      }
      settings.put(key, value == null ? "" : value.toString());
    }
  }
}
