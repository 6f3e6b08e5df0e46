package io.webber.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void buildSectionIsLayeredOverCommon() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("webber.yaml"), """
        common:
          stagingRoot: /tmp/webber-common
          metricsExporter: none
        build:
          url: https://example.com
          name: Example
          stagingRoot: /tmp/webber-build
          iconTimeoutSeconds: 10
          dryRun: true
        identify:
          url: https://other.example
        """);

    Map<String, String> settings = YamlConfigLoader.load(yaml, "build");

    assertEquals(Map.of(
        "stagingRoot", "/tmp/webber-build",
        "metricsExporter", "none",
        "url", "https://example.com",
        "name", "Example",
        "iconTimeoutSeconds", "10",
        "dryRun", "true"), settings);
  }

  @Test
  void emptyValueBecomesEmptyString() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("empty-icon.yaml"), """
        build:
          iconUrl:
        """);

    assertEquals(Map.of("iconUrl", ""), YamlConfigLoader.load(yaml, "build"));
  }

  @Test
  void fileWithoutMatchingSectionsYieldsNoSettings() throws IOException {
    Path empty = Files.writeString(tempDir.resolve("empty.yaml"), "");
    Path other = Files.writeString(tempDir.resolve("other.yaml"), "identify:\n  url: https://example.com\n");

    assertEquals(Map.of(), YamlConfigLoader.load(empty, "build"));
    assertEquals(Map.of(), YamlConfigLoader.load(other, "build"));
  }

  @Test
  void missingFileIsReported() {
    assertThrows(NoSuchFileException.class,
        () -> YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "build"));
  }

  @Test
  void nestedSettingIsRejected() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("nested.yaml"), """
        build:
          icon:
            url: https://example.com/logo.png
        """);

    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "build"));
    assertEquals("setting 'build.icon' must be a single value", ex.getMessage());
  }

  @Test
  void listSettingIsRejected() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("list.yaml"), """
        common:
          urlPatterns:
            - https://a.example/*
            - https://b.example/*
        """);

    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "build"));
    assertEquals("setting 'common.urlPatterns' must be a single value", ex.getMessage());
  }

  @Test
  void nonMappingDocumentIsRejected() throws IOException {
    Path list = Files.writeString(tempDir.resolve("list-root.yaml"), "- build\n");
    Path scalarSection = Files.writeString(tempDir.resolve("scalar.yaml"), "build: yes\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(list, "build"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(scalarSection, "build"));
  }

  @Test
  void malformedYamlIsRejected() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("broken.yaml"), "build: [unclosed");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "build"));
  }
}
