package io.webber.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StagingRootsTest {
  @TempDir Path tempDir;

  @Test
  void usesXdgCacheHomeWhenSet() {
    Path root = StagingRoots.resolve(Map.of("XDG_CACHE_HOME", tempDir.toString()), "/home/nobody");

    assertEquals(tempDir.resolve("webber.timsueberkrueb").resolve("click-build"), root);
  }

  @Test
  void fallsBackToDotCacheUnderHome() {
    Path root = StagingRoots.resolve(Map.of("XDG_CACHE_HOME", "  "), tempDir.toString());

    assertEquals(tempDir.resolve(".cache/webber.timsueberkrueb/click-build"), root);
  }

  @Test
  void defaultRootIsAbsolute() {
    assertTrue(StagingRoots.defaultRoot().isAbsolute());
  }
}
