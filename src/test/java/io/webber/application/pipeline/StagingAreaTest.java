package io.webber.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StagingAreaTest {
  @TempDir Path tempDir;

  @Test
  void recreateCreatesMissingRootAndSubtrees() throws Exception {
    Path root = tempDir.resolve("a/b/staging");

    StagingArea area = StagingArea.recreate(root);

    assertEquals(root, area.root());
    assertTrue(Files.isDirectory(area.controlDir()));
    assertTrue(Files.isDirectory(area.dataDir()));
    assertEquals(List.of("control", "data"), children(root));
  }

  @Test
  void recreateWipesResidueFromEarlierBuilds() throws Exception {
    Path root = tempDir.resolve("staging");
    Files.createDirectories(root.resolve("data/nested"));
    Files.writeString(root.resolve("data/nested/icon.png"), "old");
    Files.writeString(root.resolve("shortcut.click"), "old");

    StagingArea.recreate(root);

    assertEquals(List.of("control", "data"), children(root));
    assertEquals(List.of(), children(root.resolve("data")));
  }

  @Test
  void recreateRemovesSymlinksWithoutFollowingThem() throws Exception {
    Path outside = Files.createDirectories(tempDir.resolve("outside"));
    Path keep = Files.writeString(outside.resolve("keep.txt"), "keep");
    Path root = Files.createDirectories(tempDir.resolve("staging"));
    try {
      Files.createSymbolicLink(root.resolve("link"), outside);
    } catch (UnsupportedOperationException | java.io.IOException ex) {
      assumeTrue(false, "symbolic links unsupported");
    }

    StagingArea.recreate(root);

    assertTrue(Files.exists(keep));
    assertFalse(Files.exists(root.resolve("link")));
  }

  @Test
  void writeCreatesAndTruncates() throws Exception {
    StagingArea area = StagingArea.recreate(tempDir.resolve("staging"));

    Path file = area.write("data/file.txt", "a longer first version");
    area.write("data/file.txt", "short");

    assertEquals(area.dataDir().resolve("file.txt"), file);
    assertArrayEquals("short".getBytes(StandardCharsets.UTF_8), Files.readAllBytes(file));
  }

  @Test
  void resolveRejectsPathsOutsideRoot() throws Exception {
    StagingArea area = StagingArea.recreate(tempDir.resolve("staging"));

    assertThrows(IllegalArgumentException.class, () -> area.resolve("../escape"));
    assertThrows(IllegalArgumentException.class, () -> area.resolve("data/../../escape"));
    assertThrows(IllegalArgumentException.class, () -> area.resolve("."));
  }

  @Test
  void markExecutableSetsOwnerGroupOtherExecute() throws Exception {
    assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
    StagingArea area = StagingArea.recreate(tempDir.resolve("staging"));
    Path script = area.write("control/preinst", "#! /bin/sh");

    area.markExecutable(script);

    assertEquals("rwxr-xr-x", PosixFilePermissions.toString(Files.getPosixFilePermissions(script)));
  }

  private static List<String> children(Path dir) throws Exception {
    try (Stream<Path> list = Files.list(dir)) {
      return list.map(p -> p.getFileName().toString()).sorted().toList();
    }
  }
}
