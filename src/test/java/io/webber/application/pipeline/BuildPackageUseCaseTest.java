package io.webber.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.webber.application.port.ClockPort;
import io.webber.application.port.ContainerWriter;
import io.webber.application.port.IconFetcher;
import io.webber.application.port.MetricsPort;
import io.webber.domain.pkg.PackageRequest;
import io.webber.infrastructure.archive.ArContainerWriter;
import io.webber.infrastructure.archive.CommonsTarballBuilder;
import io.webber.testutil.PackageFixtures;
import io.webber.testutil.RecordingMetricsPort;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.MDC;

class BuildPackageUseCaseTest {
  private static final ClockPort FIXED_CLOCK = () -> 1_700_000_000_000L;
  private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1a, '\n', 0, 42};

  @TempDir Path tempDir;

  @Test
  void buildsContainerWithMembersInClickOrder() throws Exception {
    BuildResult result = useCase(uri -> PNG, MetricsPort.NO_OP).build(request(""), tempDir);

    assertEquals(tempDir.resolve("shortcut.click"), result.packageFile());
    assertEquals("webapp-example-com", result.identifier().value());
    Map<String, byte[]> members = PackageFixtures.readContainer(result.packageFile());
    assertEquals(
        List.of("debian-binary", "control.tar.gz", "data.tar.gz", "_click-binary"),
        List.copyOf(members.keySet()));
    assertEquals("2.0\n", utf8(members.get("debian-binary")));
    assertEquals("0.4\n", utf8(members.get("_click-binary")));
  }

  @Test
  void controlTarballHoldsMetadataWithExecutablePreinst() throws Exception {
    BuildResult result = useCase(uri -> PNG, MetricsPort.NO_OP).build(request(""), tempDir);

    byte[] control = PackageFixtures.readContainer(result.packageFile()).get("control.tar.gz");
    assertEquals(
        List.of("./", "./control", "./manifest", "./md5sums", "./preinst"),
        PackageFixtures.tarNames(control));
    Map<String, byte[]> files = PackageFixtures.tarFiles(control);
    assertTrue(utf8(files.get("./control")).startsWith("Package: webapp-example-com.webber\n"));
    String manifest = utf8(files.get("./manifest"));
    assertTrue(manifest.contains("\"webapp-example-com.webber\": {"), manifest);
    assertTrue(manifest.contains("\"title\": \"Example\""), manifest);
    assertTrue(utf8(files.get("./preinst")).endsWith("exit 1"));
    for (TarArchiveEntry entry : PackageFixtures.tarEntries(control)) {
      assertEquals(0L, entry.getLongUserId());
      assertEquals(0L, entry.getLongGroupId());
      if (entry.getName().equals("./preinst") || entry.isDirectory()) {
        assertEquals(0755, entry.getMode() & 0777, entry.getName());
      } else {
        assertEquals(0644, entry.getMode() & 0777, entry.getName());
      }
    }
  }

  @Test
  void dataTarballHoldsPolicyDesktopEntryAndIcon() throws Exception {
    BuildResult result =
        useCase(uri -> PNG, MetricsPort.NO_OP).build(request("https://example.com/logo.png"), tempDir);

    assertEquals("icon.png", result.iconFileName());
    byte[] data = PackageFixtures.readContainer(result.packageFile()).get("data.tar.gz");
    assertEquals(
        List.of("./", "./icon.png", "./shortcut.apparmor", "./shortcut.desktop"),
        PackageFixtures.tarNames(data));
    Map<String, byte[]> files = PackageFixtures.tarFiles(data);
    assertArrayEquals(PNG, files.get("./icon.png"));
    String desktop = utf8(files.get("./shortcut.desktop"));
    assertTrue(desktop.contains("Icon=icon.png\n"), desktop);
    assertTrue(desktop.contains(
        "Exec=webapp-container --webappUrlPatterns=https?://example.com/* --store-session-cookies https://example.com\n"),
        desktop);
    assertTrue(utf8(files.get("./shortcut.apparmor")).contains("\"policy_version\": 16.04"));
  }

  @Test
  void md5sumsListDataFiles() throws Exception {
    BuildResult result =
        useCase(uri -> PNG, MetricsPort.NO_OP).build(request("https://example.com/logo.png"), tempDir);

    String md5sums = utf8(Files.readAllBytes(tempDir.resolve("control/md5sums")));
    String[] lines = md5sums.split("\n");
    assertEquals(3, lines.length);
    assertEquals(md5(PNG) + "  icon.png", lines[0]);
    assertTrue(lines[1].endsWith("  shortcut.apparmor"));
    assertTrue(lines[2].endsWith("  shortcut.desktop"));
    assertEquals(result.packageFile(), tempDir.resolve("shortcut.click"));
  }

  @Test
  void missingIconExtensionFallsBackToBundledSvg() throws Exception {
    IconFetcher neverCalled = uri -> {
      throw new IOException("unexpected fetch of " + uri);
    };

    BuildResult result =
        useCase(neverCalled, MetricsPort.NO_OP).build(request("https://example.com/icon"), tempDir);

    assertEquals("icon.svg", result.iconFileName());
    Map<String, byte[]> files = PackageFixtures.tarFiles(
        PackageFixtures.readContainer(result.packageFile()).get("data.tar.gz"));
    assertTrue(utf8(files.get("./icon.svg")).contains("<svg"));
  }

  @Test
  void bundledIconRecordsNoFetchedBytes() throws Exception {
    RecordingMetricsPort metrics = new RecordingMetricsPort();

    useCase(uri -> PNG, metrics).build(request(""), tempDir);

    assertEquals(1, metrics.count("build.succeeded"));
    assertTrue(metrics.observed("icon.fetch.bytes").isEmpty());
  }

  @Test
  void fetchFailureAbortsWithoutContainer() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    IconFetcher failing = uri -> {
      throw new IOException("HTTP 404 for " + uri);
    };

    PackageBuildException ex = assertThrows(
        PackageBuildException.class,
        () -> useCase(failing, metrics).build(request("https://example.com/missing.png"), tempDir));

    assertEquals(PackageBuildException.Kind.NETWORK, ex.kind());
    assertFalse(Files.exists(tempDir.resolve("shortcut.click")));
    assertEquals(1, metrics.count("build.started"));
    assertEquals(1, metrics.count("build.failed"));
    assertEquals(0, metrics.count("build.succeeded"));
    assertEquals(1, metrics.observed("build.durationMillis").size());
  }

  @Test
  void containerFailureIsArchiveError() {
    ContainerWriter broken = (target, members) -> {
      throw new IOException("disk full");
    };
    BuildPackageUseCase useCase = new BuildPackageUseCase(
        new IconResolver(uri -> PNG),
        new CommonsTarballBuilder(FIXED_CLOCK),
        broken,
        MetricsPort.NO_OP,
        FIXED_CLOCK);

    PackageBuildException ex =
        assertThrows(PackageBuildException.class, () -> useCase.build(request(""), tempDir));

    assertEquals(PackageBuildException.Kind.ARCHIVE, ex.kind());
    assertEquals("archive.container", ex.operation());
  }

  @Test
  void successRecordsMetricsAndRestoresMdc() throws Exception {
    RecordingMetricsPort metrics = new RecordingMetricsPort();

    useCase(uri -> PNG, metrics).build(request("https://example.com/logo.png"), tempDir);

    assertEquals(1, metrics.count("build.started"));
    assertEquals(1, metrics.count("build.succeeded"));
    assertFalse(metrics.hasCounter("build.failed"));
    assertEquals(List.of((long) PNG.length), metrics.observed("icon.fetch.bytes"));
    assertEquals(List.of(0L), metrics.observed("build.durationMillis"));
    assertNull(MDC.get(BuildPackageUseCase.MDC_APP_ID));
  }

  @Test
  void rebuildLeavesNoResidueFromPreviousRun() throws Exception {
    BuildPackageUseCase useCase = useCase(uri -> PNG, MetricsPort.NO_OP);
    useCase.build(request("https://example.com/logo.png"), tempDir);

    BuildResult second = useCase.build(request(""), tempDir);

    assertFalse(Files.exists(tempDir.resolve("data/icon.png")));
    assertEquals(
        List.of("./", "./icon.svg", "./shortcut.apparmor", "./shortcut.desktop"),
        PackageFixtures.tarNames(PackageFixtures.readContainer(second.packageFile()).get("data.tar.gz")));
  }

  @Test
  void fixedClockGivesByteIdenticalPackages() throws Exception {
    BuildPackageUseCase useCase = useCase(uri -> PNG, MetricsPort.NO_OP);
    Path first = useCase.build(request(""), tempDir.resolve("one")).packageFile();
    Path second = useCase.build(request(""), tempDir.resolve("two")).packageFile();

    assertArrayEquals(Files.readAllBytes(first), Files.readAllBytes(second));
  }

  @Test
  void digestTreeUsesSlashSeparatedRelativePaths() throws Exception {
    Files.createDirectories(tempDir.resolve("sub"));
    Files.writeString(tempDir.resolve("sub/b.txt"), "b");
    Files.writeString(tempDir.resolve("a.txt"), "a");

    Map<String, String> digests = BuildPackageUseCase.digestTree(tempDir);

    assertEquals(List.of("a.txt", "sub/b.txt"), List.copyOf(digests.keySet()));
    assertEquals("0cc175b9c0f1b6a831c399e269772661", digests.get("a.txt"));
  }

  private static BuildPackageUseCase useCase(IconFetcher fetcher, MetricsPort metrics) {
    return new BuildPackageUseCase(
        new IconResolver(fetcher),
        new CommonsTarballBuilder(FIXED_CLOCK),
        new ArContainerWriter(FIXED_CLOCK),
        metrics,
        FIXED_CLOCK);
  }

  private static PackageRequest request(String iconUrl) {
    return new PackageRequest(
        "https://example.com", "Example", "#FFFFFF", iconUrl, "https?://example.com/*");
  }

  private static String utf8(byte[] bytes) {
    return new String(bytes, StandardCharsets.UTF_8);
  }

  private static String md5(byte[] bytes) throws Exception {
    return HexFormat.of().formatHex(MessageDigest.getInstance("MD5").digest(bytes));
  }
}
