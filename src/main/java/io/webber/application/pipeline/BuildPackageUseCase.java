package io.webber.application.pipeline;

import io.webber.application.pipeline.PackageBuildException.Kind;
import io.webber.application.port.ClockPort;
import io.webber.application.port.ContainerWriter;
import io.webber.application.port.MetricsPort;
import io.webber.application.port.TarballBuilder;
import io.webber.domain.archive.ArchiveMember;
import io.webber.domain.content.ControlFiles;
import io.webber.domain.content.DataFiles;
import io.webber.domain.icon.IconSource;
import io.webber.domain.pkg.AppIdentifier;
import io.webber.domain.pkg.PackageRequest;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Builds a click package for a web site.
 * <p><strong>Role:</strong> Application-layer use case driving the staging area, content generators,
 * icon resolver, tarball builder and container writer in a fixed sequence.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Recreate the staging tree and write every generated file.</li>
 *   <li>Archive {@code control/} and {@code data/} and assemble the container.</li>
 *   <li>Abort at the first failure with a categorized {@link PackageBuildException}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds no per-build state; concurrent builds are safe only with
 * distinct staging roots.</p>
 * <p><strong>Observability:</strong> Emits {@code build.started}, {@code build.succeeded},
 * {@code build.failed}, {@code build.durationMillis} and, for downloaded icons,
 * {@code icon.fetch.bytes}; logs carry the {@code appId} MDC key.</p>
 *
 * @since 0.1.0
 */
public final class BuildPackageUseCase {
  private static final Logger log = LoggerFactory.getLogger(BuildPackageUseCase.class);

  /** File name of the finished package inside the staging root. */
  public static final String PACKAGE_FILE = "shortcut.click";
  static final String DEBIAN_BINARY = "debian-binary";
  static final String CLICK_BINARY = "click_binary";
  static final String CLICK_BINARY_MEMBER = "_click-binary";
  static final String CONTROL_TARBALL = "control.tar.gz";
  static final String DATA_TARBALL = "data.tar.gz";
  static final String MDC_APP_ID = "appId";

  private final IconResolver iconResolver;
  private final TarballBuilder tarballBuilder;
  private final ContainerWriter containerWriter;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates the use case.
   *
   * @param iconResolver resolves the icon to stage
   * @param tarballBuilder archives the control and data subtrees
   * @param containerWriter writes the outer container
   * @param metrics metrics sink
   * @param clock clock used for build duration
   */
  public BuildPackageUseCase(
      IconResolver iconResolver,
      TarballBuilder tarballBuilder,
      ContainerWriter containerWriter,
      MetricsPort metrics,
      ClockPort clock) {
    this.iconResolver = Objects.requireNonNull(iconResolver, "iconResolver");
    this.tarballBuilder = Objects.requireNonNull(tarballBuilder, "tarballBuilder");
    this.containerWriter = Objects.requireNonNull(containerWriter, "containerWriter");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Builds {@code <stagingRoot>/shortcut.click} for {@code request}.
   *
   * <p>The staging root is wiped first. On failure the tree is left as is; no container is written
   * by a build that fails before assembly.</p>
   *
   * @param request package request
   * @param stagingRoot directory the package is assembled in
   * @return identifier, package path and staged icon file name
   * @throws PackageBuildException on the first filesystem, network or archive failure
   */
  public BuildResult build(PackageRequest request, Path stagingRoot) throws PackageBuildException {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(stagingRoot, "stagingRoot");
    AppIdentifier id = request.identifier();
    String previousAppId = MDC.get(MDC_APP_ID);
    MDC.put(MDC_APP_ID, id.value());
    long started = clock.nowMillis();
    metrics.increment("build.started");
    try {
      log.info("Building {} into {}", id.packageName(), stagingRoot);
      BuildResult result = runSteps(request, id, stagingRoot);
      metrics.increment("build.succeeded");
      log.info("Package {} written to {}", id.packageName(), result.packageFile());
      return result;
    } catch (PackageBuildException ex) {
      metrics.increment("build.failed");
      log.error("Build of {} failed during {}", id.packageName(), ex.operation(), ex);
      throw ex;
    } finally {
      metrics.observe("build.durationMillis", Math.max(0L, clock.nowMillis() - started));
      if (previousAppId == null) {
        MDC.remove(MDC_APP_ID);
      } else {
        MDC.put(MDC_APP_ID, previousAppId);
      }
    }
  }

  private BuildResult runSteps(PackageRequest request, AppIdentifier id, Path stagingRoot)
      throws PackageBuildException {
    StagingArea area = step(Kind.FILESYSTEM, "staging.recreate", () -> StagingArea.recreate(stagingRoot));

    step(Kind.FILESYSTEM, "staging.markers", () -> {
      area.write(DEBIAN_BINARY, ControlFiles.debianBinary());
      return area.write(CLICK_BINARY, ControlFiles.clickBinary());
    });

    step(Kind.FILESYSTEM, "staging.control", () -> {
      area.write(StagingArea.CONTROL_DIR + "/control", ControlFiles.control(id));
      area.write(StagingArea.CONTROL_DIR + "/manifest", ControlFiles.manifest(id, request.name()));
      // Click keeps maintainer scripts beside control and manifest, not in the payload.
      Path preinst = area.write(StagingArea.CONTROL_DIR + "/preinst", ControlFiles.preinst());
      area.markExecutable(preinst);
      return preinst;
    });

    step(Kind.FILESYSTEM, "staging.apparmor",
        () -> area.write(StagingArea.DATA_DIR + "/" + DataFiles.APPARMOR_FILE, DataFiles.apparmor()));

    IconResolver.ResolvedIcon icon = iconResolver.resolve(request.iconUrl());
    if (icon.source() instanceof IconSource.Remote) {
      metrics.observe("icon.fetch.bytes", icon.bytes().length);
    }
    step(Kind.FILESYSTEM, "staging.icon",
        () -> area.write(StagingArea.DATA_DIR + "/" + icon.fileName(), icon.bytes()));

    step(Kind.FILESYSTEM, "staging.desktop", () -> area.write(
        StagingArea.DATA_DIR + "/" + DataFiles.DESKTOP_FILE, DataFiles.desktop(request, icon.fileName())));

    step(Kind.FILESYSTEM, "staging.md5sums", () -> area.write(
        StagingArea.CONTROL_DIR + "/md5sums", ControlFiles.md5sums(digestTree(area.dataDir()))));

    Path controlTarball = area.root().resolve(CONTROL_TARBALL);
    Path dataTarball = area.root().resolve(DATA_TARBALL);
    step(Kind.ARCHIVE, "archive.control", () -> writeTarball(area.controlDir(), controlTarball));
    step(Kind.ARCHIVE, "archive.data", () -> writeTarball(area.dataDir(), dataTarball));

    Path packageFile = area.root().resolve(PACKAGE_FILE);
    List<ArchiveMember> members = List.of(
        new ArchiveMember(area.root().resolve(DEBIAN_BINARY), DEBIAN_BINARY),
        new ArchiveMember(controlTarball, CONTROL_TARBALL),
        new ArchiveMember(dataTarball, DATA_TARBALL),
        new ArchiveMember(area.root().resolve(CLICK_BINARY), CLICK_BINARY_MEMBER));
    step(Kind.ARCHIVE, "archive.container", () -> {
      containerWriter.write(packageFile, members);
      return packageFile;
    });
    return new BuildResult(id, packageFile, icon.fileName());
  }

  private Path writeTarball(Path directory, Path target) throws IOException {
    try (OutputStream out = Files.newOutputStream(
        target,
        StandardOpenOption.CREATE,
        StandardOpenOption.TRUNCATE_EXISTING,
        StandardOpenOption.WRITE)) {
      tarballBuilder.write(directory, out);
    }
    log.debug("Wrote {} ({} bytes)", target.getFileName(), Files.size(target));
    return target;
  }

  /**
   * Computes hex MD5 digests for every regular file below {@code directory}.
   *
   * @param directory tree to digest
   * @return digests keyed by {@code '/'}-separated relative path, sorted
   * @throws IOException if a file cannot be read
   */
  static Map<String, String> digestTree(Path directory) throws IOException {
    Map<String, String> digests = new TreeMap<>();
    List<Path> files;
    try (Stream<Path> walk = Files.walk(directory)) {
      files = walk.filter(Files::isRegularFile).sorted().toList();
    }
    for (Path file : files) {
      String relative = directory.relativize(file).toString().replace('\\', '/');
      digests.put(relative, md5Hex(file));
    }
    return digests;
  }

  private static String md5Hex(Path file) throws IOException {
    MessageDigest digest;
    try {
      digest = MessageDigest.getInstance("MD5");
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("MD5 not available", ex);
    }
    try (InputStream in = new DigestInputStream(Files.newInputStream(file), digest)) {
      in.transferTo(OutputStream.nullOutputStream());
    }
    return HexFormat.of().formatHex(digest.digest());
  }

  private static <T> T step(Kind kind, String operation, IoStep<T> body) throws PackageBuildException {
    try {
      T value = body.run();
      log.debug("Step {} completed", operation);
      return value;
    } catch (IOException ex) {
      throw new PackageBuildException(kind, operation, ex);
    }
  }

  @FunctionalInterface
  private interface IoStep<T> {
    T run() throws IOException;
  }
}
