package io.webber.infrastructure.archive;

import io.webber.application.port.ClockPort;
import io.webber.application.port.TarballBuilder;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TarballBuilder} backed by Apache Commons Compress.
 *
 * <p>Entries are {@code ./} followed by {@code ./<relative path>} in sorted order, owned by
 * {@code root:root} (uid/gid 0). Directories and owner-executable files get mode 0755, other files
 * 0644. Entry and gzip header timestamps come from the injected clock, so a fixed clock yields
 * byte-identical archives.</p>
 *
 * @since 0.1.0
 */
public final class CommonsTarballBuilder implements TarballBuilder {
  private static final Logger log = LoggerFactory.getLogger(CommonsTarballBuilder.class);

  static final int DIRECTORY_MODE = 040755;
  static final int FILE_MODE = 0100644;
  static final int EXECUTABLE_MODE = 0100755;
  private static final String ROOT_ENTRY = "./";
  private static final String OWNER = "root";

  private final ClockPort clock;

  /**
   * Creates a builder.
   *
   * @param clock source of entry timestamps
   */
  public CommonsTarballBuilder(ClockPort clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void write(Path directory, OutputStream out) throws IOException {
    Objects.requireNonNull(directory, "directory");
    Objects.requireNonNull(out, "out");
    if (!Files.isDirectory(directory, LinkOption.NOFOLLOW_LINKS)) {
      throw new IOException("not a directory: " + directory);
    }
    long timestamp = clock.nowMillis();
    List<Path> children = listSorted(directory);

    GzipParameters parameters = new GzipParameters();
    parameters.setModificationTime(timestamp);
    try (GzipCompressorOutputStream gzip = new GzipCompressorOutputStream(new KeepOpenOutputStream(out), parameters);
        TarArchiveOutputStream tar = new TarArchiveOutputStream(gzip)) {
      tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
      tar.setBigNumberMode(TarArchiveOutputStream.BIGNUMBER_POSIX);

      tar.putArchiveEntry(directoryEntry(ROOT_ENTRY, timestamp));
      tar.closeArchiveEntry();
      for (Path child : children) {
        String name = entryName(directory, child);
        if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
          tar.putArchiveEntry(directoryEntry(name + "/", timestamp));
          tar.closeArchiveEntry();
        } else if (Files.isRegularFile(child, LinkOption.NOFOLLOW_LINKS)) {
          TarArchiveEntry entry = ownedEntry(name, isExecutable(child) ? EXECUTABLE_MODE : FILE_MODE, timestamp);
          entry.setSize(Files.size(child));
          tar.putArchiveEntry(entry);
          Files.copy(child, tar);
          tar.closeArchiveEntry();
        } else {
          log.warn("Skipping unsupported file type {}", child);
        }
      }
      tar.finish();
    }
    log.debug("Archived {} entries from {}", children.size() + 1, directory);
  }

  private static List<Path> listSorted(Path directory) throws IOException {
    try (Stream<Path> walk = Files.walk(directory)) {
      return walk
          .filter(p -> !p.equals(directory))
          .sorted(Comparator.comparing(p -> entryName(directory, p)))
          .toList();
    }
  }

  static String entryName(Path base, Path path) {
    return "./" + base.relativize(path).toString().replace('\\', '/');
  }

  private static TarArchiveEntry directoryEntry(String name, long timestamp) {
    return ownedEntry(name, DIRECTORY_MODE, timestamp);
  }

  private static TarArchiveEntry ownedEntry(String name, int mode, long timestamp) {
    TarArchiveEntry entry = new TarArchiveEntry(name);
    entry.setMode(mode);
    entry.setUserId(0);
    entry.setGroupId(0);
    entry.setUserName(OWNER);
    entry.setGroupName(OWNER);
    entry.setModTime(timestamp);
    return entry;
  }

  private static boolean isExecutable(Path file) throws IOException {
    PosixFileAttributeView view =
        Files.getFileAttributeView(file, PosixFileAttributeView.class, LinkOption.NOFOLLOW_LINKS);
    if (view == null) {
      return false;
    }
    return view.readAttributes().permissions().contains(PosixFilePermission.OWNER_EXECUTE);
  }

  /** Leaves the caller's stream open when the compressor closes. */
  private static final class KeepOpenOutputStream extends FilterOutputStream {
    KeepOpenOutputStream(OutputStream out) {
      super(out);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
      out.write(b, off, len);
    }

    @Override
    public void close() throws IOException {
      flush();
    }
  }
}
