package io.webber.infrastructure.archive;

import io.webber.application.port.ClockPort;
import io.webber.application.port.ContainerWriter;
import io.webber.domain.archive.ArchiveMember;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;
import org.apache.commons.compress.archivers.ar.ArArchiveEntry;
import org.apache.commons.compress.archivers.ar.ArArchiveOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ContainerWriter} producing a common-format {@code ar} archive with Apache Commons Compress.
 *
 * <p>Members are stored raw with uid/gid 0 and mode 100644. The container is written to a sibling
 * {@code .part} file and moved into place once complete, so a failed write never leaves a partial
 * container under the target name.</p>
 *
 * @since 0.1.0
 */
public final class ArContainerWriter implements ContainerWriter {
  private static final Logger log = LoggerFactory.getLogger(ArContainerWriter.class);

  static final int MEMBER_MODE = 0100644;

  private final ClockPort clock;

  /**
   * Creates a writer.
   *
   * @param clock source of member timestamps
   */
  public ArContainerWriter(ClockPort clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void write(Path target, List<ArchiveMember> members) throws IOException {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(members, "members");
    long seconds = clock.nowMillis() / 1000L;
    Path partial = target.resolveSibling(target.getFileName() + ".part");
    try {
      try (OutputStream out = Files.newOutputStream(
              partial,
              StandardOpenOption.CREATE,
              StandardOpenOption.TRUNCATE_EXISTING,
              StandardOpenOption.WRITE);
          ArArchiveOutputStream ar = new ArArchiveOutputStream(out)) {
        for (ArchiveMember member : members) {
          long length = Files.size(member.source());
          ar.putArchiveEntry(new ArArchiveEntry(member.name(), length, 0, 0, MEMBER_MODE, seconds));
          Files.copy(member.source(), ar);
          ar.closeArchiveEntry();
          log.debug("Added member {} ({} bytes)", member.name(), length);
        }
        ar.finish();
      }
      Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException ex) {
      try {
        Files.deleteIfExists(partial);
      } catch (IOException cleanup) {
        ex.addSuppressed(cleanup);
      }
      throw ex;
    }
  }
}
