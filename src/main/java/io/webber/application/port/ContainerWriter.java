package io.webber.application.port;

import io.webber.domain.archive.ArchiveMember;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Port writing the outer {@code ar} container of a click package.
 *
 * @since 0.1.0
 */
public interface ContainerWriter {
  /**
   * Writes {@code members} to {@code target} in list order, replacing any existing file.
   *
   * @param target container file to create
   * @param members members in the order they must appear
   * @throws IOException if a member cannot be read or the container written
   */
  void write(Path target, List<ArchiveMember> members) throws IOException;
}
