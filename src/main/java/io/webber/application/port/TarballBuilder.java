package io.webber.application.port;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Port that serializes a staged directory as a gzip-compressed tar stream.
 * <p><strong>Contract:</strong> Entries are named relative to {@code directory}, rooted at {@code ./},
 * and emitted in sorted order. The output stream is finished but not closed.</p>
 *
 * @since 0.1.0
 */
public interface TarballBuilder {
  /**
   * Writes {@code directory} to {@code out}.
   *
   * @param directory staged directory to archive
   * @param out destination; left open for the caller
   * @throws IOException if the tree cannot be read or the stream written
   */
  void write(Path directory, OutputStream out) throws IOException;
}
