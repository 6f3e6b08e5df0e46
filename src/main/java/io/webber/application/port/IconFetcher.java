package io.webber.application.port;

import java.io.IOException;
import java.net.URI;

/**
 * Port retrieving remote icon bytes.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface IconFetcher {
  /**
   * Downloads the resource at {@code uri}.
   *
   * @param uri absolute icon location
   * @return full response body
   * @throws IOException on transport failure, timeout or a non-success response
   */
  byte[] fetch(URI uri) throws IOException;
}
