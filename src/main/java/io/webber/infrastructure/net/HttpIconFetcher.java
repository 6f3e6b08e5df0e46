package io.webber.infrastructure.net;

import io.webber.application.port.IconFetcher;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link IconFetcher} built on the JDK {@link HttpClient}.
 *
 * <p>Redirects are followed. Any status outside 2xx, an unsupported scheme, a timeout or an
 * interruption surfaces as {@link IOException}; the body is returned unvalidated.</p>
 *
 * @since 0.1.0
 */
public final class HttpIconFetcher implements IconFetcher {
  private static final Logger log = LoggerFactory.getLogger(HttpIconFetcher.class);

  private final HttpClient client;
  private final Duration timeout;

  /**
   * Creates a fetcher.
   *
   * @param timeout connect and request timeout; {@code null} waits indefinitely
   */
  public HttpIconFetcher(Duration timeout) {
    this.timeout = timeout;
    HttpClient.Builder builder = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL);
    if (timeout != null) {
      builder.connectTimeout(timeout);
    }
    this.client = builder.build();
  }

  @Override
  public byte[] fetch(URI uri) throws IOException {
    Objects.requireNonNull(uri, "uri");
    HttpRequest request;
    try {
      HttpRequest.Builder builder = HttpRequest.newBuilder(uri).GET();
      if (timeout != null) {
        builder.timeout(timeout);
      }
      request = builder.build();
    } catch (IllegalArgumentException ex) {
      throw new IOException("Unsupported icon URL: " + uri, ex);
    }
    try {
      HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
      validateStatus(response.statusCode(), uri);
      byte[] body = response.body();
      log.debug("Fetched {} bytes from {}", body.length, uri);
      return body;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IOException("Icon download interrupted: " + uri, ex);
    }
  }

  private static void validateStatus(int status, URI uri) throws IOException {
    if (status < 200 || status >= 300) {
      throw new IOException("HTTP " + status + " for " + uri);
    }
  }
}
