package io.webber.application.pipeline;

import io.webber.application.pipeline.PackageBuildException.Kind;
import io.webber.application.port.IconFetcher;
import io.webber.domain.icon.IconSource;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns an icon URL into the bytes and file name staged under {@code data/}.
 *
 * <p>Remote icons are fetched once with no retry and no fallback; any fetch failure is fatal.</p>
 *
 * @since 0.1.0
 */
public final class IconResolver {
  private static final Logger log = LoggerFactory.getLogger(IconResolver.class);

  private final IconFetcher fetcher;

  /**
   * Creates a resolver.
   *
   * @param fetcher port used for remote icons
   */
  public IconResolver(IconFetcher fetcher) {
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
  }

  /**
   * Resolves the icon for {@code iconUrl}.
   *
   * @param iconUrl icon URL, possibly blank or malformed
   * @return staged file name and bytes
   * @throws PackageBuildException {@link Kind#NETWORK} when a remote fetch fails,
   *     {@link Kind#FILESYSTEM} when the bundled icon cannot be read
   */
  public ResolvedIcon resolve(String iconUrl) throws PackageBuildException {
    IconSource source = IconSource.fromUrl(iconUrl);
    if (source instanceof IconSource.Remote remote) {
      log.debug("Fetching icon from {}", remote.uri());
      try {
        byte[] bytes = fetcher.fetch(remote.uri());
        return new ResolvedIcon(source, bytes);
      } catch (IOException ex) {
        throw new PackageBuildException(Kind.NETWORK, "icon.fetch", ex);
      }
    }
    log.debug("Using bundled icon");
    try {
      return new ResolvedIcon(source, bundledIcon());
    } catch (IOException ex) {
      throw new PackageBuildException(Kind.FILESYSTEM, "icon.bundled", ex);
    }
  }

  static byte[] bundledIcon() throws IOException {
    try (InputStream in = IconResolver.class.getResourceAsStream(IconSource.Bundled.RESOURCE)) {
      if (in == null) {
        throw new IOException("bundled icon not found on classpath: " + IconSource.Bundled.RESOURCE);
      }
      return in.readAllBytes();
    }
  }

  /**
   * Icon ready for staging.
   *
   * @param source chosen source
   * @param bytes icon content, stored verbatim
   */
  public record ResolvedIcon(IconSource source, byte[] bytes) {
    public ResolvedIcon {
      Objects.requireNonNull(source, "source");
      Objects.requireNonNull(bytes, "bytes");
    }

    /** Staged file name, e.g. {@code icon.png}. */
    public String fileName() {
      return source.fileName();
    }
  }
}
