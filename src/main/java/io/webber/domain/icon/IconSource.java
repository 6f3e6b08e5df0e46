package io.webber.domain.icon;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;

/**
 * Where the package icon comes from: a remote file with a known extension, or the bundled default.
 *
 * <p>{@link #fromUrl(String)} never throws; anything it cannot use selects {@link Bundled}.</p>
 *
 * @since 0.1.0
 */
public sealed interface IconSource permits IconSource.Remote, IconSource.Bundled {
  /** File name of the bundled icon inside {@code data/}. */
  String BUNDLED_FILE_NAME = "icon.svg";

  /**
   * Staged file name for this source.
   *
   * @return {@code icon.<ext>} for remote icons, {@code icon.svg} for the bundled icon
   */
  String fileName();

  /**
   * Chooses an icon source for {@code iconUrl}.
   *
   * <p>A remote source is chosen only for an absolute hierarchical URL whose last path segment ends
   * in a non-empty dot suffix; that suffix is used verbatim as the extension.</p>
   *
   * @param iconUrl candidate icon URL; {@code null} or blank selects the bundled icon
   * @return remote or bundled source
   */
  static IconSource fromUrl(String iconUrl) {
    if (iconUrl == null || iconUrl.isBlank()) {
      return Bundled.INSTANCE;
    }
    URI uri;
    try {
      uri = new URI(iconUrl.trim());
    } catch (URISyntaxException ex) {
      return Bundled.INSTANCE;
    }
    if (!uri.isAbsolute() || uri.isOpaque()) {
      return Bundled.INSTANCE;
    }
    String path = uri.getRawPath();
    if (path == null || path.isEmpty()) {
      return Bundled.INSTANCE;
    }
    String segment = path.substring(path.lastIndexOf('/') + 1);
    int dot = segment.lastIndexOf('.');
    if (dot < 0 || dot == segment.length() - 1) {
      return Bundled.INSTANCE;
    }
    return new Remote(uri, segment.substring(dot + 1));
  }

  /**
   * Icon fetched over the network.
   *
   * @param uri absolute icon location
   * @param extension suffix of the last path segment, without the dot
   */
  record Remote(URI uri, String extension) implements IconSource {
    public Remote {
      Objects.requireNonNull(uri, "uri");
      Objects.requireNonNull(extension, "extension");
      if (extension.isEmpty() || extension.indexOf('/') >= 0) {
        throw new IllegalArgumentException("extension must be a single non-empty suffix");
      }
    }

    @Override
    public String fileName() {
      return "icon." + extension;
    }
  }

  /** Default vector icon shipped with the application. */
  enum Bundled implements IconSource {
    INSTANCE;

    /** Classpath location of the bundled SVG. */
    public static final String RESOURCE = "/io/webber/icon/default-icon.svg";

    @Override
    public String fileName() {
      return BUNDLED_FILE_NAME;
    }
  }
}
