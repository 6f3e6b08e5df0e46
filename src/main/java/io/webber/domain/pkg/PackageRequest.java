package io.webber.domain.pkg;

import java.util.Objects;

/**
 * <strong>What:</strong> Immutable description of the web site to wrap into a click package.
 * <p><strong>Role:</strong> Input value object for {@code BuildPackageUseCase}; fixed for the duration
 * of one build.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param url web site address; parsed for the identifier but never rejected when malformed
 * @param name display title shown to the end user; embedded without sanitization
 * @param themeColor splash color token embedded verbatim into the desktop entry
 * @param iconUrl icon location; empty or unusable values select the bundled icon
 * @param urlPatterns URL pattern expression passed verbatim to the web app container
 * @since 0.1.0
 */
public record PackageRequest(
    String url,
    String name,
    String themeColor,
    String iconUrl,
    String urlPatterns) {

  /**
   * Rejects {@code null} fields; content is deliberately not validated here.
   *
   * @throws NullPointerException if any field is {@code null}
   */
  public PackageRequest {
    Objects.requireNonNull(url, "url");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(themeColor, "themeColor");
    Objects.requireNonNull(iconUrl, "iconUrl");
    Objects.requireNonNull(urlPatterns, "urlPatterns");
  }

  /**
   * Derives the package identifier for this request.
   *
   * @return identifier of the form {@code webapp-<sanitized>}
   */
  public AppIdentifier identifier() {
    return AppIdentifier.fromUrl(url);
  }
}
