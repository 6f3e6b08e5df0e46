package io.webber.domain.pkg;

import java.net.IDN;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;

/**
 * Outcome of extracting a host from a user-supplied URL.
 *
 * <p>Either the host was {@link Source#RESOLVED resolved} from the parsed URL, or the raw input was
 * kept as a {@link Source#FALLBACK fallback}. Resolution never throws.</p>
 *
 * @param value host name or raw URL text
 * @param source which branch produced {@code value}
 * @since 0.1.0
 */
public record HostResolution(String value, Source source) {

  /** Branch taken while resolving the host. */
  public enum Source {
    /** Host component extracted from an absolute URL. */
    RESOLVED,
    /** URL could not be parsed or had no host; the raw input is used. */
    FALLBACK
  }

  public HostResolution {
    Objects.requireNonNull(value, "value");
    Objects.requireNonNull(source, "source");
  }

  /**
   * Extracts the host from {@code url}, falling back to the raw string.
   *
   * <p>Surrounding whitespace and control characters are stripped first. Internationalized hosts
   * are converted to their ASCII (punycode) form.</p>
   *
   * @param url candidate URL; {@code null} is treated as empty
   * @return resolution describing the chosen text
   */
  public static HostResolution of(String url) {
    String raw = trimControls(url == null ? "" : url);
    URI uri;
    try {
      uri = new URI(raw);
    } catch (URISyntaxException ex) {
      return new HostResolution(raw, Source.FALLBACK);
    }
    if (!uri.isAbsolute()) {
      return new HostResolution(raw, Source.FALLBACK);
    }
    String host = uri.getHost();
    if (host == null) {
      host = hostFromAuthority(uri.getRawAuthority());
    }
    if (host == null || host.isEmpty()) {
      return new HostResolution(raw, Source.FALLBACK);
    }
    return new HostResolution(toAscii(host), Source.RESOLVED);
  }

  /** Returns {@code true} when the raw input was used instead of a parsed host. */
  public boolean isFallback() {
    return source == Source.FALLBACK;
  }

  private static String trimControls(String text) {
    int start = 0;
    int end = text.length();
    while (start < end && text.charAt(start) <= ' ') {
      start++;
    }
    while (end > start && text.charAt(end - 1) <= ' ') {
      end--;
    }
    return text.substring(start, end);
  }

  private static String toAscii(String host) {
    if (host.startsWith("[")) {
      return host;
    }
    try {
      return IDN.toASCII(host);
    } catch (IllegalArgumentException ex) {
      return host;
    }
  }

  // URI leaves the host undefined for registry-based authorities such as "my_site.example".
  private static String hostFromAuthority(String authority) {
    if (authority == null || authority.isEmpty()) {
      return null;
    }
    String host = authority;
    int at = host.lastIndexOf('@');
    if (at >= 0) {
      host = host.substring(at + 1);
    }
    if (host.startsWith("[")) {
      int close = host.indexOf(']');
      return close > 0 ? host.substring(0, close + 1) : host;
    }
    int colon = host.indexOf(':');
    if (colon >= 0) {
      host = host.substring(0, colon);
    }
    return host;
  }
}
