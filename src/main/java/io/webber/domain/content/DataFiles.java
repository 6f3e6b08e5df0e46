package io.webber.domain.content;

import io.webber.domain.pkg.PackageRequest;
import java.util.Objects;

/**
 * Generators for the files staged under {@code data/}.
 *
 * <p>Request values are embedded verbatim; callers that accept untrusted input reject control
 * characters before building a {@link PackageRequest}.</p>
 *
 * @since 0.1.0
 * @see ControlFiles
 */
public final class DataFiles {
  /** AppArmor policy file name, referenced from the manifest hooks. */
  public static final String APPARMOR_FILE = "shortcut.apparmor";
  /** Desktop entry file name, referenced from the manifest hooks. */
  public static final String DESKTOP_FILE = "shortcut.desktop";
  /** Launcher that hosts the web app. */
  public static final String LAUNCHER = "webapp-container";

  private DataFiles() {}

  /**
   * Renders the AppArmor policy for a networked web view.
   *
   * @return JSON document with a trailing newline
   */
  public static String apparmor() {
    return PrettyJson.render(gen -> {
      gen.writeStartObject();
      gen.writeStringField("template", "ubuntu-webapp");
      gen.writeArrayFieldStart("policy_groups");
      gen.writeString("networking");
      gen.writeString("webview");
      gen.writeEndArray();
      gen.writeFieldName("policy_version");
      gen.writeNumber("16.04");
      gen.writeEndObject();
    });
  }

  /**
   * Renders the desktop entry launching the web app container.
   *
   * @param request build request supplying name, URL, patterns and splash color
   * @param iconFileName staged icon file name, e.g. {@code icon.png}
   * @return INI-style desktop entry terminated by a newline
   */
  public static String desktop(PackageRequest request, String iconFileName) {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(iconFileName, "iconFileName");
    return "[Desktop Entry]\n"
        + "Name=" + request.name() + "\n"
        + "Exec=" + LAUNCHER + " --webappUrlPatterns=" + request.urlPatterns()
        + " --store-session-cookies " + request.url() + "\n"
        + "Icon=" + iconFileName + "\n"
        + "Terminal=false\n"
        + "Type=Application\n"
        + "X-Ubuntu-Touch=true\n"
        + "X-Ubuntu-Splash-Color=" + request.themeColor() + "\n";
  }
}
