package io.webber.domain.content;

import io.webber.domain.pkg.AppIdentifier;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Generators for the files staged under {@code control/} and the root-level
 * version markers.
 * <p><strong>Role:</strong> Pure domain functions; output depends only on the arguments, so equal
 * inputs give byte-identical files.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 * @see DataFiles
 */
public final class ControlFiles {
  /** Package version written to the control file and manifest. */
  public static final String VERSION = "1.0.0";
  /** Click format version, also the content of the {@code _click-binary} member. */
  public static final String CLICK_VERSION = "0.4";
  /** Target framework recorded in the manifest. */
  public static final String FRAMEWORK = "ubuntu-sdk-16.04";
  /** Maintainer recorded in the control file and manifest. */
  public static final String MAINTAINER = "Webber <noreply@ubports.com>";
  /** Fixed package description. */
  public static final String DESCRIPTION = "Shortcut";
  /** Nominal installed size reported by the manifest. */
  public static final String INSTALLED_SIZE = "30";

  private static final String PREINST = """
      #! /bin/sh
      echo "Click packages may not be installed directly using dpkg."
      echo "Use 'click install' instead."
      exit 1""";

  private ControlFiles() {}

  /** Content of the {@code debian-binary} marker. */
  public static String debianBinary() {
    return "2.0\n";
  }

  /** Content of the {@code click_binary} marker, stored as {@code _click-binary}. */
  public static String clickBinary() {
    return CLICK_VERSION + "\n";
  }

  /**
   * Renders the Debian-style control file.
   *
   * @param id package identifier
   * @return {@code key: value} lines terminated by a newline
   */
  public static String control(AppIdentifier id) {
    Objects.requireNonNull(id, "id");
    return "Package: " + id.packageName() + "\n"
        + "Version: " + VERSION + "\n"
        + "Click-Version: " + CLICK_VERSION + "\n"
        + "Architecture: all\n"
        + "Maintainer: " + MAINTAINER + "\n"
        + "Description: " + DESCRIPTION + "\n";
  }

  /**
   * Renders the click manifest.
   *
   * @param id package identifier used for the package name and hooks key
   * @param title display title, escaped as a JSON string but otherwise unchanged
   * @return JSON document with a trailing newline
   */
  public static String manifest(AppIdentifier id, String title) {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(title, "title");
    return PrettyJson.render(gen -> {
      gen.writeStartObject();
      gen.writeStringField("architecture", "all");
      gen.writeStringField("description", DESCRIPTION);
      gen.writeStringField("framework", FRAMEWORK);
      gen.writeObjectFieldStart("hooks");
      gen.writeObjectFieldStart(id.packageName());
      gen.writeStringField("apparmor", DataFiles.APPARMOR_FILE);
      gen.writeStringField("desktop", DataFiles.DESKTOP_FILE);
      gen.writeEndObject();
      gen.writeEndObject();
      gen.writeStringField("installed-size", INSTALLED_SIZE);
      gen.writeStringField("maintainer", MAINTAINER);
      gen.writeStringField("name", id.packageName());
      gen.writeStringField("title", title);
      gen.writeStringField("version", VERSION);
      gen.writeEndObject();
    });
  }

  /**
   * Returns the pre-install guard that refuses direct installation through dpkg.
   *
   * @return POSIX shell script exiting with status 1
   */
  public static String preinst() {
    return PREINST;
  }

  /**
   * Renders an md5sums listing, one {@code <hex>  <path>} line per file ordered by path.
   *
   * @param digests hex MD5 digests keyed by path relative to the data root
   * @return listing with a trailing newline; empty when {@code digests} is empty
   */
  public static String md5sums(Map<String, String> digests) {
    Objects.requireNonNull(digests, "digests");
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<String, String> entry : new TreeMap<>(digests).entrySet()) {
      sb.append(entry.getValue()).append("  ").append(entry.getKey()).append('\n');
    }
    return sb.toString();
  }
}
