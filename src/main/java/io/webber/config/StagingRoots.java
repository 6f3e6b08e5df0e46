package io.webber.config;

import java.nio.file.Path;
import java.util.Map;

/**
 * Default staging root under the user's cache directory.
 *
 * <p>Resolves to {@code $XDG_CACHE_HOME/webber.timsueberkrueb/click-build}, or
 * {@code ~/.cache/webber.timsueberkrueb/click-build} when the variable is unset or blank.</p>
 *
 * @since 0.1.0
 */
public final class StagingRoots {
  /** Application directory inside the cache directory. */
  public static final String APP_DIR = "webber.timsueberkrueb";
  /** Build directory inside the application directory. */
  public static final String BUILD_DIR = "click-build";

  private StagingRoots() {}

  /**
   * Default staging root for the current process environment.
   *
   * @return absolute default staging root
   */
  public static Path defaultRoot() {
    return resolve(System.getenv(), System.getProperty("user.home", "."));
  }

  static Path resolve(Map<String, String> env, String userHome) {
    String cacheHome = env.get("XDG_CACHE_HOME");
    Path cache = cacheHome == null || cacheHome.isBlank()
        ? Path.of(userHome, ".cache")
        : Path.of(cacheHome.trim());
    return cache.resolve(APP_DIR).resolve(BUILD_DIR).toAbsolutePath().normalize();
  }
}
