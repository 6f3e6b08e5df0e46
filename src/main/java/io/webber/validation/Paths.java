package io.webber.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation for staging roots handed to the build pipeline.
 * <p><strong>Role:</strong> Support utility executed by the CLI before a build wipes and recreates a
 * staging directory.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Normalize user-provided paths to absolute, canonical locations.</li>
 *   <li>Refuse roots that would wipe the filesystem root or the user's home directory.</li>
 *   <li>Verify that the nearest existing ancestor is a writable directory.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; filesystem state may change between checks.</p>
 *
 * @implNote Checks use {@link LinkOption#NOFOLLOW_LINKS} so a symlinked staging root is rejected
 * rather than followed into an unrelated tree.
 * @since 0.1.0
 * @see Fields
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates a directory that the build pipeline is allowed to delete and recreate.
   *
   * @param path candidate staging root; must not be {@code null}
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path is unsafe to wipe or its parent is not writable
   */
  public static Path validateStagingRoot(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("stagingRoot must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("stagingRoot must not contain null bytes");
    }
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException("stagingRoot must not contain control characters");
      }
    }

    Path normalized = path.toAbsolutePath().normalize();
    if (normalized.getParent() == null) {
      throw new IllegalArgumentException("stagingRoot must not be a filesystem root: " + normalized);
    }
    Path home = Path.of(System.getProperty("user.home", "/")).toAbsolutePath().normalize();
    if (home.startsWith(normalized)) {
      throw new IllegalArgumentException(
          "stagingRoot " + normalized + " would remove the home directory " + home);
    }

    try {
      if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        if (Files.isSymbolicLink(normalized)) {
          throw new IllegalArgumentException("stagingRoot must not be a symbolic link: " + normalized);
        }
        if (!Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
          throw new IllegalArgumentException("stagingRoot is not a directory: " + normalized);
        }
      }
      Path ancestor = nearestExistingAncestor(normalized.getParent());
      if (!Files.isDirectory(ancestor)) {
        throw new IllegalArgumentException("parent is not a directory: " + ancestor);
      }
      if (!Files.isWritable(ancestor)) {
        throw new IllegalArgumentException("parent directory is not writable: " + ancestor);
      }
      return normalized;
    } catch (IOException ex) {
      throw new IllegalArgumentException(
          "unable to validate stagingRoot " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  private static Path nearestExistingAncestor(Path start) throws IOException {
    Path current = start;
    while (current != null && !Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
      current = current.getParent();
    }
    if (current == null) {
      throw new IllegalArgumentException("no existing ancestor for " + start);
    }
    return current.toRealPath();
  }
}
