package io.webber.application.pipeline;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> The on-disk tree a package is assembled in.
 * <p><strong>Layout:</strong> root markers, {@code control/} and {@code data/} subtrees, and the
 * archives produced from them.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one build per root at a time.</p>
 *
 * @since 0.1.0
 */
public final class StagingArea {
  private static final Logger log = LoggerFactory.getLogger(StagingArea.class);

  /** Subtree holding package metadata. */
  public static final String CONTROL_DIR = "control";
  /** Subtree holding installed files. */
  public static final String DATA_DIR = "data";

  private static final Set<PosixFilePermission> EXECUTABLE = PosixFilePermissions.fromString("rwxr-xr-x");

  private final Path root;

  private StagingArea(Path root) {
    this.root = root;
  }

  /**
   * Wipes {@code root} and lays out an empty staging tree.
   *
   * <p>The root and its parents are created if missing, then the root is deleted recursively and
   * recreated with empty {@code control/} and {@code data/} directories. Symbolic links inside the
   * tree are removed, never followed.</p>
   *
   * @param root staging root
   * @return staging area rooted at {@code root}
   * @throws IOException if any directory cannot be created or removed
   */
  public static StagingArea recreate(Path root) throws IOException {
    Objects.requireNonNull(root, "root");
    Files.createDirectories(root);
    deleteRecursively(root);
    Files.createDirectories(root.resolve(CONTROL_DIR));
    Files.createDirectories(root.resolve(DATA_DIR));
    log.debug("Staging area recreated at {}", root);
    return new StagingArea(root);
  }

  /** Staging root. */
  public Path root() {
    return root;
  }

  /** {@code control/} subtree. */
  public Path controlDir() {
    return root.resolve(CONTROL_DIR);
  }

  /** {@code data/} subtree. */
  public Path dataDir() {
    return root.resolve(DATA_DIR);
  }

  /**
   * Writes UTF-8 text, creating or truncating the file.
   *
   * @param relative path relative to the staging root
   * @param content file content
   * @return written file
   * @throws IOException if the file cannot be written
   */
  public Path write(String relative, String content) throws IOException {
    return write(relative, content.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Writes bytes, creating or truncating the file.
   *
   * @param relative path relative to the staging root
   * @param content file content
   * @return written file
   * @throws IOException if the file cannot be written
   */
  public Path write(String relative, byte[] content) throws IOException {
    Objects.requireNonNull(content, "content");
    Path target = resolve(relative);
    Files.write(
        target,
        content,
        StandardOpenOption.CREATE,
        StandardOpenOption.TRUNCATE_EXISTING,
        StandardOpenOption.WRITE);
    return target;
  }

  /**
   * Marks a staged file as executable ({@code rwxr-xr-x}); a no-op on non-POSIX file systems.
   *
   * @param file staged file
   * @throws IOException if permissions cannot be changed
   */
  public void markExecutable(Path file) throws IOException {
    PosixFileAttributeView view = Files.getFileAttributeView(file, PosixFileAttributeView.class);
    if (view == null) {
      log.debug("File system does not support POSIX permissions; {} left as is", file);
      return;
    }
    view.setPermissions(EXECUTABLE);
  }

  /**
   * Resolves a path relative to the staging root, refusing paths that escape it.
   *
   * @param relative relative path
   * @return absolute path inside the root
   */
  public Path resolve(String relative) {
    Objects.requireNonNull(relative, "relative");
    Path resolved = root.resolve(relative).normalize();
    if (!resolved.startsWith(root.normalize()) || resolved.equals(root.normalize())) {
      throw new IllegalArgumentException("path escapes staging root: " + relative);
    }
    return resolved;
  }

  private static void deleteRecursively(Path root) throws IOException {
    Files.walkFileTree(root, new SimpleFileVisitor<>() {
      @Override
      public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
        Files.delete(file);
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
        if (exc != null) {
          throw exc;
        }
        Files.delete(dir);
        return FileVisitResult.CONTINUE;
      }
    });
    Files.createDirectories(root);
  }
}
