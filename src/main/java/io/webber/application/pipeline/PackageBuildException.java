package io.webber.application.pipeline;

import java.util.Objects;

/**
 * Raised when a build step fails; the build is abandoned at the first failure.
 *
 * <p>{@link #kind()} tells the caller which boundary failed and {@link #operation()} names the step,
 * e.g. {@code staging.write} or {@code icon.fetch}. The cause is always the underlying exception.</p>
 *
 * @since 0.1.0
 */
public final class PackageBuildException extends Exception {
  private static final long serialVersionUID = 1L;

  /** Failure category. */
  public enum Kind {
    /** Staging directory or local file I/O. */
    FILESYSTEM,
    /** Remote icon retrieval. */
    NETWORK,
    /** Tarball or container production. */
    ARCHIVE
  }

  private final Kind kind;
  private final String operation;

  /**
   * Creates a build failure.
   *
   * @param kind failure category
   * @param operation name of the failing step
   * @param cause underlying exception
   */
  public PackageBuildException(Kind kind, String operation, Throwable cause) {
    super(
        Objects.requireNonNull(kind, "kind") + " failure during " + Objects.requireNonNull(operation, "operation")
            + (cause == null || cause.getMessage() == null ? "" : ": " + cause.getMessage()),
        cause);
    this.kind = kind;
    this.operation = operation;
  }

  /** Failure category. */
  public Kind kind() {
    return kind;
  }

  /** Name of the failing step. */
  public String operation() {
    return operation;
  }
}
