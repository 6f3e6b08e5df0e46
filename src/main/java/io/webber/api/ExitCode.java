package io.webber.api;

/**
 * Process status of a {@code webber} run, one per failure category so scripts can branch on it.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  SUCCESS(0),
  /** Unknown switch, malformed {@code key=value}, missing {@code url}/{@code name} or a bad value. */
  INVALID_ARGS(2),
  /** Staging directory or configuration file could not be read or written. */
  IO_ERROR(3),
  /** Configuration file missing, malformed, or holding a non-scalar setting. */
  CONFIG_ERROR(4),
  RUNTIME_FAILURE(5),
  /** Icon download failed. */
  NETWORK_ERROR(6),
  /** A tarball or the click container could not be written. */
  ARCHIVE_ERROR(7),
  /** The build thread was interrupted. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /** Numeric status passed to {@link System#exit(int)}. */
  public int code() {
    return code;
  }
}
