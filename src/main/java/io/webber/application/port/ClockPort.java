package io.webber.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps to the build pipeline.
 * <p><strong>Role:</strong> Stamps archive entries and measures build duration; tests inject a fixed
 * clock to get byte-identical archives.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see io.webber.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();
}
