package io.webber.application.port;

/**
 * <strong>What:</strong> Port abstracting build metrics emission.
 * <p><strong>Role:</strong> Implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate calls from any thread.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code build.durationMillis}).</p>
 *
 * @implNote Callers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code build.failed}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value such as milliseconds or bytes
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
