package io.webber.infrastructure.metrics;

import io.webber.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations; selected when {@code metricsExporter=none}.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
