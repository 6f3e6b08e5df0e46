/**
 * <strong>Purpose:</strong> Metrics adapters implementing {@link io.webber.application.port.MetricsPort}.
 * <p><strong>Pipeline role:</strong> Infrastructure; selected by the composition root from the
 * {@code metricsExporter} setting.
 * <p><strong>Concurrency:</strong> Adapters are thread-safe.
 *
 * @since 0.1.0
 */
package io.webber.infrastructure.metrics;
