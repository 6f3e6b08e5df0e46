package io.webber.config;

import io.webber.application.pipeline.BuildPackageUseCase;
import io.webber.application.pipeline.IconResolver;
import io.webber.application.port.ClockPort;
import io.webber.application.port.IconFetcher;
import io.webber.application.port.MetricsPort;
import io.webber.infrastructure.archive.ArContainerWriter;
import io.webber.infrastructure.archive.CommonsTarballBuilder;
import io.webber.infrastructure.metrics.NoOpMetricsAdapter;
import io.webber.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import io.webber.infrastructure.net.HttpIconFetcher;
import io.webber.infrastructure.time.SystemClockAdapter;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires the build use case to concrete adapters.
 * <p><strong>Role:</strong> Composition root used by the CLI; the only place that names infrastructure
 * classes.</p>
 * <p><strong>Lifecycle:</strong> {@link #close()} flushes and shuts down the metrics exporter.</p>
 *
 * @since 0.1.0
 * @see BuildPackageUseCase
 */
public final class CompositionRoot implements AutoCloseable {
  private final ClockPort clock;
  private final MetricsPort metrics;

  /**
   * Creates a composition root.
   *
   * @param metricsSettings selects the OTLP exporter or the no-op adapter
   */
  public CompositionRoot(MetricsSettings metricsSettings) {
    Objects.requireNonNull(metricsSettings, "metricsSettings");
    this.clock = new SystemClockAdapter();
    this.metrics = metricsSettings.exporting()
        ? new OpenTelemetryMetricsAdapter(metricsSettings.endpoint())
        : new NoOpMetricsAdapter();
  }

  /**
   * Builds the use case for {@code config}.
   *
   * @param config build settings supplying the icon timeout
   * @return ready-to-run use case
   */
  public BuildPackageUseCase buildUseCase(BuildConfig config) {
    Objects.requireNonNull(config, "config");
    IconFetcher fetcher = new HttpIconFetcher(config.iconTimeout().orElse(null));
    return new BuildPackageUseCase(
        new IconResolver(fetcher),
        new CommonsTarballBuilder(clock),
        new ArContainerWriter(clock),
        metrics,
        clock);
  }

  /** Metrics port shared by use cases built here. */
  public MetricsPort metrics() {
    return metrics;
  }

  @Override
  public void close() {
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.close();
    }
  }
}
