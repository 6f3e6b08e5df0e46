package io.webber.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.webber.application.port.MetricsPort;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records build counters ({@code build.started}, {@code build.succeeded}, {@code build.failed}) and histograms
 * ({@code build.durationMillis}, {@code icon.fetch.bytes}) as OpenTelemetry instruments.
 *
 * <p>Instrument names are lower-cased; every point carries the key as written under
 * {@code webber.metric.key}.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> KEY = AttributeKey.stringKey("webber.metric.key");

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Map<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final Map<String, LongHistogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter exporting to an OTLP collector.
   *
   * @param endpoint OTLP gRPC endpoint
   */
  public OpenTelemetryMetricsAdapter(String endpoint) {
    this(OpenTelemetryBootstrap.otlp(Objects.requireNonNull(endpoint, "endpoint")));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
  }

  @Override
  public void increment(String key) {
    LongCounter counter = counters.computeIfAbsent(key, k -> bootstrap.meter()
        .counterBuilder(instrumentName(k))
        .setUnit("1")
        .build());
    counter.add(1, Attributes.of(KEY, key));
  }

  @Override
  public void observe(String key, long value) {
    LongHistogram histogram = histograms.computeIfAbsent(key, k -> bootstrap.meter()
        .histogramBuilder(instrumentName(k))
        .ofLongs()
        .build());
    histogram.record(value, Attributes.of(KEY, key));
  }

  /** Flushes and shuts the meter provider down. */
  @Override
  public void close() {
    bootstrap.close();
  }

  /**
   * Maps a metric key to a valid instrument name: lower case, a leading letter, and only letters,
   * digits, {@code '.'}, {@code '_'} and {@code '-'}.
   */
  static String instrumentName(String key) {
    String lower = key.trim().toLowerCase(Locale.ROOT);
    if (lower.isEmpty()) {
      return "webber.metric";
    }
    StringBuilder name = new StringBuilder(lower.length() + 1);
    if (lower.charAt(0) < 'a' || lower.charAt(0) > 'z') {
      name.append('m');
    }
    for (char c : lower.toCharArray()) {
      boolean allowed = (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '.' || c == '_' || c == '-';
      name.append(allowed ? c : '_');
    }
    if (!name.toString().equals(key)) {
      log.debug("Metric key '{}' recorded as instrument '{}'", key, name);
    }
    return name.toString();
  }
}
