package io.webber.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the meter provider behind {@link OpenTelemetryMetricsAdapter}.
 *
 * <p>Data points are tagged with the {@code webber} service name and the packaged version.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  private static final String SCOPE = "io.webber";
  private static final String UNKNOWN_VERSION = "0.0.0-dev";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

  private OpenTelemetryBootstrap() {}

  /**
   * Starts a provider exporting over OTLP gRPC.
   *
   * @param endpoint collector address, e.g. {@code http://localhost:4317}
   */
  static BootstrapResult otlp(String endpoint) {
    OtlpGrpcMetricExporter exporter = OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build();
    MetricReader reader = PeriodicMetricReader.builder(exporter).setInterval(EXPORT_INTERVAL).build();
    log.info("Exporting build metrics to {}", endpoint);
    return start(reader);
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return start(Objects.requireNonNull(reader, "reader"));
  }

  private static BootstrapResult start(MetricReader reader) {
    String version = serviceVersion();
    Resource resource = Resource.getDefault().merge(Resource.create(Attributes.of(
        AttributeKey.stringKey("service.name"), "webber",
        AttributeKey.stringKey("service.version"), version)));
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    return new BootstrapResult(
        provider.meterBuilder(SCOPE).setInstrumentationVersion(version).build(), provider);
  }

  // Filled in by the Maven archiver; absent when running from classes.
  static String serviceVersion() {
    try (InputStream in = OpenTelemetryBootstrap.class.getResourceAsStream(
        "/META-INF/maven/io.webber/webber/pom.properties")) {
      if (in == null) {
        return UNKNOWN_VERSION;
      }
      Properties props = new Properties();
      props.load(in);
      return props.getProperty("version", UNKNOWN_VERSION);
    } catch (IOException ex) {
      log.debug("Unable to read pom.properties", ex);
      return UNKNOWN_VERSION;
    }
  }

  /** Meter plus the provider that owns it. */
  record BootstrapResult(Meter meter, SdkMeterProvider provider) implements AutoCloseable {

    void forceFlush() {
      await(provider.forceFlush(), "flush");
    }

    /** Flushes pending points, then shuts the provider down. */
    @Override
    public void close() {
      forceFlush();
      await(provider.shutdown(), "shutdown");
    }

    private static void await(CompletableResultCode result, String action) {
      if (!result.join(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS).isSuccess()) {
        log.warn("OpenTelemetry metrics {} did not complete within {}s", action, SHUTDOWN_TIMEOUT_SECONDS);
      }
    }
  }
}
