package io.webber.config;

import io.webber.validation.Fields;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;

/**
 * Metrics export settings for one CLI run.
 *
 * @param exporter {@link #OTLP} or {@link #NONE}
 * @param endpoint OTLP gRPC endpoint; only used when exporting
 * @since 0.1.0
 */
public record MetricsSettings(String exporter, String endpoint) {
  /** Exports build metrics over OTLP gRPC. */
  public static final String OTLP = "otlp";
  /** Discards build metrics. */
  public static final String NONE = "none";
  /** Collector address used when neither the setting nor the environment names one. */
  public static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  static final String ENDPOINT_ENV = "OTEL_EXPORTER_OTLP_ENDPOINT";

  /**
   * Reads {@code metricsExporter} and {@code otelEndpoint}, falling back to
   * {@code OTEL_EXPORTER_OTLP_ENDPOINT} for the endpoint.
   *
   * @param settings merged configuration
   * @return validated settings
   * @throws IllegalArgumentException for an unknown exporter or an endpoint that is not an http(s) URL
   */
  public static MetricsSettings fromMap(Map<String, String> settings) {
    return fromMap(settings, System.getenv(ENDPOINT_ENV));
  }

  static MetricsSettings fromMap(Map<String, String> settings, String environmentEndpoint) {
    String exporter = Fields.optional(settings, "metricsExporter").toLowerCase(Locale.ROOT);
    if (exporter.isEmpty()) {
      exporter = NONE;
    }
    if (!exporter.equals(OTLP) && !exporter.equals(NONE)) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none' (was '" + exporter + "')");
    }
    String endpoint = Fields.optional(settings, "otelEndpoint");
    if (endpoint.isEmpty() && environmentEndpoint != null && !environmentEndpoint.isBlank()) {
      endpoint = environmentEndpoint.trim();
    }
    if (endpoint.isEmpty()) {
      endpoint = DEFAULT_ENDPOINT;
    }
    requireHttpEndpoint(endpoint);
    return new MetricsSettings(exporter, endpoint);
  }

  /** Whether metrics leave the process. */
  public boolean exporting() {
    return exporter.equals(OTLP);
  }

  private static void requireHttpEndpoint(String endpoint) {
    URI uri;
    try {
      uri = new URI(endpoint);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint is not a valid URI: " + endpoint, ex);
    }
    String scheme = uri.getScheme();
    if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
      throw new IllegalArgumentException("otelEndpoint must use http or https: " + endpoint);
    }
    if (uri.getHost() == null) {
      throw new IllegalArgumentException("otelEndpoint must name a host: " + endpoint);
    }
  }
}
