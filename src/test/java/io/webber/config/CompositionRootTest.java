package io.webber.config;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import io.webber.infrastructure.metrics.NoOpMetricsAdapter;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CompositionRootTest {
  private static final MetricsSettings NO_METRICS =
      new MetricsSettings(MetricsSettings.NONE, MetricsSettings.DEFAULT_ENDPOINT);

  @Test
  void metricsDisabledUnlessOtlpRequested() {
    try (CompositionRoot root = new CompositionRoot(NO_METRICS)) {
      assertInstanceOf(NoOpMetricsAdapter.class, root.metrics());
    }
  }

  @Test
  void buildsUseCaseForConfig() {
    BuildConfig config = BuildConfig.fromMap(Map.of(
        "url", "https://example.com", "name", "Example", "iconTimeoutSeconds", "0"));

    try (CompositionRoot root = new CompositionRoot(NO_METRICS)) {
      assertNotNull(root.buildUseCase(config));
    }
  }
}
