package ca.gc.cra.photonic.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapNoopTest {
  private String previousExporter;

  @AfterEach
  void resetProperties() {
    if (previousExporter == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", previousExporter);
    }
  }

  @Test
  void exporterNoneFallsBackToNoop() {
    previousExporter = System.getProperty("otel.metrics.exporter");
    System.setProperty("otel.metrics.exporter", "none");

    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize();
    assertTrue(result.isNoop(), "Expected noop metrics bootstrap when exporter=none");
    assertDoesNotThrow(result::forceFlush);
    result.close();
  }

  @Test
  void noopAdapterIgnoresRecordings() {
    try (OpenTelemetryMetricsAdapter adapter =
        new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult.noop())) {
      assertDoesNotThrow(() -> adapter.increment("pipeline.jobs.submitted"));
      assertDoesNotThrow(() -> adapter.observe("pipeline.job.latencyMillis", 5L));
    }
  }

  @Test
  void parsesResourceAttributesSkippingMalformedEntries() {
    Attributes attributes =
        OpenTelemetryBootstrap.parseResourceAttributes("deployment.environment=lab, broken, =x, host.name=astro1");

    assertEquals(2, attributes.size());
    assertEquals("lab", attributes.get(AttributeKey.stringKey("deployment.environment")));
    assertEquals("astro1", attributes.get(AttributeKey.stringKey("host.name")));
  }
}
