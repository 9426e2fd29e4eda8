package ca.gc.cra.photonic.api;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TelemetryConfiguratorTest {
  private static final String EXPORTER = "otel.metrics.exporter";
  private static final String ENDPOINT = "otel.exporter.otlp.endpoint";
  private static final String RESOURCE = "otel.resource.attributes";

  private final String originalExporter = System.getProperty(EXPORTER);

  @AfterEach
  void restoreProperties() {
    if (originalExporter == null) {
      System.clearProperty(EXPORTER);
    } else {
      System.setProperty(EXPORTER, originalExporter);
    }
    System.clearProperty(ENDPOINT);
    System.clearProperty(RESOURCE);
  }

  @Test
  void copiesSettingsIntoSystemProperties() {
    TelemetryConfigurator.configureMetrics("otlp", Map.of(
        "otelEndpoint", "http://collector:4317",
        "otelResourceAttributes", "service.name=photonic"));

    assertEquals("otlp", System.getProperty(EXPORTER));
    assertEquals("http://collector:4317", System.getProperty(ENDPOINT));
    assertEquals("service.name=photonic", System.getProperty(RESOURCE));
  }

  @Test
  void validatesEndpoint() {
    assertDoesNotThrow(() -> TelemetryConfigurator.validateEndpoint("https://otel.example.org:4318"));
    assertThrows(IllegalArgumentException.class, () -> TelemetryConfigurator.validateEndpoint("ftp://host"));
    assertThrows(IllegalArgumentException.class, () -> TelemetryConfigurator.validateEndpoint("http://"));
    assertThrows(IllegalArgumentException.class, () -> TelemetryConfigurator.validateEndpoint("http://bad host"));
  }
}
