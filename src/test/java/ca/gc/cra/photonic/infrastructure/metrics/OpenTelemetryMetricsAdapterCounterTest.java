package ca.gc.cra.photonic.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterCounterTest {
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("photonic.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter metrics;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    metrics = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    metrics.close();
  }

  @Test
  void jobOutcomeCountersAreExportedSeparately() {
    for (int i = 0; i < 3; i++) {
      metrics.increment("pipeline.jobs.submitted");
    }
    metrics.increment("pipeline.jobs.completed");
    metrics.increment("pipeline.jobs.completed");
    metrics.increment("pipeline.jobs.failed");
    metrics.forceFlush();

    Map<String, Long> totals = new TreeMap<>();
    Collection<MetricData> exported = reader.collectAllMetrics();
    for (MetricData metric : exported) {
      if (!metric.getName().startsWith("pipeline.jobs.")) {
        continue;
      }
      assertEquals(MetricDataType.LONG_SUM, metric.getType(), metric.getName());
      LongPointData point = metric.getLongSumData().getPoints().iterator().next();
      assertEquals(metric.getName(), point.getAttributes().get(METRIC_KEY));
      totals.put(metric.getName(), point.getValue());
    }

    assertEquals(
        Map.of("pipeline.jobs.completed", 2L, "pipeline.jobs.failed", 1L, "pipeline.jobs.submitted", 3L),
        totals);
  }

  @Test
  void exportedResourceIdentifiesTheService() {
    metrics.increment("selection.raw.fallback");
    metrics.forceFlush();

    MetricData fallback = reader.collectAllMetrics().iterator().next();

    assertEquals("photonic", fallback.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", fallback.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void keysAreMappedToValidInstrumentNames() {
    assertEquals("selection.raw.fallback", OpenTelemetryMetricsAdapter.sanitizeName("selection.raw.fallback"));
    assertEquals("stack.rejectedpixels", OpenTelemetryMetricsAdapter.sanitizeName(" stack.rejectedPixels "));
    assertEquals("m3d_align", OpenTelemetryMetricsAdapter.sanitizeName("3D align"));
    assertEquals("photonic.metric", OpenTelemetryMetricsAdapter.sanitizeName(""));
  }
}
