package ca.gc.cra.photonic.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterHistogramTest {
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
  void stackRejectionsAndJobLatencyAreSeparateHistograms() {
    metrics.observe("stack.rejectedPixels", 0L);
    metrics.observe("stack.rejectedPixels", 12L);
    metrics.observe("pipeline.job.latencyMillis", 850L);
    metrics.forceFlush();

    HistogramPointData rejected = point("stack.rejectedpixels");
    HistogramPointData latency = point("pipeline.job.latencymillis");

    assertEquals(2L, rejected.getCount());
    assertEquals(12.0, rejected.getSum());
    assertEquals("stack.rejectedPixels",
        rejected.getAttributes().get(AttributeKey.stringKey("photonic.metric.key")));
    assertEquals(1L, latency.getCount());
    assertEquals(850.0, latency.getSum());
  }

  private HistogramPointData point(String instrument) {
    MetricData metric = reader.collectAllMetrics().stream()
        .filter(candidate -> candidate.getName().equals(instrument))
        .findFirst()
        .orElseThrow(() -> new AssertionError("no histogram exported as " + instrument));
    assertEquals(MetricDataType.HISTOGRAM, metric.getType());
    return metric.getHistogramData().getPoints().iterator().next();
  }
}
