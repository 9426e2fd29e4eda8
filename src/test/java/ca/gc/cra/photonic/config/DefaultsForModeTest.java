package ca.gc.cra.photonic.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void singleJobModesUseOneWorker() {
    assertEquals("1", DefaultsForMode.asFlatMap("scan").get("workers"));
    assertEquals("1", DefaultsForMode.asFlatMap("raw-convert").get("workers"));
  }

  @Test
  void processingModesUsePipelineDefaults() {
    Map<String, String> stack = DefaultsForMode.asFlatMap("stack");

    assertEquals(Integer.toString(PipelineConfig.defaults().workers()), stack.get("workers"));
    assertEquals("otlp", stack.get("metricsExporter"));
    assertEquals("0", stack.get("timeout"));
    assertEquals("true", stack.get("alignment.astro.enabled"));
  }

  @Test
  void everyDefaultKeyIsAConfigurationKey() {
    assertTrue(PipelineConfig.KEYS.containsAll(DefaultsForMode.asFlatMap("timelapse").keySet()));
  }

  @Test
  void defaultsParseIntoDefaultConfig() {
    PipelineConfig parsed = PipelineConfig.fromMap(DefaultsForMode.asFlatMap("panoramic"));

    assertEquals(PipelineConfig.defaults(), parsed);
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("sniff"));
  }
}
