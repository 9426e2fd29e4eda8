package ca.gc.cra.photonic.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlWhichOverridesDefaults() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        "stack",
        Optional.of(Map.of("workers", "4", "journal", "/var/journal")),
        Map.of("workers", "8"),
        Map.of("workers", "2", "journal", "", "metricsExporter", "otlp"),
        warnings::add);

    assertEquals("8", effective.get("workers"));
    assertEquals("/var/journal", effective.get("journal"));
    assertEquals("otlp", effective.get("metricsExporter"));
    assertEquals(List.of("CLI overrides YAML for key: workers"), warnings);
  }

  @Test
  void defaultsUsedWhenNoYaml() {
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        "scan", Optional.empty(), Map.of(), DefaultsForMode.asFlatMap("scan"), null);

    assertEquals("1", effective.get("workers"));
    assertEquals("imagemagick", effective.get("raw.defaultTool"));
  }

  @Test
  void unknownRawDefaultToolIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "stack", Optional.empty(), Map.of("raw.defaultTool", "photoshop"), Map.of(), null));
  }

  @Test
  void disablingEveryAlignmentTypeIsRejected() {
    Map<String, String> cli = Map.of(
        "alignment.astro.enabled", "false",
        "alignment.panoramic.enabled", "no",
        "alignment.general.enabled", "0",
        "alignment.timelapse.enabled", "off");

    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "align", Optional.empty(), cli, DefaultsForMode.asFlatMap("align"), null));
  }

  @Test
  void oneEnabledAlignmentTypeIsEnough() {
    Map<String, String> cli = Map.of(
        "alignment.astro.enabled", "false",
        "alignment.panoramic.enabled", "false",
        "alignment.general.enabled", "yes",
        "alignment.timelapse.enabled", "false");

    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        "align", Optional.empty(), cli, DefaultsForMode.asFlatMap("align"), null);

    assertEquals("yes", effective.get("alignment.general.enabled"));
  }
}
