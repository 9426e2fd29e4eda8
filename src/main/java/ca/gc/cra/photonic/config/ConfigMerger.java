package ca.gc.cra.photonic.config;

import ca.gc.cra.photonic.application.selection.RawProcessorRegistry;
import ca.gc.cra.photonic.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML, and CLI settings into the effective configuration.
 *
 * <p>Precedence is CLI over YAML over defaults. A CLI value that shadows a YAML value is reported through
 * the {@code warn} callback so operators notice stale files.
 *
 * @since 0.1.0
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds and validates the effective configuration.
   *
   * @param mode job type wire name
   * @param yaml settings from the YAML file, if any
   * @param cli settings from the command line
   * @param defaults built-in defaults for {@code mode}
   * @param warn receives override notices; may be {@code null}
   * @return immutable merged settings
   * @throws IllegalArgumentException when the merged settings are inconsistent
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);

    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      String value = entry.getValue();
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (value != null) {
        merged.put(key, value);
      }
    }

    validate(merged);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective) {
    String defaultTool = trim(effective.get("raw.defaultTool")).toLowerCase(Locale.ROOT);
    if (!defaultTool.isEmpty() && !RawProcessorRegistry.PRIORITY.contains(defaultTool)) {
      throw new IllegalArgumentException(
          "raw.defaultTool must be one of " + RawProcessorRegistry.PRIORITY + " (was " + defaultTool + ")");
    }

    boolean anyAlignment = parseBoolean(effective, "alignment.astro.enabled")
        || parseBoolean(effective, "alignment.panoramic.enabled")
        || parseBoolean(effective, "alignment.general.enabled")
        || parseBoolean(effective, "alignment.timelapse.enabled");
    if (!anyAlignment) {
      throw new IllegalArgumentException("At least one alignment type must be enabled");
    }
  }

  private static boolean parseBoolean(Map<String, String> effective, String key) {
    String value = effective.get(key);
    if (value == null || value.isBlank()) {
      return true;
    }
    return Strings.parseBoolean(key, value.trim());
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
