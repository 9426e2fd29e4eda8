package ca.gc.cra.photonic.api;

import ca.gc.cra.photonic.config.PipelineConfig;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Helpers shared by the CLI for locating and splitting configuration. */
final class ConfigCliUtils {
  static final String CONFIG_ENV = "PHOTONIC_CONFIG";

  private ConfigCliUtils() {}

  /**
   * Removes {@code config=} from {@code args}, falling back to the {@code PHOTONIC_CONFIG} variable.
   *
   * @param args mutable CLI map
   * @param environment process environment
   * @return YAML path, if any
   */
  static Optional<Path> extractConfigPath(Map<String, String> args, Map<String, String> environment) {
    String value = args.remove("config");
    if (value != null && !value.isBlank()) {
      return Optional.of(Path.of(value.trim()));
    }
    String fromEnv = environment.get(CONFIG_ENV);
    if (fromEnv != null && !fromEnv.isBlank()) {
      return Optional.of(Path.of(fromEnv.trim()));
    }
    return Optional.empty();
  }

  /**
   * Moves every configuration key out of {@code args}.
   *
   * @param args mutable CLI map; left holding only job options
   * @return configuration keys in CLI order
   */
  static Map<String, String> extractConfigKeys(Map<String, String> args) {
    Map<String, String> config = new LinkedHashMap<>();
    args.entrySet().removeIf(entry -> {
      if (PipelineConfig.KEYS.contains(entry.getKey())) {
        config.put(entry.getKey(), entry.getValue());
        return true;
      }
      return false;
    });
    return config;
  }
}
