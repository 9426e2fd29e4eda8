package ca.gc.cra.photonic.config;

import ca.gc.cra.photonic.domain.job.JobType;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads the per-command YAML settings file into the dotted keys understood by {@link PipelineConfig}.
 *
 * <p>Top-level sections are {@code common}, applied to every command, and one section per job type
 * ({@code stack}, {@code raw-convert}, ...) that overrides {@code common} for that command only. Section
 * names are matched case-insensitively; any other top-level name is a configuration error, so a typo
 * such as {@code stak:} is reported instead of ignored. Inside a section, nested mappings become dotted
 * keys ({@code raw: {quality: 95}} yields {@code raw.quality=95}), empty values become empty strings and
 * sequences are rejected.
 *
 * @since 0.1.0
 */
public final class YamlConfigLoader {
  static final String COMMON_SECTION = "common";

  private YamlConfigLoader() {}

  /**
   * Loads the settings that apply to {@code type}.
   *
   * @param path YAML file
   * @param type command being configured
   * @return merged settings, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is malformed or names an unknown section
   */
  public static Optional<Map<String, String>> load(Path path, JobType type) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(type, "type");
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }

    Map<String, Map<String, Object>> sections = sections(document, path);
    Map<String, String> settings = new LinkedHashMap<>();
    flatten(sections.getOrDefault(COMMON_SECTION, Map.of()), "", settings);
    flatten(sections.getOrDefault(type.wireName(), Map.of()), "", settings);
    return Optional.of(Map.copyOf(settings));
  }

  /** Splits the root mapping into validated sections keyed by their normalized name. */
  private static Map<String, Map<String, Object>> sections(Object document, Path path) {
    Map<String, Object> root = mapping(document, "root of " + path);
    Map<String, Map<String, Object>> sections = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      String name = entry.getKey().trim().toLowerCase(Locale.ROOT);
      if (!sectionNames().contains(name)) {
        throw new IllegalArgumentException(
            "Unknown section '" + entry.getKey() + "' in " + path + "; expected one of " + sectionNames());
      }
      if (sections.containsKey(name)) {
        throw new IllegalArgumentException("Section '" + name + "' appears more than once in " + path);
      }
      Object body = entry.getValue();
      sections.put(name, body == null ? Map.of() : mapping(body, "section '" + name + "'"));
    }
    return sections;
  }

  static Set<String> sectionNames() {
    Set<String> names = new TreeSet<>();
    names.add(COMMON_SECTION);
    for (JobType type : JobType.values()) {
      names.add(type.wireName());
    }
    return names;
  }

  private static Map<String, Object> mapping(Object node, String where) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(where + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key) || key.isBlank()) {
        throw new IllegalArgumentException(where + " contains a blank or non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = prefix.isEmpty() ? entry.getKey() : prefix + '.' + entry.getKey();
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> nested) {
        flatten(mapping(nested, "key '" + key + "'"), key, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML sequences are not supported for key " + key);
      } else {
        target.put(key, value == null ? "" : value.toString());
      }
    }
  }
}
