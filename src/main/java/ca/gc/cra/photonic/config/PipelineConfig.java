package ca.gc.cra.photonic.config;

import ca.gc.cra.photonic.application.pipeline.JobPipeline.PipelineSettings;
import ca.gc.cra.photonic.infrastructure.raw.DarktableRawProcessor;
import ca.gc.cra.photonic.infrastructure.raw.DcrawRawProcessor;
import ca.gc.cra.photonic.validation.Numbers;
import ca.gc.cra.photonic.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Typed process-wide settings built from the merged {@code key=value} configuration.
 * <p><strong>Why:</strong> Keeps string parsing at the edge; {@link CompositionRoot} only sees validated values.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param workers worker threads in the job pipeline (1-64)
 * @param subscriberBuffer results buffered per subscriber (1-4096)
 * @param journal directory receiving the JSON-lines job journal; empty disables it
 * @param metricsExporter {@code otlp} or {@code none}
 * @param jobTimeout how long the CLI waits for a job; zero waits indefinitely
 * @param stackingDefaultProcessor stacking processor preferred when a job names none
 * @param alignment alignment settings
 * @param raw RAW conversion settings
 * @since 0.1.0
 */
public record PipelineConfig(
    int workers,
    int subscriberBuffer,
    Optional<Path> journal,
    String metricsExporter,
    Duration jobTimeout,
    String stackingDefaultProcessor,
    AlignmentConfig alignment,
    RawConfig raw) {

  /** Keys understood by {@link #fromMap(Map)}; anything else on the command line is a job option. */
  public static final Set<String> KEYS = Set.of(
      "workers",
      "subscriberBuffer",
      "journal",
      "metricsExporter",
      "otelEndpoint",
      "otelResourceAttributes",
      "timeout",
      "verbose",
      "stacking.defaultProcessor",
      "alignment.defaultProcessor",
      "alignment.astro.enabled",
      "alignment.panoramic.enabled",
      "alignment.general.enabled",
      "alignment.timelapse.enabled",
      "raw.defaultTool",
      "raw.outputFormat",
      "raw.quality",
      "raw.darktable.enabled",
      "raw.darktable.applyPresets",
      "raw.darktable.highQuality",
      "raw.darktable.width",
      "raw.darktable.height",
      "raw.imagemagick.enabled",
      "raw.imagemagick.resize",
      "raw.dcraw.enabled",
      "raw.dcraw.whiteBalance",
      "raw.dcraw.colorMatrix",
      "raw.dcraw.gamma",
      "raw.dcraw.brightness",
      "raw.rawtherapee.enabled",
      "raw.rawtherapee.profile",
      "raw.rawtherapee.outputProfile");

  private static final int MAX_WORKERS = 64;
  private static final int MAX_SUBSCRIBER_BUFFER = 4_096;
  private static final long MAX_TIMEOUT_SECONDS = 7L * 24 * 3600;

  public PipelineConfig {
    workers = (int) Numbers.requireRange("workers", workers, 1, MAX_WORKERS);
    subscriberBuffer = (int) Numbers.requireRange("subscriberBuffer", subscriberBuffer, 1, MAX_SUBSCRIBER_BUFFER);
    journal = Objects.requireNonNullElse(journal, Optional.empty());
    metricsExporter = normalizeExporter(metricsExporter);
    jobTimeout = jobTimeout == null || jobTimeout.isNegative() ? Duration.ZERO : jobTimeout;
    stackingDefaultProcessor = Strings.trimToEmpty(stackingDefaultProcessor);
    alignment = Objects.requireNonNullElse(alignment, AlignmentConfig.defaults());
    raw = Objects.requireNonNullElse(raw, RawConfig.defaults());
  }

  /**
   * Returns the built-in configuration.
   *
   * @return defaults matching {@link DefaultsForMode}
   */
  public static PipelineConfig defaults() {
    PipelineSettings settings = PipelineSettings.defaults();
    return new PipelineConfig(
        settings.workers(),
        settings.subscriberBuffer(),
        Optional.empty(),
        "otlp",
        Duration.ZERO,
        "",
        AlignmentConfig.defaults(),
        RawConfig.defaults());
  }

  /**
   * Parses a flat configuration map; missing keys keep their {@link #defaults()} value.
   *
   * @param options merged configuration keyed by dotted names
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static PipelineConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    PipelineConfig defaults = defaults();

    int workers = parseInt(options, "workers", defaults.workers());
    int subscriberBuffer = parseInt(options, "subscriberBuffer", defaults.subscriberBuffer());
    Optional<Path> journal = optionalString(options.get("journal")).map(value -> parsePath("journal", value));
    String exporter = optionalString(options.get("metricsExporter")).orElse(defaults.metricsExporter());
    long timeoutSeconds = Numbers.requireRange(
        "timeout", parseInt(options, "timeout", 0), 0, MAX_TIMEOUT_SECONDS);

    AlignmentConfig alignmentDefaults = defaults.alignment();
    AlignmentConfig alignment = new AlignmentConfig(
        optionalString(options.get("alignment.defaultProcessor")).orElse(alignmentDefaults.defaultProcessor()),
        parseBoolean(options, "alignment.astro.enabled", alignmentDefaults.astroEnabled()),
        parseBoolean(options, "alignment.panoramic.enabled", alignmentDefaults.panoramicEnabled()),
        parseBoolean(options, "alignment.general.enabled", alignmentDefaults.generalEnabled()),
        parseBoolean(options, "alignment.timelapse.enabled", alignmentDefaults.timelapseEnabled()));

    RawConfig rawDefaults = defaults.raw();
    DarktableRawProcessor.Settings darktableDefaults = rawDefaults.darktable();
    DcrawRawProcessor.Settings dcrawDefaults = rawDefaults.dcraw();
    RawConfig raw = new RawConfig(
        optionalString(options.get("raw.defaultTool")).orElse(rawDefaults.defaultTool()),
        optionalString(options.get("raw.outputFormat")).orElse(rawDefaults.outputFormat()),
        parseInt(options, "raw.quality", rawDefaults.quality()),
        parseBoolean(options, "raw.darktable.enabled", rawDefaults.darktableEnabled()),
        parseBoolean(options, "raw.imagemagick.enabled", rawDefaults.imagemagickEnabled()),
        parseBoolean(options, "raw.dcraw.enabled", rawDefaults.dcrawEnabled()),
        parseBoolean(options, "raw.rawtherapee.enabled", rawDefaults.rawtherapeeEnabled()),
        new DarktableRawProcessor.Settings(
            parseBoolean(options, "raw.darktable.applyPresets", darktableDefaults.applyPresets()),
            parseBoolean(options, "raw.darktable.highQuality", darktableDefaults.highQuality()),
            nonNegative("raw.darktable.width", parseInt(options, "raw.darktable.width", darktableDefaults.width())),
            nonNegative("raw.darktable.height", parseInt(options, "raw.darktable.height", darktableDefaults.height()))),
        new DcrawRawProcessor.Settings(
            optionalString(options.get("raw.dcraw.whiteBalance")).orElse(dcrawDefaults.whiteBalance()),
            nonNegative("raw.dcraw.colorMatrix", parseInt(options, "raw.dcraw.colorMatrix", dcrawDefaults.colorMatrix())),
            optionalString(options.get("raw.dcraw.gamma")).orElse(dcrawDefaults.gamma()),
            parseDouble(options, "raw.dcraw.brightness", dcrawDefaults.brightness())),
        optionalString(options.get("raw.imagemagick.resize")).orElse(rawDefaults.imagemagickResize()),
        optionalString(options.get("raw.rawtherapee.profile")).orElse(rawDefaults.rawtherapeeProfile()),
        optionalString(options.get("raw.rawtherapee.outputProfile")).orElse(rawDefaults.rawtherapeeOutputProfile()));

    return new PipelineConfig(
        workers,
        subscriberBuffer,
        journal,
        exporter,
        Duration.ofSeconds(timeoutSeconds),
        optionalString(options.get("stacking.defaultProcessor")).orElse(defaults.stackingDefaultProcessor()),
        alignment,
        raw);
  }

  /** @return pipeline sizing derived from this configuration */
  public PipelineSettings pipelineSettings() {
    return new PipelineSettings(workers, subscriberBuffer);
  }

  /** @return {@code true} when metrics go nowhere */
  public boolean metricsDisabled() {
    return "none".equals(metricsExporter);
  }

  private static String normalizeExporter(String value) {
    String normalized = value == null || value.isBlank() ? "otlp" : value.trim().toLowerCase(Locale.ROOT);
    if (!normalized.equals("otlp") && !normalized.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    return normalized;
  }

  private static int parseInt(Map<String, String> options, String key, int defaultValue) {
    String value = options.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Numbers.parseInt(key, value.trim());
  }

  private static double parseDouble(Map<String, String> options, String key, double defaultValue) {
    String value = options.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Numbers.parseDouble(key, value.trim());
  }

  private static boolean parseBoolean(Map<String, String> options, String key, boolean defaultValue) {
    String value = options.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Strings.parseBoolean(key, value.trim());
  }

  private static int nonNegative(String name, int value) {
    return (int) Numbers.requireRange(name, value, 0, Integer.MAX_VALUE);
  }

  private static Optional<String> optionalString(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
  }

  private static Path parsePath(String name, String value) {
    try {
      return Path.of(value).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }
}
