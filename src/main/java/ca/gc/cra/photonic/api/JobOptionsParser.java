package ca.gc.cra.photonic.api;

import ca.gc.cra.photonic.config.RawConfig;
import ca.gc.cra.photonic.domain.align.AlignmentType;
import ca.gc.cra.photonic.domain.job.AlignOptions;
import ca.gc.cra.photonic.domain.job.JobOptions;
import ca.gc.cra.photonic.domain.job.JobType;
import ca.gc.cra.photonic.domain.job.PanoramicOptions;
import ca.gc.cra.photonic.domain.job.RawConvertOptions;
import ca.gc.cra.photonic.domain.job.ScanOptions;
import ca.gc.cra.photonic.domain.job.StackOptions;
import ca.gc.cra.photonic.domain.job.TimelapseOptions;
import ca.gc.cra.photonic.domain.stack.StackMethod;
import ca.gc.cra.photonic.domain.stack.StackParameters;
import ca.gc.cra.photonic.infrastructure.media.FfmpegTimelapseBuilder;
import ca.gc.cra.photonic.validation.Numbers;
import ca.gc.cra.photonic.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns the job-specific {@code key=value} arguments into typed {@link JobOptions}.
 *
 * <p>Each job type accepts a fixed key set; an unknown key is an error rather than being ignored, so a typo
 * never silently falls back to a default. Enumerated values are checked here so the job fails before it is
 * queued.
 *
 * @since 0.1.0
 */
public final class JobOptionsParser {
  private static final Set<String> SCAN_KEYS = Set.of("clusterGap", "minGroupSize");
  private static final Set<String> TIMELAPSE_KEYS = Set.of("fps", "formats", "resolution", "rawTool", "noCache");
  private static final Set<String> PANORAMIC_KEYS =
      Set.of("projection", "blending", "quality", "aggression", "rawTool", "noCache");
  private static final Set<String> STACK_KEYS = Set.of(
      "method", "sigmaLow", "sigmaHigh", "iterations", "kappa", "winsorPercent", "percentile",
      "alignment", "processor", "astroMode", "rawTool", "noCache");
  private static final Set<String> ALIGN_KEYS = Set.of("images", "type", "quality", "starThreshold", "processor");
  private static final Set<String> RAW_CONVERT_KEYS = Set.of("tool", "format", "quality");

  private static final Set<String> PROJECTIONS =
      Set.of("planar", "cylindrical", "spherical", "fisheye", "stereographic", "mercator");
  private static final Set<String> BLENDINGS = Set.of("multiband", "feather", "none");
  private static final Set<String> QUALITIES = Set.of("fast", "normal", "high", "ultra");
  private static final Set<String> AGGRESSIONS = Set.of("low", "moderate", "high");
  private static final Set<String> RESOLUTIONS = Set.of("1080p", "720p", "480p", "240p");
  private static final Set<String> ALIGNMENTS =
      Set.of("auto", "none", "star", "astro", "feature", "general", "panoramic", "timelapse");
  private static final Set<String> RAW_TOOLS = Set.of("imagemagick", "darktable", "dcraw", "rawtherapee");
  private static final Set<String> RAW_FORMATS = Set.of("jpg", "jpeg", "tif", "tiff", "png");

  private static final int MAX_FPS = 120;
  private static final long MAX_CLUSTER_GAP_SECONDS = 86_400L;

  private JobOptionsParser() {}

  /**
   * Parses options for {@code type}.
   *
   * @param type job type
   * @param options job option arguments; configuration keys must already be removed
   * @param rawDefaults configured RAW defaults applied to {@code raw-convert} jobs
   * @return typed options
   * @throws IllegalArgumentException on unknown keys or invalid values
   */
  public static JobOptions parse(JobType type, Map<String, String> options, RawConfig rawDefaults) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(options, "options");
    Objects.requireNonNull(rawDefaults, "rawDefaults");
    requireKnownKeys(type, options.keySet());
    return switch (type) {
      case SCAN -> parseScan(options);
      case TIMELAPSE -> parseTimelapse(options);
      case PANORAMIC -> parsePanoramic(options);
      case STACK -> parseStack(options);
      case ALIGN -> parseAlign(options);
      case RAW_CONVERT -> parseRawConvert(options, rawDefaults);
    };
  }

  /**
   * Returns the option keys accepted by a job type.
   *
   * @param type job type
   * @return accepted keys
   */
  public static Set<String> keysFor(JobType type) {
    return switch (type) {
      case SCAN -> SCAN_KEYS;
      case TIMELAPSE -> TIMELAPSE_KEYS;
      case PANORAMIC -> PANORAMIC_KEYS;
      case STACK -> STACK_KEYS;
      case ALIGN -> ALIGN_KEYS;
      case RAW_CONVERT -> RAW_CONVERT_KEYS;
    };
  }

  private static void requireKnownKeys(JobType type, Set<String> keys) {
    Set<String> allowed = keysFor(type);
    Set<String> unknown = new TreeSet<>();
    for (String key : keys) {
      if (!allowed.contains(key)) {
        unknown.add(key);
      }
    }
    if (!unknown.isEmpty()) {
      throw new IllegalArgumentException(
          "unknown option(s) for " + type.wireName() + ": " + String.join(", ", unknown)
              + " (allowed: " + String.join(", ", new TreeSet<>(allowed)) + ")");
    }
  }

  private static ScanOptions parseScan(Map<String, String> options) {
    long gapSeconds = Numbers.requireRange(
        "clusterGap",
        parseInt(options, "clusterGap", (int) ScanOptions.DEFAULT_CLUSTER_GAP.toSeconds()),
        1,
        MAX_CLUSTER_GAP_SECONDS);
    int minGroupSize = (int) Numbers.requireRange(
        "minGroupSize", parseInt(options, "minGroupSize", ScanOptions.DEFAULT_MIN_GROUP_SIZE), 1, 10_000);
    return new ScanOptions(Duration.ofSeconds(gapSeconds), minGroupSize);
  }

  private static TimelapseOptions parseTimelapse(Map<String, String> options) {
    int fps = (int) Numbers.requireRange("fps", parseInt(options, "fps", TimelapseOptions.DEFAULT_FPS), 1, MAX_FPS);
    List<String> formats = parseList(options.get("formats"));
    for (String format : formats) {
      requireOneOf("formats", format, FfmpegTimelapseBuilder.SUPPORTED_FORMATS);
    }
    String resolution = optionalChoice(options, "resolution", RESOLUTIONS);
    return new TimelapseOptions(fps, formats, resolution, rawTool(options), parseBoolean(options, "noCache"));
  }

  private static PanoramicOptions parsePanoramic(Map<String, String> options) {
    return new PanoramicOptions(
        optionalChoice(options, "projection", PROJECTIONS),
        optionalChoice(options, "blending", BLENDINGS),
        optionalChoice(options, "quality", QUALITIES),
        optionalChoice(options, "aggression", AGGRESSIONS),
        rawTool(options),
        parseBoolean(options, "noCache"));
  }

  private static StackOptions parseStack(Map<String, String> options) {
    String methodName = Strings.trimToEmpty(options.get("method"));
    StackMethod method = methodName.isEmpty() ? StackMethod.AVERAGE : StackMethod.fromWireName(methodName);
    StackParameters parameters = new StackParameters(
        positive("sigmaLow", parseDouble(options, "sigmaLow", StackParameters.DEFAULT_SIGMA)),
        positive("sigmaHigh", parseDouble(options, "sigmaHigh", StackParameters.DEFAULT_SIGMA)),
        (int) Numbers.requireRange(
            "iterations", parseInt(options, "iterations", StackParameters.DEFAULT_ITERATIONS), 1, 100),
        positive("kappa", parseDouble(options, "kappa", StackParameters.DEFAULT_KAPPA)),
        Numbers.requireRange(
            "winsorPercent", parseDouble(options, "winsorPercent", StackParameters.DEFAULT_WINSOR_PERCENT), 0.01d, 50d),
        Numbers.requireRange(
            "percentile", parseDouble(options, "percentile", StackParameters.DEFAULT_PERCENTILE), 0.01d, 1d));
    return new StackOptions(
        method,
        parameters,
        optionalChoice(options, "alignment", ALIGNMENTS),
        Strings.trimToEmpty(options.get("processor")),
        parseBoolean(options, "astroMode"),
        rawTool(options),
        parseBoolean(options, "noCache"));
  }

  private static AlignOptions parseAlign(Map<String, String> options) {
    List<Path> images = new ArrayList<>();
    for (String image : parseList(options.get("images"))) {
      images.add(parsePath("images", image));
    }
    String typeName = Strings.trimToEmpty(options.get("type"));
    AlignmentType type =
        typeName.isEmpty() || typeName.equalsIgnoreCase("auto") ? null : AlignmentType.fromWireName(typeName);
    double threshold = Numbers.requireRange(
        "starThreshold", parseDouble(options, "starThreshold", AlignOptions.DEFAULT_STAR_THRESHOLD), 0.01d, 1d);
    return new AlignOptions(
        images, type, optionalChoice(options, "quality", QUALITIES), threshold,
        Strings.trimToEmpty(options.get("processor")));
  }

  private static RawConvertOptions parseRawConvert(Map<String, String> options, RawConfig defaults) {
    String tool = optionalChoice(options, "tool", RAW_TOOLS);
    String format = optionalChoice(options, "format", RAW_FORMATS);
    int quality = (int) Numbers.requireRange("quality", parseInt(options, "quality", defaults.quality()), 1, 100);
    return new RawConvertOptions(tool, format.isEmpty() ? defaults.outputFormat() : format, quality);
  }

  private static String rawTool(Map<String, String> options) {
    return optionalChoice(options, "rawTool", RAW_TOOLS);
  }

  private static String optionalChoice(Map<String, String> options, String key, Iterable<String> allowed) {
    String value = Strings.trimToEmpty(options.get(key)).toLowerCase(Locale.ROOT);
    if (value.isEmpty()) {
      return value;
    }
    return requireOneOf(key, value, allowed);
  }

  private static String requireOneOf(String key, String value, Iterable<String> allowed) {
    for (String candidate : allowed) {
      if (candidate.equals(value)) {
        return value;
      }
    }
    Set<String> sorted = new TreeSet<>();
    allowed.forEach(sorted::add);
    throw new IllegalArgumentException(key + " must be one of " + sorted + " (was " + value + ")");
  }

  private static List<String> parseList(String raw) {
    Set<String> values = new LinkedHashSet<>();
    for (String part : Strings.trimToEmpty(raw).split(",")) {
      String trimmed = part.trim();
      if (!trimmed.isEmpty()) {
        values.add(trimmed);
      }
    }
    return List.copyOf(values);
  }

  private static int parseInt(Map<String, String> options, String key, int defaultValue) {
    String value = options.get(key);
    return value == null || value.isBlank() ? defaultValue : Numbers.parseInt(key, value.trim());
  }

  private static double parseDouble(Map<String, String> options, String key, double defaultValue) {
    String value = options.get(key);
    return value == null || value.isBlank() ? defaultValue : Numbers.parseDouble(key, value.trim());
  }

  private static boolean parseBoolean(Map<String, String> options, String key) {
    String value = options.get(key);
    return value != null && !value.isBlank() && Strings.parseBoolean(key, value.trim());
  }

  private static double positive(String name, double value) {
    if (!(value > 0d)) {
      throw new IllegalArgumentException(name + " must be positive (was " + value + ")");
    }
    return value;
  }

  private static Path parsePath(String name, String value) {
    try {
      return Path.of(value).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " contains an invalid path: " + value, ex);
    }
  }
}
