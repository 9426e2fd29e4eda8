package ca.gc.cra.photonic.config;

import ca.gc.cra.photonic.domain.job.JobType;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Built-in configuration defaults as a flat map, the lowest layer of {@link ConfigMerger}.
 *
 * @since 0.1.0
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns defaults for a job type.
   *
   * @param mode job type wire name
   * @return immutable defaults
   * @throws IllegalArgumentException when {@code mode} is not a job type
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (JobType.fromWireName(mode)) {
      // single-job commands never need more than one worker
      case SCAN, RAW_CONVERT -> Map.of("workers", "1");
      case TIMELAPSE, PANORAMIC, STACK, ALIGN -> Map.of();
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    PipelineConfig defaults = PipelineConfig.defaults();
    RawConfig raw = defaults.raw();
    AlignmentConfig alignment = defaults.alignment();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("workers", Integer.toString(defaults.workers()));
    map.put("subscriberBuffer", Integer.toString(defaults.subscriberBuffer()));
    map.put("journal", "");
    map.put("metricsExporter", defaults.metricsExporter());
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("timeout", "0");
    map.put("verbose", "false");
    map.put("stacking.defaultProcessor", "");
    map.put("alignment.defaultProcessor", alignment.defaultProcessor());
    map.put("alignment.astro.enabled", Boolean.toString(alignment.astroEnabled()));
    map.put("alignment.panoramic.enabled", Boolean.toString(alignment.panoramicEnabled()));
    map.put("alignment.general.enabled", Boolean.toString(alignment.generalEnabled()));
    map.put("alignment.timelapse.enabled", Boolean.toString(alignment.timelapseEnabled()));
    map.put("raw.defaultTool", raw.defaultTool());
    map.put("raw.outputFormat", raw.outputFormat());
    map.put("raw.quality", Integer.toString(raw.quality()));
    map.put("raw.darktable.enabled", Boolean.toString(raw.darktableEnabled()));
    map.put("raw.imagemagick.enabled", Boolean.toString(raw.imagemagickEnabled()));
    map.put("raw.dcraw.enabled", Boolean.toString(raw.dcrawEnabled()));
    map.put("raw.rawtherapee.enabled", Boolean.toString(raw.rawtherapeeEnabled()));
    map.put("raw.dcraw.whiteBalance", raw.dcraw().whiteBalance());
    return Map.copyOf(map);
  }
}
