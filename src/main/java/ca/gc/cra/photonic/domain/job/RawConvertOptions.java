package ca.gc.cra.photonic.domain.job;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Options for {@link JobType#RAW_CONVERT}.
 *
 * @param tool preferred converter tried first; blank uses the configured default
 * @param outputFormat output extension without the dot; defaults to {@code jpg}
 * @param quality lossy output quality in {@code [1, 100]}; defaults to 90
 * @since 0.1.0
 */
public record RawConvertOptions(String tool, String outputFormat, int quality) implements JobOptions {
  public static final int DEFAULT_QUALITY = 90;

  public RawConvertOptions {
    tool = tool == null ? "" : tool.trim();
    outputFormat =
        outputFormat == null || outputFormat.isBlank()
            ? "jpg"
            : outputFormat.trim().toLowerCase(Locale.ROOT).replaceFirst("^\\.", "");
    if (quality <= 0 || quality > 100) {
      quality = DEFAULT_QUALITY;
    }
  }

  public static RawConvertOptions defaults() {
    return new RawConvertOptions("", "jpg", DEFAULT_QUALITY);
  }

  @Override
  public JobType jobType() {
    return JobType.RAW_CONVERT;
  }

  @Override
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("tool", tool);
    map.put("outputFormat", outputFormat);
    map.put("quality", quality);
    return map;
  }
}
