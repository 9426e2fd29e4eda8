package ca.gc.cra.photonic.domain.job;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options for {@link JobType#PANORAMIC}.
 *
 * @param projection output projection ({@code cylindrical}, {@code rectilinear}, {@code equirectangular}, ...)
 * @param blending seam blending ({@code multiband}, {@code feather}, {@code none})
 * @param quality interpolation quality ({@code fast}, {@code normal}, {@code high}, {@code ultra})
 * @param aggression control-point cleaning strength ({@code low}, {@code moderate}, {@code high})
 * @param rawTool preferred RAW converter for pre-conversion
 * @param noCache reconvert RAW files even when a cached conversion is current
 * @since 0.1.0
 */
public record PanoramicOptions(
    String projection,
    String blending,
    String quality,
    String aggression,
    String rawTool,
    boolean noCache)
    implements JobOptions {

  public PanoramicOptions {
    projection = orDefault(projection, "cylindrical");
    blending = orDefault(blending, "multiband");
    quality = orDefault(quality, "normal");
    aggression = orDefault(aggression, "moderate");
    rawTool = rawTool == null ? "" : rawTool.trim();
  }

  public static PanoramicOptions defaults() {
    return new PanoramicOptions(null, null, null, null, null, false);
  }

  @Override
  public JobType jobType() {
    return JobType.PANORAMIC;
  }

  @Override
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("projection", projection);
    map.put("blending", blending);
    map.put("quality", quality);
    map.put("aggression", aggression);
    map.put("rawTool", rawTool);
    map.put("noCache", noCache);
    return map;
  }

  private static String orDefault(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value.trim();
  }
}
