package ca.gc.cra.photonic.domain.job;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Options for {@link JobType#TIMELAPSE}.
 *
 * @param fps output frame rate; defaults to 10
 * @param formats output formats ({@code mp4}, {@code mp4-h265}, {@code gif}); defaults to {@code mp4}
 * @param resolution optional scale preset ({@code 1080p}, {@code 720p}, {@code 480p}); blank keeps source size
 * @param rawTool preferred RAW converter for pre-conversion; blank uses the configured default
 * @param noCache reconvert RAW files even when a cached conversion is current
 * @since 0.1.0
 */
public record TimelapseOptions(
    int fps, List<String> formats, String resolution, String rawTool, boolean noCache)
    implements JobOptions {
  public static final int DEFAULT_FPS = 10;

  public TimelapseOptions {
    if (fps <= 0) {
      fps = DEFAULT_FPS;
    }
    formats = formats == null || formats.isEmpty() ? List.of("mp4") : List.copyOf(formats);
    resolution = resolution == null ? "" : resolution.trim();
    rawTool = rawTool == null ? "" : rawTool.trim();
  }

  public static TimelapseOptions defaults() {
    return new TimelapseOptions(DEFAULT_FPS, List.of(), "", "", false);
  }

  @Override
  public JobType jobType() {
    return JobType.TIMELAPSE;
  }

  @Override
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("fps", fps);
    map.put("formats", formats);
    map.put("resolution", resolution);
    map.put("rawTool", rawTool);
    map.put("noCache", noCache);
    return map;
  }
}
