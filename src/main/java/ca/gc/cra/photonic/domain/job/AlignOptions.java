package ca.gc.cra.photonic.domain.job;

import ca.gc.cra.photonic.domain.align.AlignmentType;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Options for {@link JobType#ALIGN}.
 *
 * @param images explicit frame list; empty means every image in the job's input directory
 * @param type alignment type; {@code null} lets the router infer one from the frame count
 * @param quality quality preset forwarded to external aligners ({@code fast}, {@code normal}, {@code high}, {@code ultra})
 * @param starThreshold detection sensitivity in standard deviations above the mean luminance
 * @param processor explicit alignment processor; blank selects by quality
 * @since 0.1.0
 */
public record AlignOptions(
    List<Path> images, AlignmentType type, String quality, double starThreshold, String processor)
    implements JobOptions {
  public static final double DEFAULT_STAR_THRESHOLD = 0.85d;

  public AlignOptions {
    images = images == null ? List.of() : List.copyOf(images);
    quality = quality == null || quality.isBlank() ? "normal" : quality.trim();
    if (!(starThreshold > 0d)) {
      starThreshold = DEFAULT_STAR_THRESHOLD;
    }
    processor = processor == null ? "" : processor.trim();
  }

  public static AlignOptions defaults() {
    return new AlignOptions(List.of(), null, "normal", DEFAULT_STAR_THRESHOLD, "");
  }

  /**
   * Returns the explicitly requested alignment type.
   *
   * @return requested type, or empty when the router should infer it
   */
  public Optional<AlignmentType> requestedType() {
    return Optional.ofNullable(type);
  }

  @Override
  public JobType jobType() {
    return JobType.ALIGN;
  }

  @Override
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("images", images.stream().map(Path::toString).toList());
    map.put("type", type == null ? "" : type.wireName());
    map.put("quality", quality);
    map.put("starThreshold", starThreshold);
    map.put("processor", processor);
    return map;
  }
}
