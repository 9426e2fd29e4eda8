package ca.gc.cra.photonic.domain.job;

import java.util.Map;

/**
 * Typed options carried by a {@link Job}; exactly one variant exists per {@link JobType}.
 * <p>Variants normalize absent or non-positive values to their documented defaults in their
 * compact constructors, so handlers never re-apply defaults.</p>
 *
 * @since 0.1.0
 */
public sealed interface JobOptions
    permits ScanOptions,
        TimelapseOptions,
        PanoramicOptions,
        StackOptions,
        AlignOptions,
        RawConvertOptions {

  /**
   * Returns the job type these options belong to.
   *
   * @return owning job type
   */
  JobType jobType();

  /**
   * Renders the options as an ordered map of JSON-friendly values for journals and logs.
   *
   * @return insertion-ordered map; values are strings, numbers, booleans, or lists of those
   */
  Map<String, Object> toMap();

  /**
   * Returns default options for the given job type.
   *
   * @param type job type
   * @return defaults for that type
   */
  static JobOptions defaultsFor(JobType type) {
    return switch (type) {
      case SCAN -> ScanOptions.defaults();
      case TIMELAPSE -> TimelapseOptions.defaults();
      case PANORAMIC -> PanoramicOptions.defaults();
      case STACK -> StackOptions.defaults();
      case ALIGN -> AlignOptions.defaults();
      case RAW_CONVERT -> RawConvertOptions.defaults();
    };
  }
}
