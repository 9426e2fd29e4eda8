package ca.gc.cra.photonic.domain.job;

import java.util.Locale;

/**
 * Kinds of work the pipeline routes to a handler.
 *
 * @since 0.1.0
 */
public enum JobType {
  /** Walk a directory and report related image groups. */
  SCAN("scan"),
  /** Encode an image sequence into one or more videos. */
  TIMELAPSE("timelapse"),
  /** Stitch overlapping frames into a panorama. */
  PANORAMIC("panoramic"),
  /** Combine aligned frames into a single noise-reduced image. */
  STACK("stack"),
  /** Register a sequence of frames against a reference. */
  ALIGN("align"),
  /** Convert RAW camera files to a display format. */
  RAW_CONVERT("raw-convert");

  private final String wireName;

  JobType(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Returns the lowercase name used on the command line and in persisted records.
   *
   * @return wire name such as {@code raw-convert}
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Resolves a wire name (case-insensitive; underscores accepted in place of hyphens).
   *
   * @param raw candidate name
   * @return matching job type
   * @throws IllegalArgumentException when no job type matches
   */
  public static JobType fromWireName(String raw) {
    if (raw != null) {
      String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
      for (JobType type : values()) {
        if (type.wireName.equals(normalized)) {
          return type;
        }
      }
    }
    throw new IllegalArgumentException("unknown job type: " + raw);
  }

  @Override
  public String toString() {
    return wireName;
  }
}
