package ca.gc.cra.photonic.domain.align;

import java.util.Locale;

/**
 * Capability tag used to pick an alignment processor.
 *
 * @since 0.1.0
 */
public enum AlignmentType {
  ASTRO("astro"),
  PANORAMIC("panoramic"),
  GENERAL("general"),
  TIMELAPSE("timelapse");

  private static final int TIMELAPSE_THRESHOLD = 20;

  private final String wireName;

  AlignmentType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  /**
   * Resolves a type name (case-insensitive).
   *
   * @param raw candidate name
   * @return matching type
   * @throws IllegalArgumentException when nothing matches
   */
  public static AlignmentType fromWireName(String raw) {
    if (raw != null) {
      String normalized = raw.trim().toLowerCase(Locale.ROOT);
      for (AlignmentType type : values()) {
        if (type.wireName.equals(normalized)) {
          return type;
        }
      }
    }
    throw new IllegalArgumentException("unknown alignment type: " + raw);
  }

  /**
   * Guesses a type from the number of frames: none is general, more than twenty is a timelapse,
   * anything else is treated as panoramic.
   *
   * @param imageCount frames to align
   * @return inferred type
   */
  public static AlignmentType infer(int imageCount) {
    if (imageCount <= 0) {
      return GENERAL;
    }
    if (imageCount > TIMELAPSE_THRESHOLD) {
      return TIMELAPSE;
    }
    return PANORAMIC;
  }

  @Override
  public String toString() {
    return wireName;
  }
}
