package ca.gc.cra.photonic.config;

import ca.gc.cra.photonic.domain.align.AlignmentType;
import java.util.EnumSet;
import java.util.Set;

/**
 * Alignment settings.
 *
 * @param defaultProcessor processor preferred when a job names none; blank or {@code auto} for none
 * @param astroEnabled registers the native star aligner
 * @param panoramicEnabled allows panoramic alignment through {@code align_image_stack}
 * @param generalEnabled allows general alignment through {@code align_image_stack}
 * @param timelapseEnabled allows timelapse alignment through {@code align_image_stack}
 * @since 0.1.0
 */
public record AlignmentConfig(
    String defaultProcessor,
    boolean astroEnabled,
    boolean panoramicEnabled,
    boolean generalEnabled,
    boolean timelapseEnabled) {

  public AlignmentConfig {
    defaultProcessor = defaultProcessor == null ? "" : defaultProcessor.trim();
  }

  /** @return every alignment type enabled, no default processor */
  public static AlignmentConfig defaults() {
    return new AlignmentConfig("", true, true, true, true);
  }

  /** @return the non-astro alignment types handed to the Hugin aligner */
  public Set<AlignmentType> externalTypes() {
    Set<AlignmentType> types = EnumSet.noneOf(AlignmentType.class);
    if (panoramicEnabled) {
      types.add(AlignmentType.PANORAMIC);
    }
    if (generalEnabled) {
      types.add(AlignmentType.GENERAL);
    }
    if (timelapseEnabled) {
      types.add(AlignmentType.TIMELAPSE);
    }
    return types;
  }
}
