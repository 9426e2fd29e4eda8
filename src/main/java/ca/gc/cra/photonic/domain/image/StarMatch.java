package ca.gc.cra.photonic.domain.image;

import java.util.Objects;

/**
 * Correspondence between a reference star and its nearest target star.
 *
 * @param reference star in the reference frame
 * @param target star in the frame being aligned
 * @param distance Euclidean distance between the two centroids
 * @since 0.1.0
 */
public record StarMatch(StarPoint reference, StarPoint target, double distance) {

  public StarMatch {
    Objects.requireNonNull(reference, "reference");
    Objects.requireNonNull(target, "target");
  }

  /** Horizontal displacement of the target relative to the reference. */
  public double dx() {
    return target.x() - reference.x();
  }

  /** Vertical displacement of the target relative to the reference. */
  public double dy() {
    return target.y() - reference.y();
  }
}
