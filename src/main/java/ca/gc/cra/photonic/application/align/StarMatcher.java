package ca.gc.cra.photonic.application.align;

import ca.gc.cra.photonic.domain.image.StarMatch;
import ca.gc.cra.photonic.domain.image.StarPoint;
import java.util.ArrayList;
import java.util.List;

/**
 * Pairs each reference star with its nearest target star.
 *
 * <p>Matching is greedy per reference star; a target star may serve several references. Reference stars
 * whose nearest target is at or beyond the distance ceiling are dropped.
 *
 * @since 0.1.0
 */
public final class StarMatcher {
  /** Default distance ceiling in pixels. */
  public static final double DEFAULT_MAX_DISTANCE = 50d;

  private final double maxDistance;

  /** Creates a matcher with the default ceiling. */
  public StarMatcher() {
    this(DEFAULT_MAX_DISTANCE);
  }

  /**
   * Creates a matcher.
   *
   * @param maxDistance exclusive distance ceiling in pixels
   */
  public StarMatcher(double maxDistance) {
    if (!(maxDistance > 0d)) {
      throw new IllegalArgumentException("maxDistance must be positive");
    }
    this.maxDistance = maxDistance;
  }

  /**
   * Matches {@code reference} stars against {@code target} stars.
   *
   * @param reference stars detected in the reference frame
   * @param target stars detected in the frame being aligned
   * @return one match per reference star that has a target within the ceiling, in reference order
   */
  public List<StarMatch> match(List<StarPoint> reference, List<StarPoint> target) {
    List<StarMatch> matches = new ArrayList<>();
    for (StarPoint ref : reference) {
      StarPoint best = null;
      double bestDistance = Double.POSITIVE_INFINITY;
      for (StarPoint candidate : target) {
        double distance = ref.distanceTo(candidate);
        if (distance < bestDistance && distance < maxDistance) {
          best = candidate;
          bestDistance = distance;
        }
      }
      if (best != null) {
        matches.add(new StarMatch(ref, best, bestDistance));
      }
    }
    return matches;
  }
}
