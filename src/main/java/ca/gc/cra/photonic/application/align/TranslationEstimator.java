package ca.gc.cra.photonic.application.align;

import ca.gc.cra.photonic.domain.error.InsufficientDataException;
import ca.gc.cra.photonic.domain.image.StarMatch;
import ca.gc.cra.photonic.domain.image.Translation;
import java.util.Arrays;
import java.util.List;

/**
 * Estimates the displacement of a target frame from star matches.
 *
 * <p>Each axis takes the median of {@code target - reference} independently; for an even number of
 * matches the upper middle element is used. The median discards mismatched pairs without explicit
 * outlier filtering but recovers translation only.
 *
 * @since 0.1.0
 */
public final class TranslationEstimator {

  /**
   * Computes the target's displacement relative to the reference.
   *
   * @param matches star correspondences
   * @return median per-axis displacement
   * @throws InsufficientDataException when {@code matches} is empty
   */
  public Translation estimate(List<StarMatch> matches) throws InsufficientDataException {
    if (matches.isEmpty()) {
      throw new InsufficientDataException("no star matches to estimate a translation from");
    }
    int n = matches.size();
    double[] dx = new double[n];
    double[] dy = new double[n];
    for (int i = 0; i < n; i++) {
      dx[i] = matches.get(i).dx();
      dy[i] = matches.get(i).dy();
    }
    Arrays.sort(dx);
    Arrays.sort(dy);
    return new Translation(dx[n / 2], dy[n / 2]);
  }
}
