package ca.gc.cra.photonic.domain.image;

/**
 * Pure translation of a frame relative to the reference frame.
 *
 * @param dx horizontal displacement in pixels (positive is right)
 * @param dy vertical displacement in pixels (positive is down)
 * @since 0.1.0
 */
public record Translation(double dx, double dy) {
  public static final Translation ZERO = new Translation(0d, 0d);

  /**
   * Returns the translation that undoes this one.
   *
   * @return negated translation
   */
  public Translation inverse() {
    return new Translation(-dx, -dy);
  }
}
