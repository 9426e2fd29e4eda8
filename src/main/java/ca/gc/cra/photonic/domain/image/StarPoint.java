package ca.gc.cra.photonic.domain.image;

/**
 * Detected star: intensity-weighted blob centroid.
 *
 * @param x centroid column
 * @param y centroid row
 * @param intensity summed luminance of the blob
 * @param pixelCount blob area in pixels
 * @since 0.1.0
 */
public record StarPoint(double x, double y, double intensity, int pixelCount) {

  public StarPoint(double x, double y, double intensity) {
    this(x, y, intensity, 1);
  }

  public double distanceTo(StarPoint other) {
    return Math.hypot(other.x - x, other.y - y);
  }
}
