package ca.gc.cra.photonic.application.align;

import ca.gc.cra.photonic.application.stack.PixelStatistics;
import ca.gc.cra.photonic.domain.image.PixelBuffer;
import ca.gc.cra.photonic.domain.image.StarPoint;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Finds point sources (stars) in an image.
 * <p><strong>Why:</strong> Star positions are stable features across an astro sequence; their centroids
 * give sub-pixel reference points for translation estimation without general feature matching.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Threshold luminance at {@code clamp(mean + k * stddev, 0, 1)}.</li>
 *   <li>Open the mask with a 3x3 cross to remove isolated noise pixels.</li>
 *   <li>Extract 4-connected blobs within the configured size band and weight their centroids by
 *       luminance.</li>
 *   <li>Return the brightest blobs first, capped at {@code maxStars}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; each call allocates its own mask.</p>
 *
 * @since 0.1.0
 */
public final class StarDetector {

  /**
   * Detection tuning.
   *
   * @param sensitivity standard deviations above the mean a pixel must exceed
   * @param minBlobPixels smallest blob accepted as a star
   * @param maxBlobPixels largest blob accepted; larger blobs are saturated regions or nebulosity
   * @param maxStars cap on returned stars
   */
  public record DetectionSettings(double sensitivity, int minBlobPixels, int maxBlobPixels, int maxStars) {
    public static final int DEFAULT_MIN_BLOB = 2;
    public static final int DEFAULT_MAX_BLOB = 1000;
    public static final int DEFAULT_MAX_STARS = 100;

    public DetectionSettings {
      if (!Double.isFinite(sensitivity)) {
        throw new IllegalArgumentException("sensitivity must be finite");
      }
      if (minBlobPixels < 1 || maxBlobPixels < minBlobPixels) {
        throw new IllegalArgumentException(
            "blob size band is invalid: " + minBlobPixels + ".." + maxBlobPixels);
      }
      if (maxStars < 1) {
        throw new IllegalArgumentException("maxStars must be positive");
      }
    }

    /**
     * Default size band and cap with the given sensitivity.
     *
     * @param sensitivity standard deviations above the mean
     * @return settings
     */
    public static DetectionSettings withSensitivity(double sensitivity) {
      return new DetectionSettings(sensitivity, DEFAULT_MIN_BLOB, DEFAULT_MAX_BLOB, DEFAULT_MAX_STARS);
    }
  }

  private final DetectionSettings settings;

  /**
   * Creates a detector.
   *
   * @param settings detection tuning
   */
  public StarDetector(DetectionSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /** @return detection tuning */
  public DetectionSettings settings() {
    return settings;
  }

  /**
   * Detects stars in {@code image}.
   *
   * @param image source pixels; not modified
   * @return stars sorted by descending intensity, at most {@code maxStars}
   */
  public List<StarPoint> detect(PixelBuffer image) {
    int width = image.width();
    int height = image.height();
    float[] luma = PixelStatistics.luminance(image);
    double threshold = threshold(luma);

    boolean[] mask = new boolean[luma.length];
    for (int i = 0; i < luma.length; i++) {
      mask[i] = luma[i] > threshold;
    }
    boolean[] opened = dilate(erode(mask, width, height), width, height);

    List<StarPoint> stars = new ArrayList<>();
    boolean[] visited = new boolean[opened.length];
    int[] stack = new int[Math.max(16, opened.length)];
    for (int start = 0; start < opened.length; start++) {
      if (!opened[start] || visited[start]) {
        continue;
      }
      // explicit work-list flood fill; recursion would overflow on large bright regions
      int top = 0;
      stack[top++] = start;
      visited[start] = true;
      int count = 0;
      double sumX = 0d;
      double sumY = 0d;
      double sumWeight = 0d;
      while (top > 0) {
        int idx = stack[--top];
        int x = idx % width;
        int y = idx / width;
        double weight = luma[idx];
        count++;
        sumX += x * weight;
        sumY += y * weight;
        sumWeight += weight;
        top = push(stack, top, opened, visited, x + 1, y, width, height);
        top = push(stack, top, opened, visited, x - 1, y, width, height);
        top = push(stack, top, opened, visited, x, y + 1, width, height);
        top = push(stack, top, opened, visited, x, y - 1, width, height);
      }
      if (count < settings.minBlobPixels() || count > settings.maxBlobPixels() || sumWeight <= 0d) {
        continue;
      }
      stars.add(new StarPoint(sumX / sumWeight, sumY / sumWeight, sumWeight, count));
    }

    stars.sort(Comparator.comparingDouble(StarPoint::intensity).reversed());
    if (stars.size() > settings.maxStars()) {
      return List.copyOf(stars.subList(0, settings.maxStars()));
    }
    return List.copyOf(stars);
  }

  double threshold(float[] luma) {
    double sum = 0d;
    for (float v : luma) {
      sum += v;
    }
    double mean = sum / luma.length;
    double sumSquares = 0d;
    for (float v : luma) {
      double delta = v - mean;
      sumSquares += delta * delta;
    }
    double stddev = Math.sqrt(sumSquares / luma.length);
    return Math.max(0d, Math.min(1d, mean + settings.sensitivity() * stddev));
  }

  private static int push(
      int[] stack, int top, boolean[] mask, boolean[] visited, int x, int y, int width, int height) {
    if (x < 0 || y < 0 || x >= width || y >= height) {
      return top;
    }
    int idx = y * width + x;
    if (!mask[idx] || visited[idx]) {
      return top;
    }
    visited[idx] = true;
    stack[top] = idx;
    return top + 1;
  }

  // Cross-shaped structuring element; pixels outside the image count as background.
  static boolean[] erode(boolean[] mask, int width, int height) {
    boolean[] out = new boolean[mask.length];
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        int idx = y * width + x;
        out[idx] =
            mask[idx]
                && x > 0 && mask[idx - 1]
                && x < width - 1 && mask[idx + 1]
                && y > 0 && mask[idx - width]
                && y < height - 1 && mask[idx + width];
      }
    }
    return out;
  }

  static boolean[] dilate(boolean[] mask, int width, int height) {
    boolean[] out = new boolean[mask.length];
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        int idx = y * width + x;
        out[idx] =
            mask[idx]
                || (x > 0 && mask[idx - 1])
                || (x < width - 1 && mask[idx + 1])
                || (y > 0 && mask[idx - width])
                || (y < height - 1 && mask[idx + width]);
      }
    }
    return out;
  }
}
