package ca.gc.cra.photonic.application.stack;

import ca.gc.cra.photonic.domain.image.PixelBuffer;
import java.util.Arrays;

/**
 * <strong>What:</strong> Scalar statistics over the N samples that stack into one output pixel.
 * <p><strong>Why:</strong> Keeps the numeric contract in one place: sample (N-1) standard deviation,
 * linearly interpolated percentiles, and inclusive clipping bounds.</p>
 * <p><strong>Thread-safety:</strong> Stateless; methods never modify their input arrays.</p>
 *
 * @since 0.1.0
 * @see StatisticalStackingEngine
 */
public final class PixelStatistics {
  private static final double LUMA_RED = 0.299d;
  private static final double LUMA_GREEN = 0.587d;
  private static final double LUMA_BLUE = 0.114d;

  private PixelStatistics() {
    // Utility
  }

  /**
   * Result of iterative clipping for one pixel.
   *
   * @param value mean of the surviving samples, or of all samples when every one was clipped
   * @param rejected number of samples dropped across all iterations
   */
  public record ClipOutcome(double value, int rejected) {}

  /**
   * Arithmetic mean of the first {@code count} values.
   *
   * @param values samples
   * @param count number of samples to use
   * @return mean, or {@code 0} when {@code count} is zero
   */
  public static double mean(double[] values, int count) {
    if (count <= 0) {
      return 0d;
    }
    double sum = 0d;
    for (int i = 0; i < count; i++) {
      sum += values[i];
    }
    return sum / count;
  }

  /**
   * Sample standard deviation (N-1 denominator) of the first {@code count} values.
   *
   * @param values samples
   * @param count number of samples to use
   * @param mean precomputed mean of those samples
   * @return standard deviation, or {@code 0} when fewer than two samples are given
   */
  public static double sampleStdDev(double[] values, int count, double mean) {
    if (count < 2) {
      return 0d;
    }
    double sumSquares = 0d;
    for (int i = 0; i < count; i++) {
      double delta = values[i] - mean;
      sumSquares += delta * delta;
    }
    return Math.sqrt(sumSquares / (count - 1));
  }

  /**
   * Linearly interpolated order statistic at fraction {@code p} of the sorted values.
   *
   * <p>The rank is {@code p * (n - 1)}; e.g. {@code percentile([1, 2, 3, 4], 0.5) == 2.5}.
   *
   * @param values samples; not modified
   * @param p fraction in {@code [0, 1]}; values outside are clamped
   * @return interpolated value, or {@code 0} for an empty array
   */
  public static double percentile(double[] values, double p) {
    if (values.length == 0) {
      return 0d;
    }
    double[] sorted = values.clone();
    Arrays.sort(sorted);
    return percentileOfSorted(sorted, p);
  }

  static double percentileOfSorted(double[] sorted, double p) {
    int n = sorted.length;
    if (n == 1) {
      return sorted[0];
    }
    double clamped = Math.max(0d, Math.min(1d, p));
    double rank = clamped * (n - 1);
    int lower = (int) Math.floor(rank);
    int upper = (int) Math.ceil(rank);
    if (lower == upper) {
      return sorted[lower];
    }
    double weight = rank - lower;
    return sorted[lower] * (1d - weight) + sorted[upper] * weight;
  }

  /**
   * Iterative sigma clipping.
   *
   * <p>Each iteration computes the mean and sample standard deviation of the active samples and drops
   * those outside {@code [mean - sigmaLow * sd, mean + sigmaHigh * sd]} (bounds inclusive). Iteration
   * stops early when the deviation is zero, nothing was dropped, or at most one sample remains.
   *
   * @param values samples; not modified
   * @param sigmaLow lower bound multiplier
   * @param sigmaHigh upper bound multiplier
   * @param iterations maximum number of passes
   * @return surviving mean and rejected count
   */
  public static ClipOutcome sigmaClip(double[] values, double sigmaLow, double sigmaHigh, int iterations) {
    int n = values.length;
    if (n == 0) {
      return new ClipOutcome(0d, 0);
    }
    double originalMean = mean(values, n);
    double[] active = values.clone();
    int activeCount = n;
    int rejected = 0;
    for (int iter = 0; iter < iterations && activeCount > 1; iter++) {
      double mean = mean(active, activeCount);
      double sd = sampleStdDev(active, activeCount, mean);
      if (sd == 0d) {
        break;
      }
      double low = mean - sigmaLow * sd;
      double high = mean + sigmaHigh * sd;
      int kept = 0;
      for (int i = 0; i < activeCount; i++) {
        double v = active[i];
        if (v >= low && v <= high) {
          active[kept++] = v;
        }
      }
      int dropped = activeCount - kept;
      rejected += dropped;
      activeCount = kept;
      if (dropped == 0) {
        break;
      }
    }
    if (activeCount == 0) {
      return new ClipOutcome(originalMean, rejected);
    }
    return new ClipOutcome(mean(active, activeCount), rejected);
  }

  /**
   * Converts a buffer to single-channel luminance (Rec. 601 weights for colour, identity for grey).
   *
   * @param image source pixels
   * @return one value per pixel, row-major
   */
  public static float[] luminance(PixelBuffer image) {
    int pixels = image.pixelCount();
    int channels = image.channels();
    float[] luma = new float[pixels];
    for (int p = 0; p < pixels; p++) {
      int base = p * channels;
      if (channels >= 3) {
        luma[p] =
            (float)
                (LUMA_RED * image.sample(base)
                    + LUMA_GREEN * image.sample(base + 1)
                    + LUMA_BLUE * image.sample(base + 2));
      } else {
        luma[p] = image.sample(base);
      }
    }
    return luma;
  }

  /**
   * Signal-to-noise estimate of an image: mean luminance over its population standard deviation.
   *
   * @param image stacked output
   * @return ratio, or {@code 0} for a flat image
   */
  public static double signalToNoise(PixelBuffer image) {
    float[] luma = luminance(image);
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
    double sd = Math.sqrt(sumSquares / luma.length);
    return sd == 0d ? 0d : mean / sd;
  }
}
