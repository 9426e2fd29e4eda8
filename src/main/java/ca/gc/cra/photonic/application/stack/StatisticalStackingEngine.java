package ca.gc.cra.photonic.application.stack;

import ca.gc.cra.photonic.application.port.JobContext;
import ca.gc.cra.photonic.domain.error.InsufficientDataException;
import ca.gc.cra.photonic.domain.error.JobCancelledException;
import ca.gc.cra.photonic.domain.image.PixelBuffer;
import ca.gc.cra.photonic.domain.stack.StackMethod;
import ca.gc.cra.photonic.domain.stack.StackOutcome;
import ca.gc.cra.photonic.domain.stack.StackParameters;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Aggregates N aligned images sample-by-sample into one new image.
 * <p><strong>Why:</strong> Averaging suppresses sensor noise; clipping and order statistics additionally
 * reject cosmic rays, satellites, and hot pixels that a plain mean would smear into the result.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Validate that every input shares the first image's dimensions and channel count.</li>
 *   <li>Apply the chosen estimator independently to each pixel channel.</li>
 *   <li>Count clipped samples across all pixels, channels, and iterations.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; each call allocates its own scratch arrays and output.</p>
 * <p><strong>Performance:</strong> O(samples x N) for mean/min/max; percentile methods sort N values per
 * sample.</p>
 *
 * @since 0.1.0
 * @see PixelStatistics
 */
public final class StatisticalStackingEngine {
  private static final Logger log = LoggerFactory.getLogger(StatisticalStackingEngine.class);

  /** Samples combined between two cancellation checks. */
  static final int CANCEL_CHECK_INTERVAL = 1 << 16;

  /**
   * Stacks {@code images} with {@code method}.
   *
   * @param images inputs; never modified
   * @param method estimator; {@link StackMethod#HDR} is not a statistical method and is rejected
   * @param parameters clipping and percentile settings
   * @return new image and rejected-sample count
   * @throws InsufficientDataException when {@code images} is empty
   * @throws IllegalArgumentException when shapes differ or the method is unsupported
   */
  public StackOutcome stack(List<PixelBuffer> images, StackMethod method, StackParameters parameters)
      throws InsufficientDataException {
    try {
      return stack(images, method, parameters, JobContext.NONE);
    } catch (JobCancelledException ex) {
      throw new IllegalStateException("uncancellable stack was cancelled", ex);
    }
  }

  /**
   * Stacks {@code images} with {@code method}, checking {@code context} every
   * {@value #CANCEL_CHECK_INTERVAL} samples so a shutdown does not wait for a full-resolution pass.
   *
   * @throws JobCancelledException when {@code context} is cancelled mid-stack
   * @see #stack(List, StackMethod, StackParameters)
   */
  public StackOutcome stack(
      List<PixelBuffer> images, StackMethod method, StackParameters parameters, JobContext context)
      throws InsufficientDataException, JobCancelledException {
    Objects.requireNonNull(context, "context");
    Objects.requireNonNull(images, "images");
    Objects.requireNonNull(method, "method");
    StackParameters params = Objects.requireNonNullElse(parameters, StackParameters.defaults());
    if (images.isEmpty()) {
      throw new InsufficientDataException("no images to stack");
    }
    PixelBuffer first = images.get(0);
    if (images.size() == 1) {
      return new StackOutcome(first.copy(), 0L);
    }
    for (int i = 1; i < images.size(); i++) {
      PixelBuffer other = images.get(i);
      if (!first.sameShape(other)) {
        throw new IllegalArgumentException(
            "image " + i + " is " + other.width() + "x" + other.height() + "x" + other.channels()
                + ", expected " + first.width() + "x" + first.height() + "x" + first.channels());
      }
    }

    int n = images.size();
    int sampleCount = first.sampleCount();
    float[] out = new float[sampleCount];
    double[] column = new double[n];
    long rejected = 0L;

    for (int s = 0; s < sampleCount; s++) {
      if (s % CANCEL_CHECK_INTERVAL == 0) {
        context.throwIfCancelled();
      }
      for (int k = 0; k < n; k++) {
        column[k] = images.get(k).sample(s);
      }
      double value;
      switch (method) {
        case MEAN, AVERAGE, ASTRO -> value = PixelStatistics.mean(column, n);
        case MEDIAN -> value = sortedPercentile(column, 0.5d);
        case PERCENTILE -> value = sortedPercentile(column, params.percentile());
        case WINSORIZED -> value = sortedPercentile(column, params.winsorPercent() / 100d);
        case SIGMA_CLIP -> {
          PixelStatistics.ClipOutcome clip =
              PixelStatistics.sigmaClip(column, params.sigmaLow(), params.sigmaHigh(), params.iterations());
          value = clip.value();
          rejected += clip.rejected();
        }
        case KAPPA_SIGMA -> {
          PixelStatistics.ClipOutcome clip =
              PixelStatistics.sigmaClip(
                  column, params.kappaSigmaLow(), params.kappaSigmaHigh(), params.iterations());
          value = clip.value();
          rejected += clip.rejected();
        }
        case MAX -> value = extreme(column, true);
        case MIN -> value = extreme(column, false);
        default -> throw new IllegalArgumentException(
            "stacking method " + method + " is not a statistical method");
      }
      out[s] = (float) value;
    }

    log.debug("Stacked {} images with {} ({} samples, {} rejected)", n, method, sampleCount, rejected);
    return new StackOutcome(new PixelBuffer(first.width(), first.height(), first.channels(), out), rejected);
  }

  private static double sortedPercentile(double[] column, double p) {
    double[] sorted = column.clone();
    Arrays.sort(sorted);
    return PixelStatistics.percentileOfSorted(sorted, p);
  }

  private static double extreme(double[] column, boolean max) {
    double result = column[0];
    for (int i = 1; i < column.length; i++) {
      result = max ? Math.max(result, column[i]) : Math.min(result, column[i]);
    }
    return result;
  }
}
