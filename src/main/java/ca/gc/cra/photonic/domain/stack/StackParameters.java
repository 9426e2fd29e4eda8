package ca.gc.cra.photonic.domain.stack;

/**
 * Tuning for the statistical stacking methods. Non-positive values fall back to the defaults.
 *
 * @param sigmaLow lower clipping bound in standard deviations (default 2.0)
 * @param sigmaHigh upper clipping bound in standard deviations (default 2.0)
 * @param iterations maximum clipping passes (default 3)
 * @param kappa kappa-sigma factor; bounds become {@code 1.5k} and {@code 2.0k} (default 1.5)
 * @param winsorPercent order statistic used by winsorized stacking, in percent (default 5.0)
 * @param percentile fraction used by percentile stacking, in {@code (0, 1]} (default 0.5)
 * @since 0.1.0
 */
public record StackParameters(
    double sigmaLow,
    double sigmaHigh,
    int iterations,
    double kappa,
    double winsorPercent,
    double percentile) {
  public static final double DEFAULT_SIGMA = 2.0d;
  public static final int DEFAULT_ITERATIONS = 3;
  public static final double DEFAULT_KAPPA = 1.5d;
  public static final double DEFAULT_WINSOR_PERCENT = 5.0d;
  public static final double DEFAULT_PERCENTILE = 0.5d;

  public StackParameters {
    sigmaLow = sigmaLow > 0d ? sigmaLow : DEFAULT_SIGMA;
    sigmaHigh = sigmaHigh > 0d ? sigmaHigh : DEFAULT_SIGMA;
    iterations = iterations > 0 ? iterations : DEFAULT_ITERATIONS;
    kappa = kappa > 0d ? kappa : DEFAULT_KAPPA;
    winsorPercent = winsorPercent > 0d ? Math.min(winsorPercent, 100d) : DEFAULT_WINSOR_PERCENT;
    percentile = percentile > 0d ? Math.min(percentile, 1d) : DEFAULT_PERCENTILE;
  }

  public static StackParameters defaults() {
    return new StackParameters(
        DEFAULT_SIGMA, DEFAULT_SIGMA, DEFAULT_ITERATIONS, DEFAULT_KAPPA, DEFAULT_WINSOR_PERCENT, DEFAULT_PERCENTILE);
  }

  /**
   * Returns sigma-clip parameters with explicit bounds and iteration count.
   *
   * @param sigmaLow lower bound in standard deviations
   * @param sigmaHigh upper bound in standard deviations
   * @param iterations maximum passes
   * @return parameters with the remaining fields at their defaults
   */
  public static StackParameters sigmaClip(double sigmaLow, double sigmaHigh, int iterations) {
    return new StackParameters(
        sigmaLow, sigmaHigh, iterations, DEFAULT_KAPPA, DEFAULT_WINSOR_PERCENT, DEFAULT_PERCENTILE);
  }

  public double kappaSigmaLow() {
    return kappa * 1.5d;
  }

  public double kappaSigmaHigh() {
    return kappa * 2.0d;
  }
}
