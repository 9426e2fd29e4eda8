package ca.gc.cra.photonic.domain.stack;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Diagnostics from one stacking call.
 *
 * @param success whether an output image was written
 * @param tool processor name
 * @param output written image
 * @param method method actually applied
 * @param imageCount frames combined
 * @param rejectedPixels samples rejected by clipping; zero for non-clipping methods
 * @param signalToNoise mean over standard deviation of the output luminance; zero when unknown
 * @param elapsed wall time spent stacking
 * @param warnings non-fatal issues
 * @since 0.1.0
 */
public record StackResult(
    boolean success,
    String tool,
    Path output,
    StackMethod method,
    int imageCount,
    long rejectedPixels,
    double signalToNoise,
    Duration elapsed,
    List<String> warnings) {
  public StackResult {
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
    elapsed = elapsed == null ? Duration.ZERO : elapsed;
  }

  /**
   * Rough cosmic-ray estimate: one hit per thousand rejected samples.
   *
   * @return estimated cosmic-ray count
   */
  public long cosmicRayEstimate() {
    return rejectedPixels / 1000;
  }
}
