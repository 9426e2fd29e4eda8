package ca.gc.cra.photonic.domain.stack;

import ca.gc.cra.photonic.domain.image.PixelBuffer;
import java.util.Objects;

/**
 * Output of the in-memory stacking engine.
 *
 * @param image newly allocated stacked image
 * @param rejectedPixels samples discarded by clipping, summed over pixels, channels, and passes
 * @since 0.1.0
 */
public record StackOutcome(PixelBuffer image, long rejectedPixels) {
  public StackOutcome {
    Objects.requireNonNull(image, "image");
  }
}
