package ca.gc.cra.photonic.application.align;

import ca.gc.cra.photonic.domain.image.PixelBuffer;

/**
 * Cyclic pixel roll: content shifted past one edge re-enters at the opposite edge.
 *
 * @since 0.1.0
 */
public final class ImageShifter {
  private ImageShifter() {
    // Utility
  }

  /**
   * Rolls {@code image} by whole pixels.
   *
   * @param image source; not modified
   * @param dx horizontal shift, positive to the right
   * @param dy vertical shift, positive downwards
   * @return new shifted buffer
   */
  public static PixelBuffer roll(PixelBuffer image, int dx, int dy) {
    int width = image.width();
    int height = image.height();
    int channels = image.channels();
    float[] out = new float[image.sampleCount()];
    int shiftX = Math.floorMod(dx, width);
    int shiftY = Math.floorMod(dy, height);
    for (int y = 0; y < height; y++) {
      int targetY = (y + shiftY) % height;
      for (int x = 0; x < width; x++) {
        int targetX = (x + shiftX) % width;
        int src = (y * width + x) * channels;
        int dst = (targetY * width + targetX) * channels;
        for (int c = 0; c < channels; c++) {
          out[dst + c] = image.sample(src + c);
        }
      }
    }
    return new PixelBuffer(width, height, channels, out);
  }
}
