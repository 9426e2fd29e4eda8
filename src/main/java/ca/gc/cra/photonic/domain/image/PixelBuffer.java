package ca.gc.cra.photonic.domain.image;

import java.util.Arrays;
import java.util.Objects;

/**
 * Dense, row-major image buffer with interleaved channels and samples normalized to {@code [0, 1]}.
 * <p>The buffer takes ownership of the array passed to its constructor and never hands it out again;
 * {@link #samples()} returns a copy. Numeric kernels therefore cannot mutate an input buffer and
 * always build a new one for their output.</p>
 *
 * @since 0.1.0
 */
public final class PixelBuffer {
  private final int width;
  private final int height;
  private final int channels;
  private final float[] samples;

  /**
   * Wraps a sample array.
   *
   * @param width image width in pixels; positive
   * @param height image height in pixels; positive
   * @param channels samples per pixel; 1 (grey) to 4 (RGBA)
   * @param samples {@code width * height * channels} samples; ownership passes to the buffer
   * @throws IllegalArgumentException when the dimensions are invalid or the array length does not match
   */
  public PixelBuffer(int width, int height, int channels, float[] samples) {
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException("image dimensions must be positive (was " + width + "x" + height + ")");
    }
    if (channels < 1 || channels > 4) {
      throw new IllegalArgumentException("channels must be between 1 and 4 (was " + channels + ")");
    }
    Objects.requireNonNull(samples, "samples");
    long expected = (long) width * height * channels;
    if (samples.length != expected) {
      throw new IllegalArgumentException(
          "expected " + expected + " samples for " + width + "x" + height + "x" + channels
              + " (was " + samples.length + ")");
    }
    this.width = width;
    this.height = height;
    this.channels = channels;
    this.samples = samples;
  }

  /**
   * Creates a zero-filled buffer.
   *
   * @param width image width
   * @param height image height
   * @param channels samples per pixel
   * @return blank buffer
   */
  public static PixelBuffer blank(int width, int height, int channels) {
    return new PixelBuffer(width, height, channels, new float[width * height * channels]);
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }

  public int channels() {
    return channels;
  }

  public int pixelCount() {
    return width * height;
  }

  public int sampleCount() {
    return samples.length;
  }

  /**
   * Returns the sample at a flat index.
   *
   * @param index index in {@code [0, sampleCount())}
   * @return sample value
   */
  public float sample(int index) {
    return samples[index];
  }

  /**
   * Returns one channel of one pixel.
   *
   * @param x column
   * @param y row
   * @param channel channel index
   * @return sample value
   */
  public float get(int x, int y, int channel) {
    return samples[(y * width + x) * channels + channel];
  }

  /**
   * Returns a copy of all samples.
   *
   * @return new array in row-major, interleaved order
   */
  public float[] samples() {
    return samples.clone();
  }

  /**
   * Returns an independent copy of this buffer.
   *
   * @return new buffer with identical content
   */
  public PixelBuffer copy() {
    return new PixelBuffer(width, height, channels, samples.clone());
  }

  /**
   * Checks whether another buffer has identical dimensions and channel count.
   *
   * @param other buffer to compare
   * @return {@code true} when the shapes match
   */
  public boolean sameShape(PixelBuffer other) {
    return other != null && other.width == width && other.height == height && other.channels == channels;
  }

  /**
   * Compares sample content.
   *
   * @param other buffer to compare
   * @param tolerance maximum absolute per-sample difference
   * @return {@code true} when shapes match and every sample is within {@code tolerance}
   */
  public boolean contentEquals(PixelBuffer other, double tolerance) {
    if (!sameShape(other)) {
      return false;
    }
    for (int i = 0; i < samples.length; i++) {
      if (Math.abs(samples[i] - other.samples[i]) > tolerance) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PixelBuffer other)) {
      return false;
    }
    return sameShape(other) && Arrays.equals(samples, other.samples);
  }

  @Override
  public int hashCode() {
    return Objects.hash(width, height, channels, Arrays.hashCode(samples));
  }

  @Override
  public String toString() {
    return "PixelBuffer[" + width + "x" + height + "x" + channels + "]";
  }
}
