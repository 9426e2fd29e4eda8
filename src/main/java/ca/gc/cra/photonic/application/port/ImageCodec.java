package ca.gc.cra.photonic.application.port;

import ca.gc.cra.photonic.domain.image.ImageFormat;
import ca.gc.cra.photonic.domain.image.PixelBuffer;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Decodes image files into {@link PixelBuffer}s and encodes buffers back to disk.
 *
 * @since 0.1.0
 * @see ca.gc.cra.photonic.infrastructure.image.ImageIoCodec
 */
public interface ImageCodec {
  /**
   * Reads an image file into a normalized float buffer.
   *
   * @param file image to decode
   * @return decoded pixels with samples in {@code [0, 1]}
   * @throws IOException when the file is missing, unreadable, or in an unsupported format
   */
  PixelBuffer read(Path file) throws IOException;

  /**
   * Writes a buffer to {@code file}, replacing any existing file.
   *
   * @param image pixels to encode; samples outside {@code [0, 1]} are clamped
   * @param file destination
   * @param format container and bit depth
   * @throws IOException when encoding or writing fails
   */
  void write(PixelBuffer image, Path file, ImageFormat format) throws IOException;
}
