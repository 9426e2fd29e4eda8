package ca.gc.cra.photonic.domain.image;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Encodings the pixel codec can write.
 *
 * @since 0.1.0
 */
public enum ImageFormat {
  /** 16-bit per channel TIFF; preserves stacking precision. */
  TIFF16("tif", 16),
  /** 16-bit per channel PNG. */
  PNG16("png", 16),
  /** 8-bit JPEG. */
  JPEG("jpg", 8);

  private final String extension;
  private final int bitsPerChannel;

  ImageFormat(String extension, int bitsPerChannel) {
    this.extension = extension;
    this.bitsPerChannel = bitsPerChannel;
  }

  public String extension() {
    return extension;
  }

  public int bitsPerChannel() {
    return bitsPerChannel;
  }

  /**
   * Infers the format from a file extension, defaulting to {@link #TIFF16}.
   *
   * @param path output path
   * @return matching format
   */
  public static ImageFormat fromPath(Path path) {
    String name = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
    if (name.endsWith(".jpg") || name.endsWith(".jpeg")) {
      return JPEG;
    }
    if (name.endsWith(".png")) {
      return PNG16;
    }
    return TIFF16;
  }
}
