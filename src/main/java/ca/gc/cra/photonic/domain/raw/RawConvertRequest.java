package ca.gc.cra.photonic.domain.raw;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Request to convert one RAW file.
 *
 * @param input RAW file
 * @param output converted file; its extension selects the format
 * @param quality lossy output quality in {@code [1, 100]}
 * @since 0.1.0
 */
public record RawConvertRequest(Path input, Path output, int quality) {
  public RawConvertRequest {
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(output, "output");
    if (quality <= 0 || quality > 100) {
      quality = 90;
    }
  }
}
