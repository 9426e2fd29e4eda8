package ca.gc.cra.photonic.domain.align;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Request handed to an alignment processor. The first image is the reference.
 *
 * @param images frames in sequence order
 * @param outputDirectory directory receiving aligned frames
 * @param type requested alignment type
 * @param quality quality preset ({@code fast}, {@code normal}, {@code high}, {@code ultra})
 * @param starThreshold detection sensitivity for star-based aligners
 * @since 0.1.0
 */
public record AlignmentRequest(
    List<Path> images, Path outputDirectory, AlignmentType type, String quality, double starThreshold) {
  public AlignmentRequest {
    images = List.copyOf(Objects.requireNonNull(images, "images"));
    Objects.requireNonNull(outputDirectory, "outputDirectory");
    Objects.requireNonNull(type, "type");
    quality = quality == null || quality.isBlank() ? "normal" : quality;
  }
}
