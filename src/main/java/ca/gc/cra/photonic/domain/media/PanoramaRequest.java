package ca.gc.cra.photonic.domain.media;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * @param images overlapping frames
 * @param output stitched output file
 * @param projection output projection
 * @param blending seam blending mode
 * @param quality interpolation quality preset
 * @param aggression control-point cleaning strength
 */
public record PanoramaRequest(
    List<Path> images,
    Path output,
    String projection,
    String blending,
    String quality,
    String aggression) {
  public PanoramaRequest {
    images = List.copyOf(Objects.requireNonNull(images, "images"));
    Objects.requireNonNull(output, "output");
  }
}
