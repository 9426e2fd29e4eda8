package ca.gc.cra.photonic.domain.stack;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Request handed to a stacking processor.
 *
 * @param images aligned input frames
 * @param output output file, or a directory that receives a default file name
 * @param method aggregation method
 * @param parameters method tuning
 * @param astroMode frames are astrophotography
 * @since 0.1.0
 */
public record StackRequest(
    List<Path> images, Path output, StackMethod method, StackParameters parameters, boolean astroMode) {
  public StackRequest {
    images = List.copyOf(Objects.requireNonNull(images, "images"));
    Objects.requireNonNull(output, "output");
    Objects.requireNonNull(method, "method");
    parameters = Objects.requireNonNullElse(parameters, StackParameters.defaults());
  }
}
