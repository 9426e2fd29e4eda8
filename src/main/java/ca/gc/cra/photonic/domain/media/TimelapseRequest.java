package ca.gc.cra.photonic.domain.media;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * @param frames frames in playback order
 * @param output output file; its base name is reused for every format
 * @param fps frame rate
 * @param formats requested output formats
 * @param resolution optional scale preset
 */
public record TimelapseRequest(
    List<Path> frames, Path output, int fps, List<String> formats, String resolution) {
  public TimelapseRequest {
    frames = List.copyOf(Objects.requireNonNull(frames, "frames"));
    Objects.requireNonNull(output, "output");
    formats = formats == null || formats.isEmpty() ? List.of("mp4") : List.copyOf(formats);
    resolution = resolution == null ? "" : resolution;
  }
}
