package ca.gc.cra.photonic.domain.media;

import java.nio.file.Path;
import java.util.List;

/**
 * @param outputs one file per successfully encoded format
 * @param frameCount frames encoded
 * @param failedFormats formats that could not be encoded
 */
public record TimelapseResult(List<Path> outputs, int frameCount, List<String> failedFormats) {
  public TimelapseResult {
    outputs = List.copyOf(outputs);
    failedFormats = failedFormats == null ? List.of() : List.copyOf(failedFormats);
  }
}
