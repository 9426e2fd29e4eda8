package ca.gc.cra.photonic.domain.media;

import java.nio.file.Path;
import java.util.List;

/**
 * @param output stitched file
 * @param imageCount frames stitched
 * @param tool final rendering tool ({@code hugin_executor} or {@code nona+enblend})
 * @param warnings optional stages that were skipped
 */
public record PanoramaResult(Path output, int imageCount, String tool, List<String> warnings) {
  public PanoramaResult {
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }
}
