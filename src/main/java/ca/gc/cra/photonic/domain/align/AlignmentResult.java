package ca.gc.cra.photonic.domain.align;

import ca.gc.cra.photonic.domain.image.Translation;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Diagnostics from one alignment call.
 *
 * @param success whether at least one frame besides the reference was aligned
 * @param tool processor name
 * @param alignedImages written frames, reference first
 * @param translations applied translation per input frame (star aligner only)
 * @param referenceStars stars detected in the reference frame
 * @param matchedStars matches summed over aligned frames
 * @param elapsed wall time spent aligning
 * @param warnings per-frame issues that did not abort the run
 * @since 0.1.0
 */
public record AlignmentResult(
    boolean success,
    String tool,
    List<Path> alignedImages,
    Map<Path, Translation> translations,
    int referenceStars,
    int matchedStars,
    Duration elapsed,
    List<String> warnings) {
  public AlignmentResult {
    alignedImages = alignedImages == null ? List.of() : List.copyOf(alignedImages);
    translations =
        translations == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(translations));
    elapsed = elapsed == null ? Duration.ZERO : elapsed;
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }
}
