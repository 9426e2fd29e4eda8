package ca.gc.cra.photonic.domain.raw;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Outcome of one RAW conversion attempt.
 *
 * @param success whether the output file was produced
 * @param tool converter name
 * @param input RAW file
 * @param output converted file
 * @param processingLog captured tool output, possibly empty
 * @param elapsed wall time of the attempt
 * @since 0.1.0
 */
public record RawConvertResult(
    boolean success, String tool, Path input, Path output, String processingLog, Duration elapsed) {
  public RawConvertResult {
    processingLog = processingLog == null ? "" : processingLog;
    elapsed = elapsed == null ? Duration.ZERO : elapsed;
  }
}
