package ca.gc.cra.photonic.application.port;

import java.time.Duration;

/**
 * Exit status and captured output of one external command.
 *
 * @param exitCode process exit code
 * @param output combined stdout/stderr (stderr only when stdout was redirected to a file)
 * @param elapsed wall time
 * @since 0.1.0
 */
public record ToolOutcome(int exitCode, String output, Duration elapsed) {
  public ToolOutcome {
    output = output == null ? "" : output;
    elapsed = elapsed == null ? Duration.ZERO : elapsed;
  }

  /** @return {@code true} when the process exited with status 0 */
  public boolean succeeded() {
    return exitCode == 0;
  }
}
