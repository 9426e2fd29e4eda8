package ca.gc.cra.photonic.application.port;

import ca.gc.cra.photonic.domain.error.JobCancelledException;
import java.io.IOException;

/**
 * <strong>What:</strong> Port for running external executables (RAW decoders, Hugin, ffmpeg, enfuse).
 * <p><strong>Why:</strong> Processors build argument lists; this port owns process lifetime so a pipeline
 * shutdown can terminate every running subprocess.</p>
 * <p><strong>Thread-safety:</strong> Implementations must support concurrent invocations from workers.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.photonic.infrastructure.exec.ProcessToolRunner
 */
public interface ToolRunner {
  /**
   * Runs a command to completion. A non-zero exit status is reported in the outcome, not thrown.
   *
   * @param command command to run
   * @param context cancellation signal; the process is destroyed when it flips
   * @return exit status and output
   * @throws IOException when the process cannot be started
   * @throws JobCancelledException when the context was cancelled or the thread interrupted
   */
  ToolOutcome run(ToolCommand command, JobContext context) throws IOException, JobCancelledException;

  /**
   * Reports whether an executable can be found.
   *
   * @param executable bare executable name
   * @return {@code true} when it is on the search path
   */
  boolean isInstalled(String executable);
}
