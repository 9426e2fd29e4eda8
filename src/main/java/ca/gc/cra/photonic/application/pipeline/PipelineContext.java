package ca.gc.cra.photonic.application.pipeline;

import ca.gc.cra.photonic.application.port.JobContext;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pipeline-wide cancellation flag handed to every job.
 *
 * @since 0.1.0
 */
public final class PipelineContext implements JobContext {
  private final AtomicBoolean cancelled = new AtomicBoolean();

  /** Requests cancellation of all running work. Idempotent. */
  public void cancel() {
    cancelled.set(true);
  }

  @Override
  public boolean isCancelled() {
    return cancelled.get();
  }
}
