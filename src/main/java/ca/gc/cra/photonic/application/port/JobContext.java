package ca.gc.cra.photonic.application.port;

import ca.gc.cra.photonic.domain.error.JobCancelledException;

/**
 * Cancellation signal shared by every job running on one pipeline.
 *
 * <p>There is no per-job cancellation: the pipeline flips a single context when it stops, and
 * long-running work (tool subprocesses, per-image loops) polls it between steps.
 *
 * @since 0.1.0
 */
public interface JobContext {
  /**
   * Reports whether the owning pipeline is shutting down.
   *
   * @return {@code true} once cancellation has been requested
   */
  boolean isCancelled();

  /**
   * Throws when cancellation has been requested.
   *
   * @throws JobCancelledException if {@link #isCancelled()} is {@code true}
   */
  default void throwIfCancelled() throws JobCancelledException {
    if (isCancelled()) {
      throw new JobCancelledException("pipeline is shutting down");
    }
  }

  /** Context that is never cancelled; used by direct callers and tests. */
  JobContext NONE = () -> false;
}
