package ca.gc.cra.photonic.application.pipeline;

import ca.gc.cra.photonic.domain.job.JobId;
import java.util.Objects;

/**
 * Synchronous submission failure; the job was not queued.
 *
 * @since 0.1.0
 */
public final class JobRejectedException extends Exception {
  private static final long serialVersionUID = 1L;

  /** Why a job was turned away. */
  public enum Reason {
    /** Every queue slot is taken; retry later. */
    QUEUE_FULL,
    /** The pipeline is stopped or was never started. */
    STOPPED,
    /** A job with the same ID is queued or running. */
    DUPLICATE_ID
  }

  private final transient JobId jobId;
  private final Reason reason;

  /**
   * Creates the exception.
   *
   * @param jobId rejected job
   * @param reason cause
   * @param message detail
   */
  public JobRejectedException(JobId jobId, Reason reason, String message) {
    super(message);
    this.jobId = Objects.requireNonNull(jobId, "jobId");
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  /** @return rejected job ID */
  public JobId jobId() {
    return jobId;
  }

  /** @return rejection cause */
  public Reason reason() {
    return reason;
  }
}
