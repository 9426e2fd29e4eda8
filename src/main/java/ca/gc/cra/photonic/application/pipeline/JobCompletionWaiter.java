package ca.gc.cra.photonic.application.pipeline;

import ca.gc.cra.photonic.domain.job.Job;
import ca.gc.cra.photonic.domain.job.JobResult;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Submits a job and waits for its result.
 *
 * <p>Subscribes before submitting so the result cannot be missed, then discards results of other jobs
 * until the matching ID arrives. Results of concurrent jobs arrive in any order.
 *
 * @since 0.1.0
 */
public final class JobCompletionWaiter {
  private static final Duration POLL_SLICE = Duration.ofMillis(250);

  private final JobPipeline pipeline;

  /**
   * Creates a waiter bound to {@code pipeline}.
   *
   * @param pipeline running pipeline
   */
  public JobCompletionWaiter(JobPipeline pipeline) {
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
  }

  /**
   * Submits {@code job} and blocks until its result arrives.
   *
   * @param job job to run
   * @param timeout maximum wait; {@code null} or non-positive waits indefinitely
   * @return the job's result; empty on timeout or when the pipeline stopped first
   * @throws JobRejectedException when the pipeline refuses the job
   * @throws InterruptedException if interrupted while waiting
   */
  public Optional<JobResult> submitAndAwait(Job job, Duration timeout)
      throws JobRejectedException, InterruptedException {
    Objects.requireNonNull(job, "job");
    boolean unbounded = timeout == null || timeout.isZero() || timeout.isNegative();
    long deadline = unbounded ? Long.MAX_VALUE : System.nanoTime() + timeout.toNanos();
    try (ResultSubscription subscription = pipeline.subscribe()) {
      pipeline.submit(job);
      while (true) {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0L) {
          return Optional.empty();
        }
        Duration slice = unbounded ? POLL_SLICE : Duration.ofNanos(Math.min(remaining, POLL_SLICE.toNanos()));
        Optional<JobResult> next = subscription.next(slice);
        if (next.isPresent()) {
          if (next.get().jobId().equals(job.id())) {
            return next;
          }
          continue;
        }
        if (subscription.isClosed() && subscription.buffered() == 0) {
          return Optional.empty();
        }
      }
    }
  }
}
