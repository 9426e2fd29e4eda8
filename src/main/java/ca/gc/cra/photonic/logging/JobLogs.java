package ca.gc.cra.photonic.logging;

import ca.gc.cra.photonic.domain.job.Job;
import java.util.Objects;
import org.slf4j.MDC;

/**
 * MDC scope that tags log lines emitted while a worker processes one job.
 *
 * <p>Use with try-with-resources; {@link #close()} removes exactly the keys this scope set.
 *
 * @since 0.1.0
 */
public final class JobLogs implements AutoCloseable {
  /** MDC key carrying the job identifier. */
  public static final String JOB_ID = "jobId";
  /** MDC key carrying the job type wire name. */
  public static final String JOB_TYPE = "jobType";
  /** MDC key carrying the pipeline name. */
  public static final String PIPELINE = "pipeline";

  private JobLogs() {}

  /**
   * Opens a scope for {@code job} on the current thread.
   *
   * @param pipeline pipeline name
   * @param job job being processed
   * @return scope to close when processing ends
   */
  public static JobLogs open(String pipeline, Job job) {
    Objects.requireNonNull(job, "job");
    MDC.put(PIPELINE, pipeline);
    MDC.put(JOB_ID, job.id().value());
    MDC.put(JOB_TYPE, job.type().wireName());
    return new JobLogs();
  }

  @Override
  public void close() {
    MDC.remove(JOB_TYPE);
    MDC.remove(JOB_ID);
    MDC.remove(PIPELINE);
  }
}
