package ca.gc.cra.photonic.application.port;

import ca.gc.cra.photonic.domain.job.Job;
import ca.gc.cra.photonic.domain.job.JobResult;

/**
 * Executes one job on a pipeline worker thread.
 *
 * @since 0.1.0
 * @see ca.gc.cra.photonic.application.pipeline.JobRouter
 */
@FunctionalInterface
public interface JobProcessor {
  /**
   * Processes {@code job} to completion.
   *
   * <p>Expected failures should be returned as failed results. Anything thrown is caught by the worker
   * and converted into a failed result, so one broken job never takes the worker down.
   *
   * @param job job to run
   * @param context pipeline cancellation signal
   * @return result whose job is {@code job}
   * @throws Exception on unexpected failure
   */
  JobResult process(Job job, JobContext context) throws Exception;
}
