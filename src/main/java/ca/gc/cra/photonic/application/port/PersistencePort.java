package ca.gc.cra.photonic.application.port;

import ca.gc.cra.photonic.domain.job.Job;
import ca.gc.cra.photonic.domain.job.JobId;
import ca.gc.cra.photonic.domain.job.JobStatus;
import java.util.Map;

/**
 * <strong>What:</strong> Port recording job lifecycle events (queued, started, finished).
 * <p><strong>Why:</strong> Gives operators a durable trail of what ran, with which options, and why it
 * failed, without making storage part of the pipeline's correctness.</p>
 * <p><strong>Role:</strong> Implemented by {@code JsonlJobJournalAdapter}; {@link #NONE} when no journal is
 * configured.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept calls from the submitting thread and from
 * every worker concurrently.</p>
 * <p><strong>Observability:</strong> The pipeline logs and counts failures of these calls but never fails a
 * job because of them.</p>
 *
 * @since 0.1.0
 */
public interface PersistencePort extends AutoCloseable {
  /**
   * Records a job accepted or rejected at submission. Options are taken from {@link Job#options()}.
   *
   * @param job submitted job
   * @param status {@link JobStatus#QUEUED} or {@link JobStatus#REJECTED}
   * @throws Exception when the record cannot be written
   */
  void recordJobQueued(Job job, JobStatus status) throws Exception;

  /**
   * Records that a worker has dequeued the job.
   *
   * @param id job identifier
   * @throws Exception when the record cannot be written
   */
  void recordJobStart(JobId id) throws Exception;

  /**
   * Records a terminal outcome.
   *
   * @param id job identifier
   * @param status terminal status
   * @param metadata result metadata; may be empty
   * @param error error message, empty on success
   * @throws Exception when the record cannot be written
   */
  void recordJobResult(JobId id, JobStatus status, Map<String, Object> metadata, String error)
      throws Exception;

  /**
   * Releases underlying resources.
   *
   * @throws Exception when flushing or closing fails
   */
  @Override
  default void close() throws Exception {}

  /** Persistence that records nothing. */
  PersistencePort NONE = new PersistencePort() {
    @Override public void recordJobQueued(Job job, JobStatus status) {}

    @Override public void recordJobStart(JobId id) {}

    @Override
    public void recordJobResult(JobId id, JobStatus status, Map<String, Object> metadata, String error) {}
  };
}
