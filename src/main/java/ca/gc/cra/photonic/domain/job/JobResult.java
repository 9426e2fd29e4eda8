package ca.gc.cra.photonic.domain.job;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of processing one {@link Job}; broadcast to subscribers and then discarded.
 *
 * @param job originating job; its id correlates the result with the submission
 * @param error failure cause, or {@code null} on success
 * @param metadata unmodifiable, insertion-ordered diagnostics (output paths, tool used, warnings)
 * @since 0.1.0
 */
public record JobResult(Job job, Throwable error, Map<String, Object> metadata) {

  public JobResult {
    Objects.requireNonNull(job, "job");
    metadata =
        metadata == null || metadata.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public static JobResult success(Job job, Map<String, Object> metadata) {
    return new JobResult(job, null, metadata);
  }

  public static JobResult failure(Job job, Throwable error, Map<String, Object> metadata) {
    return new JobResult(job, Objects.requireNonNull(error, "error"), metadata);
  }

  public static JobResult failure(Job job, Throwable error) {
    return failure(job, error, Map.of());
  }

  public JobId jobId() {
    return job.id();
  }

  public boolean isSuccess() {
    return error == null;
  }

  public Optional<Throwable> failure() {
    return Optional.ofNullable(error);
  }

  /**
   * Returns the terminal status recorded for this result.
   *
   * @return {@link JobStatus#COMPLETED} or {@link JobStatus#FAILED}
   */
  public JobStatus status() {
    return error == null ? JobStatus.COMPLETED : JobStatus.FAILED;
  }

  /**
   * Returns the error message, falling back to the exception class when the message is absent.
   *
   * @return message text, or an empty string on success
   */
  public String errorMessage() {
    if (error == null) {
      return "";
    }
    String message = error.getMessage();
    return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
  }
}
