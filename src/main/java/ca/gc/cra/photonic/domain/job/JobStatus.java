package ca.gc.cra.photonic.domain.job;

import java.util.Locale;

/**
 * Lifecycle states recorded through the persistence port.
 *
 * @since 0.1.0
 */
public enum JobStatus {
  QUEUED,
  RUNNING,
  COMPLETED,
  FAILED,
  /** Accepted but discarded from the queue when the pipeline stopped. */
  CANCELLED,
  /** Refused at submission (queue full or pipeline stopped). */
  REJECTED;

  /**
   * Returns the lowercase label written to journals.
   *
   * @return label such as {@code completed}
   */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
