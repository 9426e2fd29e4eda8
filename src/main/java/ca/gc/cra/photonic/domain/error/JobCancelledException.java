package ca.gc.cra.photonic.domain.error;

/**
 * Raised when the pipeline-wide cancellation signal interrupts a running job.
 *
 * @since 0.1.0
 */
public final class JobCancelledException extends ProcessingException {
  private static final long serialVersionUID = 1L;

  public JobCancelledException(String message) {
    super(message);
  }
}
