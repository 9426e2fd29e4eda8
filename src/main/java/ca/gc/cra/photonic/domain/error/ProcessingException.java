package ca.gc.cra.photonic.domain.error;

/**
 * Base type for failures that end a single processing call.
 *
 * @since 0.1.0
 */
public class ProcessingException extends Exception {
  private static final long serialVersionUID = 1L;

  public ProcessingException(String message) {
    super(message);
  }

  public ProcessingException(String message, Throwable cause) {
    super(message, cause);
  }
}
