package ca.gc.cra.photonic.domain.error;

/**
 * Raised when too few inputs remain to produce a meaningful output (fewer than two frames to stack,
 * no stars in the reference frame, fewer than three star matches).
 *
 * @since 0.1.0
 */
public final class InsufficientDataException extends ProcessingException {
  private static final long serialVersionUID = 1L;

  public InsufficientDataException(String message) {
    super(message);
  }
}
