package ca.gc.cra.photonic.domain.error;

/**
 * Raised when no registered processor is available and capable of the requested task.
 *
 * @since 0.1.0
 */
public final class NoProcessorAvailableException extends ProcessingException {
  private static final long serialVersionUID = 1L;

  private final String kind;
  private final String capability;

  public NoProcessorAvailableException(String kind, String capability) {
    super("no " + kind + " processor available for type " + capability);
    this.kind = kind;
    this.capability = capability;
  }

  public String kind() {
    return kind;
  }

  public String capability() {
    return capability;
  }
}
