package ca.gc.cra.photonic.domain.error;

/**
 * Raised when a single external tool or processor invocation fails.
 *
 * @since 0.1.0
 */
public final class ToolFailureException extends ProcessingException {
  private static final long serialVersionUID = 1L;

  private final String tool;
  private final String toolOutput;

  public ToolFailureException(String tool, String message, String toolOutput) {
    super(tool + ": " + message);
    this.tool = tool;
    this.toolOutput = toolOutput == null ? "" : toolOutput;
  }

  public ToolFailureException(String tool, String message, Throwable cause) {
    super(tool + ": " + message, cause);
    this.tool = tool;
    this.toolOutput = "";
  }

  public String tool() {
    return tool;
  }

  /** Captured stdout/stderr of the tool, possibly empty. */
  public String toolOutput() {
    return toolOutput;
  }
}
