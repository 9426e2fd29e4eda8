package ca.gc.cra.photonic.domain.error;

import java.nio.file.Path;
import java.util.List;

/**
 * Raised when every candidate of a fallback chain was skipped or failed. The message lists one line
 * per attempt so operators can see why each tool was rejected on this host.
 *
 * @since 0.1.0
 */
public final class ToolChainExhaustedException extends ProcessingException {
  private static final long serialVersionUID = 1L;

  private final transient Path input;
  private final List<String> attempts;

  public ToolChainExhaustedException(Path input, List<String> attempts) {
    super(buildMessage(input, attempts));
    this.input = input;
    this.attempts = List.copyOf(attempts);
  }

  public Path input() {
    return input;
  }

  /** One diagnostic line per candidate, in the order tried. */
  public List<String> attempts() {
    return attempts;
  }

  private static String buildMessage(Path input, List<String> attempts) {
    StringBuilder message = new StringBuilder("all raw processors failed for ").append(input).append(':');
    if (attempts.isEmpty()) {
      message.append("\n  no processors registered");
    }
    for (String attempt : attempts) {
      message.append("\n  ").append(attempt);
    }
    return message.toString();
  }
}
