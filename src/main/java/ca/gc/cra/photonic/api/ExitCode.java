package ca.gc.cra.photonic.api;

/**
 * <strong>What:</strong> Process exit statuses returned by the {@code photonic} command.
 * <p><strong>Role:</strong> Adapter-facing enum returned by CLI entry points.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Job completed. */
  SUCCESS(0),
  /** Arguments or job options were invalid. */
  INVALID_ARGS(2),
  /** Input or output paths, or the configuration file, could not be read or written. */
  IO_ERROR(3),
  /** Configuration was malformed or inconsistent. */
  CONFIG_ERROR(4),
  /** Job failed, was rejected, or did not finish in time. */
  RUNTIME_FAILURE(5),
  /** Interrupted while waiting for the job (e.g. SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /** @return numeric status handed to {@link System#exit(int)} */
  public int code() {
    return code;
  }
}
