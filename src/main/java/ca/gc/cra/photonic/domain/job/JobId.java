package ca.gc.cra.photonic.domain.job;

import ca.gc.cra.photonic.validation.Strings;
import java.util.UUID;

/**
 * Identifier correlating a submitted {@link Job} with the {@link JobResult} it produces.
 *
 * @param value trimmed, non-blank identifier text
 * @since 0.1.0
 */
public record JobId(String value) {
  private static final int MAX_LENGTH = 128;

  /**
   * Validates the identifier.
   *
   * @throws IllegalArgumentException when blank, too long, or not printable ASCII
   */
  public JobId {
    value = Strings.requirePrintableAscii("jobId", value, MAX_LENGTH);
  }

  /**
   * Creates an identifier from caller-supplied text.
   *
   * @param value identifier text
   * @return validated identifier
   */
  public static JobId of(String value) {
    return new JobId(value);
  }

  /**
   * Generates a random identifier.
   *
   * @return new identifier backed by a random UUID
   */
  public static JobId random() {
    return new JobId(UUID.randomUUID().toString());
  }

  @Override
  public String toString() {
    return value;
  }
}
