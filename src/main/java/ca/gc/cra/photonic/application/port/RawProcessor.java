package ca.gc.cra.photonic.application.port;

import ca.gc.cra.photonic.domain.error.ProcessingException;
import ca.gc.cra.photonic.domain.raw.RawConvertRequest;
import ca.gc.cra.photonic.domain.raw.RawConvertResult;

/**
 * Converts one camera RAW file to a standard image format.
 *
 * <p>RAW processors are tried in a fallback chain rather than ranked, so they expose no quality estimate.
 *
 * @since 0.1.0
 * @see ca.gc.cra.photonic.application.selection.RawProcessorRegistry
 */
public interface RawProcessor {
  /** @return unique registry key, e.g. {@code darktable} */
  String name();

  /** @return {@code true} when enabled and installed */
  boolean isAvailable();

  /**
   * Converts {@code request.input()} to {@code request.output()}.
   *
   * @param request conversion request
   * @param context cancellation signal
   * @return result; {@code success()} is {@code false} when the tool ran but produced nothing usable
   * @throws ProcessingException when the tool fails
   */
  RawConvertResult convert(RawConvertRequest request, JobContext context) throws ProcessingException;
}
