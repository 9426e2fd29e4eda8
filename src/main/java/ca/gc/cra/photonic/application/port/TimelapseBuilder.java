package ca.gc.cra.photonic.application.port;

import ca.gc.cra.photonic.domain.error.ProcessingException;
import ca.gc.cra.photonic.domain.media.TimelapseRequest;
import ca.gc.cra.photonic.domain.media.TimelapseResult;

/**
 * Encodes a frame sequence into one or more video formats.
 *
 * @since 0.1.0
 */
public interface TimelapseBuilder {
  /**
   * Builds every requested format. A format that fails is reported in the result; the call fails only
   * when no format could be produced.
   *
   * @param request frames and encoding settings
   * @param context cancellation signal
   * @return produced files
   * @throws ProcessingException when nothing could be produced
   */
  TimelapseResult build(TimelapseRequest request, JobContext context) throws ProcessingException;
}
