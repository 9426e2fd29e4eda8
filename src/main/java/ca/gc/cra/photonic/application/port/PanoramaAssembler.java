package ca.gc.cra.photonic.application.port;

import ca.gc.cra.photonic.domain.error.ProcessingException;
import ca.gc.cra.photonic.domain.media.PanoramaRequest;
import ca.gc.cra.photonic.domain.media.PanoramaResult;

/**
 * Stitches overlapping images into a panorama.
 *
 * @since 0.1.0
 */
public interface PanoramaAssembler {
  /**
   * Stitches the request's images.
   *
   * @param request images and stitching settings
   * @param context cancellation signal
   * @return stitched output
   * @throws ProcessingException when any mandatory stitching step fails
   */
  PanoramaResult assemble(PanoramaRequest request, JobContext context) throws ProcessingException;
}
