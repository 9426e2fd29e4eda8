package ca.gc.cra.photonic.application.port;

import ca.gc.cra.photonic.domain.align.AlignmentRequest;
import ca.gc.cra.photonic.domain.align.AlignmentResult;
import ca.gc.cra.photonic.domain.align.AlignmentType;
import ca.gc.cra.photonic.domain.error.ProcessingException;

/**
 * Aligns an image sequence so that each image registers on a reference.
 *
 * @since 0.1.0
 */
public interface AlignmentProcessor extends ProcessorDescriptor<AlignmentType> {
  /**
   * Aligns {@code request.images()} into {@code request.outputDirectory()}.
   *
   * @param request images and settings
   * @param context cancellation signal
   * @return aligned files and diagnostics
   * @throws ProcessingException when the run as a whole fails
   */
  AlignmentResult align(AlignmentRequest request, JobContext context) throws ProcessingException;
}
