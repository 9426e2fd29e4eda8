package ca.gc.cra.photonic.application.port;

import ca.gc.cra.photonic.domain.error.ProcessingException;
import ca.gc.cra.photonic.domain.stack.StackMethod;
import ca.gc.cra.photonic.domain.stack.StackRequest;
import ca.gc.cra.photonic.domain.stack.StackResult;

/**
 * Combines a set of aligned images into one output image.
 *
 * @since 0.1.0
 */
public interface StackingProcessor extends ProcessorDescriptor<StackMethod> {
  /**
   * Stacks the request's images.
   *
   * @param request images, method, and parameters
   * @param context cancellation signal
   * @return output file and diagnostics
   * @throws ProcessingException when stacking fails
   */
  StackResult stack(StackRequest request, JobContext context) throws ProcessingException;
}
