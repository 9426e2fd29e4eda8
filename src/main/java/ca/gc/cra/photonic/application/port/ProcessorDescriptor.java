package ca.gc.cra.photonic.application.port;

import ca.gc.cra.photonic.domain.error.ProcessingException;
import java.nio.file.Path;
import java.util.List;

/**
 * <strong>What:</strong> Common contract of interchangeable processors held in a registry.
 * <p><strong>Why:</strong> Best-of selection compares processors purely through availability, capability,
 * and a scalar quality estimate.</p>
 * <p><strong>Thread-safety:</strong> Implementations are registered once at startup and must be stateless
 * across invocations apart from construction-time configuration.</p>
 *
 * @param <C> capability type ({@code AlignmentType}, {@code StackMethod})
 * @since 0.1.0
 * @see ca.gc.cra.photonic.application.selection.ProcessorRegistry
 */
public interface ProcessorDescriptor<C> {
  /** @return unique registry key */
  String name();

  /** @return {@code true} when the processor can run in this environment */
  boolean isAvailable();

  /**
   * @param capability requested capability
   * @return {@code true} when the processor handles it
   */
  boolean supports(C capability);

  /**
   * Estimates output quality for the given inputs; higher is better.
   *
   * @param inputs input images
   * @return comparable score, nominally in {@code [0, 1]}
   * @throws ProcessingException when the inputs cannot be assessed
   */
  double estimateQuality(List<Path> inputs) throws ProcessingException;
}
