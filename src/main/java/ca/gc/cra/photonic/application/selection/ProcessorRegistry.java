package ca.gc.cra.photonic.application.selection;

import ca.gc.cra.photonic.application.port.ProcessorDescriptor;
import ca.gc.cra.photonic.domain.error.NoProcessorAvailableException;
import ca.gc.cra.photonic.domain.error.ProcessingException;
import ca.gc.cra.photonic.validation.Strings;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Named, capability-tagged processors with best-of selection.
 * <p><strong>Why:</strong> Several processors can align or stack the same inputs; their quality estimates
 * are comparable scalars, so the registry picks the best and commits to it.</p>
 * <p><strong>Selection order:</strong>
 * <ol>
 *   <li>An explicit name must resolve to a registered, available, capable processor or selection fails.</li>
 *   <li>The configured default is used when available and capable.</li>
 *   <li>Otherwise the strict maximum {@code estimateQuality} wins; ties keep registration order.
 *       Processors whose estimate throws are skipped.</li>
 * </ol>
 * The names {@code auto} and blank mean "no explicit choice". A failed run of the selected processor is
 * not retried with the runner-up.
 * <p><strong>Thread-safety:</strong> Register during startup only; selection is then safe from any thread.</p>
 *
 * @param <C> capability type
 * @param <P> processor type
 * @since 0.1.0
 */
public final class ProcessorRegistry<C, P extends ProcessorDescriptor<C>> {
  private static final Logger log = LoggerFactory.getLogger(ProcessorRegistry.class);

  private final String kind;
  private final String defaultName;
  private final Map<String, P> processors = new LinkedHashMap<>();

  /**
   * Creates an empty registry.
   *
   * @param kind processor kind used in messages, e.g. {@code alignment}
   * @param defaultName configured default processor name; blank or {@code auto} for none
   */
  public ProcessorRegistry(String kind, String defaultName) {
    this.kind = Strings.requireNonBlank("kind", kind);
    this.defaultName = normalizeChoice(defaultName);
  }

  /**
   * Registers a processor under its own name.
   *
   * @param processor processor to add
   * @return this registry
   * @throws IllegalStateException when a processor with the same name is already registered
   */
  public ProcessorRegistry<C, P> register(P processor) {
    Objects.requireNonNull(processor, "processor");
    String name = Strings.requireNonBlank("processor name", processor.name());
    if (processors.putIfAbsent(name, processor) != null) {
      throw new IllegalStateException(kind + " processor " + name + " is already registered");
    }
    return this;
  }

  /**
   * Looks up a processor by name.
   *
   * @param name registry key
   * @return the processor, if registered
   */
  public Optional<P> get(String name) {
    return Optional.ofNullable(processors.get(name));
  }

  /** @return registered names in registration order */
  public List<String> names() {
    return List.copyOf(processors.keySet());
  }

  /**
   * Lists available processors that support {@code capability}, in registration order.
   *
   * @param capability requested capability
   * @return matching processors
   */
  public List<P> available(C capability) {
    List<P> result = new ArrayList<>();
    for (P processor : processors.values()) {
      if (usable(processor, capability)) {
        result.add(processor);
      }
    }
    return result;
  }

  /**
   * Selects the processor to run.
   *
   * @param capability requested capability
   * @param inputs inputs passed to quality estimation
   * @param explicitName caller override; blank or {@code auto} for none
   * @return chosen processor
   * @throws NoProcessorAvailableException when nothing usable is registered, or the explicit choice is
   *     unusable
   */
  public P select(C capability, List<Path> inputs, String explicitName) throws NoProcessorAvailableException {
    Objects.requireNonNull(capability, "capability");
    List<Path> safeInputs = inputs == null ? List.of() : inputs;
    String explicit = normalizeChoice(explicitName);
    if (!explicit.isEmpty()) {
      P requested = processors.get(explicit);
      if (usable(requested, capability)) {
        log.debug("Using explicitly requested {} processor {}", kind, explicit);
        return requested;
      }
      log.warn("Requested {} processor {} is not registered, available, or capable of {}", kind, explicit, capability);
      throw new NoProcessorAvailableException(kind, String.valueOf(capability));
    }

    if (!defaultName.isEmpty()) {
      P configured = processors.get(defaultName);
      if (usable(configured, capability)) {
        log.debug("Using configured default {} processor {}", kind, defaultName);
        return configured;
      }
    }

    P best = null;
    double bestScore = Double.NEGATIVE_INFINITY;
    for (P processor : processors.values()) {
      if (!usable(processor, capability)) {
        continue;
      }
      double score;
      try {
        score = processor.estimateQuality(safeInputs);
      } catch (ProcessingException ex) {
        log.debug("Skipping {} processor {}: quality estimate failed: {}", kind, processor.name(), ex.getMessage());
        continue;
      }
      if (best == null || score > bestScore) {
        best = processor;
        bestScore = score;
      }
    }
    if (best == null) {
      throw new NoProcessorAvailableException(kind, String.valueOf(capability));
    }
    log.debug("Selected {} processor {} (quality {})", kind, best.name(), bestScore);
    return best;
  }

  private boolean usable(P processor, C capability) {
    return processor != null && processor.isAvailable() && processor.supports(capability);
  }

  static String normalizeChoice(String name) {
    String trimmed = Strings.trimToEmpty(name);
    return trimmed.equalsIgnoreCase("auto") ? "" : trimmed;
  }
}
