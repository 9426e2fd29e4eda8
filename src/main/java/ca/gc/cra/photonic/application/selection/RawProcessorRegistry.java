package ca.gc.cra.photonic.application.selection;

import ca.gc.cra.photonic.application.port.JobContext;
import ca.gc.cra.photonic.application.port.MetricsPort;
import ca.gc.cra.photonic.application.port.RawProcessor;
import ca.gc.cra.photonic.domain.error.JobCancelledException;
import ca.gc.cra.photonic.domain.error.ProcessingException;
import ca.gc.cra.photonic.domain.error.ToolChainExhaustedException;
import ca.gc.cra.photonic.domain.error.ToolFailureException;
import ca.gc.cra.photonic.domain.raw.RawConvertRequest;
import ca.gc.cra.photonic.domain.raw.RawConvertResult;
import ca.gc.cra.photonic.logging.Logs;
import ca.gc.cra.photonic.validation.Strings;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> RAW converters tried as an ordered fallback chain.
 * <p><strong>Why:</strong> Which converters are installed, and which of them understand a given camera,
 * varies from host to host. Conversion success is binary, so trying alternatives in order is more useful
 * than ranking them.</p>
 * <p><strong>Chain order:</strong> explicit tool, configured default, then {@link #PRIORITY}; duplicates and
 * blanks are dropped.</p>
 * <p><strong>Thread-safety:</strong> Register during startup only; conversions may run concurrently.</p>
 * <p><strong>Observability:</strong> Each failed or skipped candidate increments
 * {@code selection.raw.fallback}.</p>
 *
 * @since 0.1.0
 */
public final class RawProcessorRegistry {
  private static final Logger log = LoggerFactory.getLogger(RawProcessorRegistry.class);

  /** Fixed tool priority after the explicit and default choices. */
  public static final List<String> PRIORITY = List.of("imagemagick", "darktable", "dcraw", "rawtherapee");

  private static final int LOG_TAIL_BYTES = 512;

  private final String defaultTool;
  private final MetricsPort metrics;
  private final Map<String, RawProcessor> processors = new LinkedHashMap<>();

  /**
   * Creates an empty registry.
   *
   * @param defaultTool configured default tool; blank for none
   * @param metrics metrics sink
   */
  public RawProcessorRegistry(String defaultTool, MetricsPort metrics) {
    this.defaultTool = Strings.trimToEmpty(defaultTool);
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Registers a converter under its own name.
   *
   * @param processor converter
   * @return this registry
   * @throws IllegalStateException when a converter with the same name is already registered
   */
  public RawProcessorRegistry register(RawProcessor processor) {
    Objects.requireNonNull(processor, "processor");
    String name = Strings.requireNonBlank("processor name", processor.name());
    if (processors.putIfAbsent(name, processor) != null) {
      throw new IllegalStateException("RAW processor " + name + " is already registered");
    }
    return this;
  }

  /** @return registered names in registration order */
  public List<String> names() {
    return List.copyOf(processors.keySet());
  }

  /** @return {@code true} when at least one registered converter is available */
  public boolean hasAvailableProcessor() {
    for (RawProcessor processor : processors.values()) {
      if (processor.isAvailable()) {
        return true;
      }
    }
    return false;
  }

  /**
   * Computes the candidate order for a conversion.
   *
   * @param explicitTool caller override; blank for none
   * @return de-duplicated candidate names
   */
  public List<String> candidates(String explicitTool) {
    Set<String> order = new LinkedHashSet<>();
    String explicit = Strings.trimToEmpty(explicitTool);
    if (!explicit.isEmpty()) {
      order.add(explicit);
    }
    if (!defaultTool.isEmpty()) {
      order.add(defaultTool);
    }
    order.addAll(PRIORITY);
    return List.copyOf(order);
  }

  /**
   * Converts one file, trying candidates until one succeeds.
   *
   * @param request conversion request
   * @param explicitTool caller override; blank for none
   * @param context cancellation signal
   * @return the first successful result
   * @throws ToolChainExhaustedException when every candidate was skipped or failed
   * @throws JobCancelledException when the pipeline is stopping
   */
  public RawConvertResult convertWithFallback(
      RawConvertRequest request, String explicitTool, JobContext context) throws ProcessingException {
    Objects.requireNonNull(request, "request");
    List<String> attempts = new ArrayList<>();
    for (String name : candidates(explicitTool)) {
      context.throwIfCancelled();
      RawProcessor processor = processors.get(name);
      if (processor == null || !processor.isAvailable()) {
        attempts.add(name + " not available or disabled");
        metrics.increment("selection.raw.fallback");
        continue;
      }
      try {
        RawConvertResult result = processor.convert(request, context);
        if (result != null && result.success()) {
          if (!attempts.isEmpty()) {
            log.info("Converted {} with {} after {} fallback step(s)", request.input().getFileName(), name, attempts.size());
          }
          return result;
        }
        String processingLog = result == null ? "" : result.processingLog();
        attempts.add(describeFailure(name, "conversion reported no output", processingLog));
      } catch (JobCancelledException cancelled) {
        throw cancelled;
      } catch (ToolFailureException ex) {
        attempts.add(describeFailure(name, ex.getMessage(), ex.toolOutput()));
      } catch (ProcessingException ex) {
        attempts.add(describeFailure(name, ex.getMessage(), ""));
      }
      metrics.increment("selection.raw.fallback");
      log.debug("RAW processor {} failed for {}; trying next", name, request.input());
    }
    throw new ToolChainExhaustedException(request.input(), attempts);
  }

  private static String describeFailure(String name, String error, String processingLog) {
    String detail = name + " failed: " + error;
    if (processingLog == null || processingLog.isBlank()) {
      return detail;
    }
    return detail + " (log: " + Logs.tail(processingLog.strip(), LOG_TAIL_BYTES) + ")";
  }
}
