package ca.gc.cra.photonic.domain.job;

import ca.gc.cra.photonic.domain.stack.StackMethod;
import ca.gc.cra.photonic.domain.stack.StackParameters;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Options for {@link JobType#STACK}.
 *
 * @param method aggregation method; defaults to {@link StackMethod#AVERAGE}
 * @param parameters clipping and percentile parameters
 * @param alignment alignment processor to run before stacking; blank, {@code auto} or {@code none} skip pre-alignment
 * @param processor explicit stacking processor name; blank selects by quality
 * @param astroMode treat the frames as astrophotography (affects pre-alignment type)
 * @param rawTool preferred RAW converter for pre-conversion
 * @param noCache reconvert RAW files even when a cached conversion is current
 * @since 0.1.0
 */
public record StackOptions(
    StackMethod method,
    StackParameters parameters,
    String alignment,
    String processor,
    boolean astroMode,
    String rawTool,
    boolean noCache)
    implements JobOptions {

  public StackOptions {
    method = Objects.requireNonNullElse(method, StackMethod.AVERAGE);
    parameters = Objects.requireNonNullElse(parameters, StackParameters.defaults());
    alignment = alignment == null ? "" : alignment.trim();
    processor = processor == null ? "" : processor.trim();
    rawTool = rawTool == null ? "" : rawTool.trim();
  }

  public static StackOptions defaults() {
    return new StackOptions(StackMethod.AVERAGE, StackParameters.defaults(), "", "", false, "", false);
  }

  /**
   * Indicates whether frames should be aligned before stacking.
   *
   * @return {@code true} when a concrete alignment processor was requested
   */
  public boolean requiresPreAlignment() {
    return !alignment.isEmpty()
        && !alignment.equalsIgnoreCase("auto")
        && !alignment.equalsIgnoreCase("none");
  }

  @Override
  public JobType jobType() {
    return JobType.STACK;
  }

  @Override
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("method", method.wireName());
    map.put("sigmaLow", parameters.sigmaLow());
    map.put("sigmaHigh", parameters.sigmaHigh());
    map.put("iterations", parameters.iterations());
    map.put("kappa", parameters.kappa());
    map.put("winsorPercent", parameters.winsorPercent());
    map.put("percentile", parameters.percentile());
    map.put("alignment", alignment);
    map.put("processor", processor);
    map.put("astroMode", astroMode);
    map.put("rawTool", rawTool);
    map.put("noCache", noCache);
    return map;
  }
}
