package ca.gc.cra.photonic.domain.stack;

import java.util.List;
import java.util.Locale;

/**
 * Per-pixel aggregation methods.
 *
 * @since 0.1.0
 */
public enum StackMethod {
  MEAN("mean"),
  AVERAGE("average"),
  /** Arithmetic mean used for astrophotography frames. */
  ASTRO("astro"),
  MEDIAN("median"),
  /** Linear-interpolated order statistic at {@link StackParameters#percentile()}. */
  PERCENTILE("percentile"),
  /** Order statistic at {@link StackParameters#winsorPercent()} percent. */
  WINSORIZED("winsorized"),
  SIGMA_CLIP("sigma-clip", "sigma"),
  /** Sigma clipping with bounds derived from {@link StackParameters#kappa()}. */
  KAPPA_SIGMA("kappa-sigma", "kappa"),
  MAX("max", "lighten", "star-trails"),
  MIN("min", "darken"),
  /** Exposure fusion; only external fusion tools support it. */
  HDR("hdr", "enfuse", "exposure");

  private final String wireName;
  private final List<String> aliases;

  StackMethod(String wireName, String... aliases) {
    this.wireName = wireName;
    this.aliases = List.of(aliases);
  }

  public String wireName() {
    return wireName;
  }

  /**
   * Indicates whether the method rejects outliers and therefore reports rejected pixels.
   *
   * @return {@code true} for sigma and kappa-sigma clipping
   */
  public boolean isClipping() {
    return this == SIGMA_CLIP || this == KAPPA_SIGMA;
  }

  /**
   * Resolves a method name or alias (case-insensitive; underscores accepted in place of hyphens).
   *
   * @param raw candidate name
   * @return matching method
   * @throws IllegalArgumentException when nothing matches
   */
  public static StackMethod fromWireName(String raw) {
    if (raw != null) {
      String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
      for (StackMethod method : values()) {
        if (method.wireName.equals(normalized) || method.aliases.contains(normalized)) {
          return method;
        }
      }
    }
    throw new IllegalArgumentException("unknown stacking method: " + raw);
  }

  @Override
  public String toString() {
    return wireName;
  }
}
