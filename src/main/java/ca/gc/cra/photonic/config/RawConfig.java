package ca.gc.cra.photonic.config;

import ca.gc.cra.photonic.domain.job.RawConvertOptions;
import ca.gc.cra.photonic.infrastructure.raw.DarktableRawProcessor;
import ca.gc.cra.photonic.infrastructure.raw.DcrawRawProcessor;
import ca.gc.cra.photonic.validation.Numbers;
import java.util.Locale;
import java.util.Objects;

/**
 * RAW conversion settings: the preferred tool, default output encoding, and which converters are enabled.
 *
 * @param defaultTool converter tried first when a job names none; blank for none
 * @param outputFormat default output extension for {@code raw-convert} jobs
 * @param quality default output quality (1-100)
 * @param darktableEnabled whether darktable-cli may be used
 * @param imagemagickEnabled whether ImageMagick may be used
 * @param dcrawEnabled whether dcraw may be used
 * @param rawtherapeeEnabled whether rawtherapee-cli may be used
 * @param darktable darktable tuning
 * @param dcraw dcraw tuning
 * @param imagemagickResize optional ImageMagick {@code -resize} geometry
 * @param rawtherapeeProfile optional RawTherapee processing profile
 * @param rawtherapeeOutputProfile optional RawTherapee output colour profile
 * @since 0.1.0
 */
public record RawConfig(
    String defaultTool,
    String outputFormat,
    int quality,
    boolean darktableEnabled,
    boolean imagemagickEnabled,
    boolean dcrawEnabled,
    boolean rawtherapeeEnabled,
    DarktableRawProcessor.Settings darktable,
    DcrawRawProcessor.Settings dcraw,
    String imagemagickResize,
    String rawtherapeeProfile,
    String rawtherapeeOutputProfile) {

  public RawConfig {
    defaultTool = defaultTool == null ? "" : defaultTool.trim().toLowerCase(Locale.ROOT);
    outputFormat =
        outputFormat == null || outputFormat.isBlank()
            ? "jpg"
            : outputFormat.trim().toLowerCase(Locale.ROOT).replaceFirst("^\\.", "");
    quality = (int) Numbers.requireRange("raw.quality", quality, 1, 100);
    darktable = Objects.requireNonNullElse(darktable, DarktableRawProcessor.Settings.defaults());
    dcraw = Objects.requireNonNullElse(dcraw, DcrawRawProcessor.Settings.defaults());
    imagemagickResize = imagemagickResize == null ? "" : imagemagickResize.trim();
    rawtherapeeProfile = rawtherapeeProfile == null ? "" : rawtherapeeProfile.trim();
    rawtherapeeOutputProfile = rawtherapeeOutputProfile == null ? "" : rawtherapeeOutputProfile.trim();
  }

  /** @return ImageMagick preferred, darktable and ImageMagick enabled, jpg at quality 90 */
  public static RawConfig defaults() {
    return new RawConfig(
        "imagemagick",
        "jpg",
        RawConvertOptions.DEFAULT_QUALITY,
        true,
        true,
        false,
        false,
        DarktableRawProcessor.Settings.defaults(),
        DcrawRawProcessor.Settings.defaults(),
        "",
        "",
        "");
  }
}
