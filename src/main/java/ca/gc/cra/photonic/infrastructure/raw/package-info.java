/**
 * RAW converters wrapping darktable-cli, ImageMagick, dcraw and rawtherapee-cli.
 * <p>Each adapter is available only when enabled in configuration and its binaries are on {@code PATH};
 * {@link ca.gc.cra.photonic.application.selection.RawProcessorRegistry} chains them.</p>
 */
package ca.gc.cra.photonic.infrastructure.raw;
