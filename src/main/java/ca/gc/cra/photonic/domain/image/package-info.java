/**
 * Pixel buffers and the geometric value objects produced by star detection.
 *
 * @since 0.1.0
 */
package ca.gc.cra.photonic.domain.image;
