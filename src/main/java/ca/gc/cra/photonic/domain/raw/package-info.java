/**
 * RAW conversion requests and results.
 *
 * @since 0.1.0
 */
package ca.gc.cra.photonic.domain.raw;
