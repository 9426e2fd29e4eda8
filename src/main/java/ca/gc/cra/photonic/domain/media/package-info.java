/**
 * Requests and results for the external timelapse and panorama builders.
 *
 * @since 0.1.0
 */
package ca.gc.cra.photonic.domain.media;
