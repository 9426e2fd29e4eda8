/**
 * Directory scanning that proposes timelapse, panorama, and stack groupings for a folder of images.
 *
 * @since 0.1.0
 */
package ca.gc.cra.photonic.application.scan;
