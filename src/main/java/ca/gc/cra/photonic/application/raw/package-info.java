/**
 * Directory-level RAW pre-conversion with an on-disk cache, run before timelapse, panorama, and stacking
 * jobs so downstream tools only see developed images.
 *
 * @since 0.1.0
 */
package ca.gc.cra.photonic.application.raw;
