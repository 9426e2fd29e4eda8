/**
 * Star-based alignment for astronomical sequences: adaptive-threshold star detection, nearest-neighbour
 * matching against a reference frame, median translation estimation, and cyclic image shifting.
 *
 * @since 0.1.0
 */
package ca.gc.cra.photonic.application.align;
