/**
 * Per-pixel statistical stacking: mean, order statistics, and iterative sigma / kappa-sigma clipping
 * with rejected-sample accounting, plus the registry processor that runs them on image files.
 *
 * @since 0.1.0
 */
package ca.gc.cra.photonic.application.stack;
