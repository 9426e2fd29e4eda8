/**
 * Stacking methods, their parameters, and per-call request and result objects.
 *
 * @since 0.1.0
 */
package ca.gc.cra.photonic.domain.stack;
