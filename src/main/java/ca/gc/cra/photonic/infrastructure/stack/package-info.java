/**
 * Stacking adapters wrapping external fusion tools.
 */
package ca.gc.cra.photonic.infrastructure.stack;
