/**
 * Alignment adapters wrapping external registration tools.
 */
package ca.gc.cra.photonic.infrastructure.align;
