/**
 * Immutable domain model for the photonic pipeline: jobs, results, pixel buffers, and the value
 * objects exchanged between the selection layer and concrete processors.
 * <p>Types in this package perform no I/O and hold no references to adapters.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.photonic.domain;
