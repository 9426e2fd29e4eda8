/**
 * Application ports. The pipeline, router, and selection strategies talk to pixel I/O, external tools,
 * persistence, and metrics only through these interfaces; adapters live under
 * {@code ca.gc.cra.photonic.infrastructure}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.photonic.application.port;
