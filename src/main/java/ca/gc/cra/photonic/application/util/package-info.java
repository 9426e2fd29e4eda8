/**
 * Small application helpers shared by the router, RAW pre-conversion, and scanning.
 *
 * @since 0.1.0
 */
package ca.gc.cra.photonic.application.util;
