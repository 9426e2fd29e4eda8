/**
 * Argument and configuration validation shared by the CLI, configuration loaders, and domain
 * constructors. Every helper throws {@link java.lang.IllegalArgumentException} with a message that
 * names the offending parameter.
 *
 * @since 0.1.0
 */
package ca.gc.cra.photonic.validation;
