/**
 * Logging helpers: runtime level control for the CLI, output truncation for tool logs, and MDC scopes
 * that tag worker log lines with the job being processed.
 *
 * @since 0.1.0
 */
package ca.gc.cra.photonic.logging;
