/**
 * Job identity, typed per-job options, and the results broadcast by the pipeline.
 *
 * @since 0.1.0
 */
package ca.gc.cra.photonic.domain.job;
