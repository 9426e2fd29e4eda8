/**
 * Checked exceptions raised while processing a job. The pipeline packages every one of them into
 * the job's result; none escapes a worker thread.
 *
 * @since 0.1.0
 */
package ca.gc.cra.photonic.domain.error;
