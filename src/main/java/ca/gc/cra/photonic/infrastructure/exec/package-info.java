/**
 * Process and thread plumbing: the pipeline's worker pool and the subprocess runner used by every
 * external-tool adapter.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.photonic.infrastructure.exec.ProcessToolRunner} is safe
 * for concurrent use; each call owns its own {@link java.lang.Process}.</p>
 */
package ca.gc.cra.photonic.infrastructure.exec;
