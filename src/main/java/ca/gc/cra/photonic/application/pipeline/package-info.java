/**
 * The job pipeline: a bounded FIFO queue drained by a fixed worker pool, per-subscriber bounded result
 * streams, and the router that turns each job into a result.
 * <p>Submission never blocks: a full queue is reported to the caller immediately. Broadcasting never
 * blocks either: a subscriber whose buffer is full misses that result. Callers correlate results by
 * job ID (see {@link ca.gc.cra.photonic.application.pipeline.JobCompletionWaiter}).</p>
 * <p>Worker threads are named {@code photonic-worker-*} and tag their log lines with the MDC keys
 * {@code pipeline}, {@code jobId}, and {@code jobType}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.photonic.application.pipeline;
