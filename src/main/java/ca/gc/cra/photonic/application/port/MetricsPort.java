package ca.gc.cra.photonic.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for the job pipeline and its processors.
 * <p><strong>Why:</strong> Lets the pipeline count submissions, drops, and rejected pixels without binding
 * to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter} and test doubles.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent updates from every worker.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code pipeline.jobs.completed}).</p>
 *
 * @implNote Callers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code pipeline.results.dropped}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (milliseconds, counts, queue depth); semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
