/**
 * Metrics adapters bridging {@link ca.gc.cra.photonic.application.port.MetricsPort} to OpenTelemetry.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe; instruments are cached per key.</p>
 * <p><strong>Metrics:</strong> Keys follow {@code pipeline.*}, {@code selection.*}, {@code stack.*}, and
 * {@code align.*} namespaces.</p>
 */
package ca.gc.cra.photonic.infrastructure.metrics;
