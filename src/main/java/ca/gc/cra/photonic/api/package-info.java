/**
 * Command-line entry points: argument parsing, configuration merging, and running one job through the
 * pipeline.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging, and
 * invokes the pipeline built by {@link ca.gc.cra.photonic.config.CompositionRoot}.</p>
 * <p><strong>Concurrency:</strong> CLI setup runs on the main thread; the pipeline spawns its own workers.</p>
 */
package ca.gc.cra.photonic.api;
