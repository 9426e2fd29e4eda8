/**
 * Processor selection. {@link ca.gc.cra.photonic.application.selection.ProcessorRegistry} commits to
 * the single best-scoring processor; {@link ca.gc.cra.photonic.application.selection.RawProcessorRegistry}
 * walks an ordered fallback chain until one RAW converter succeeds.
 *
 * @since 0.1.0
 */
package ca.gc.cra.photonic.application.selection;
