/**
 * Configuration loading and wiring: YAML and CLI merging, typed settings, and the composition root that
 * builds the processor registries and the job pipeline once per process.
 */
package ca.gc.cra.photonic.config;
