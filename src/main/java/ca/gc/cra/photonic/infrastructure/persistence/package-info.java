/**
 * Job journal adapters implementing {@link ca.gc.cra.photonic.application.port.PersistencePort}.
 * <p><strong>Concurrency:</strong> Adapters are shared by all pipeline workers and serialize their own
 * writes.</p>
 */
package ca.gc.cra.photonic.infrastructure.persistence;
