/**
 * Wall-clock adapters implementing {@link ca.gc.cra.photonic.application.port.ClockPort}.
 */
package ca.gc.cra.photonic.infrastructure.time;
