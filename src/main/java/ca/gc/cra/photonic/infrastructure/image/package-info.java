/**
 * Pixel codecs implementing {@link ca.gc.cra.photonic.application.port.ImageCodec}.
 */
package ca.gc.cra.photonic.infrastructure.image;
