/**
 * Media adapters: ffmpeg timelapse encoding and Hugin panorama stitching.
 * <p>Both run their tools through {@link ca.gc.cra.photonic.application.port.ToolRunner} inside a
 * {@link ca.gc.cra.photonic.infrastructure.exec.ScratchDirectory}.</p>
 */
package ca.gc.cra.photonic.infrastructure.media;
