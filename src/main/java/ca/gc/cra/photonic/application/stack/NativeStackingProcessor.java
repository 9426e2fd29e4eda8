package ca.gc.cra.photonic.application.stack;

import ca.gc.cra.photonic.application.port.ImageCodec;
import ca.gc.cra.photonic.application.port.JobContext;
import ca.gc.cra.photonic.application.port.MetricsPort;
import ca.gc.cra.photonic.application.port.StackingProcessor;
import ca.gc.cra.photonic.domain.error.InsufficientDataException;
import ca.gc.cra.photonic.domain.error.ProcessingException;
import ca.gc.cra.photonic.domain.image.ImageFormat;
import ca.gc.cra.photonic.domain.image.PixelBuffer;
import ca.gc.cra.photonic.domain.stack.StackMethod;
import ca.gc.cra.photonic.domain.stack.StackOutcome;
import ca.gc.cra.photonic.domain.stack.StackRequest;
import ca.gc.cra.photonic.domain.stack.StackResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stacking processor that decodes images in-process and runs {@link StatisticalStackingEngine}.
 *
 * <p>Handles every statistical method; exposure fusion ({@link StackMethod#HDR}) is left to external
 * tools. When the requested output is a directory the result is written to {@value #DEFAULT_OUTPUT_NAME}
 * inside it.
 *
 * @since 0.1.0
 */
public final class NativeStackingProcessor implements StackingProcessor {
  private static final Logger log = LoggerFactory.getLogger(NativeStackingProcessor.class);

  /** Registry key. */
  public static final String NAME = "native-statistical";
  /** File name used when the output path is a directory. */
  public static final String DEFAULT_OUTPUT_NAME = "astro_stack.tif";

  private static final double QUALITY = 0.8d;

  private final ImageCodec codec;
  private final StatisticalStackingEngine engine;
  private final MetricsPort metrics;

  /**
   * Creates the processor.
   *
   * @param codec pixel I/O
   * @param engine stacking kernel
   * @param metrics metrics sink for rejected-pixel counts
   */
  public NativeStackingProcessor(ImageCodec codec, StatisticalStackingEngine engine, MetricsPort metrics) {
    this.codec = Objects.requireNonNull(codec, "codec");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public boolean isAvailable() {
    return true;
  }

  @Override
  public boolean supports(StackMethod method) {
    return method != StackMethod.HDR;
  }

  @Override
  public double estimateQuality(List<Path> inputs) {
    return QUALITY;
  }

  @Override
  public StackResult stack(StackRequest request, JobContext context) throws ProcessingException {
    long started = System.nanoTime();
    List<Path> images = request.images();
    if (images.size() < 2) {
      throw new InsufficientDataException("need at least 2 images for stacking, got " + images.size());
    }
    if (!supports(request.method())) {
      throw new ProcessingException(NAME + " does not support stacking method " + request.method());
    }

    List<PixelBuffer> buffers = new ArrayList<>(images.size());
    for (Path image : images) {
      context.throwIfCancelled();
      try {
        buffers.add(codec.read(image));
      } catch (IOException ex) {
        throw new ProcessingException("failed to read " + image + ": " + ex.getMessage(), ex);
      }
    }

    StackOutcome outcome;
    try {
      outcome = engine.stack(buffers, request.method(), request.parameters(), context);
    } catch (IllegalArgumentException ex) {
      throw new ProcessingException("cannot stack images: " + ex.getMessage(), ex);
    }
    context.throwIfCancelled();

    Path output = resolveOutput(request.output());
    try {
      Path parent = output.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      codec.write(outcome.image(), output, ImageFormat.fromPath(output));
    } catch (IOException ex) {
      throw new ProcessingException("failed to write " + output + ": " + ex.getMessage(), ex);
    }

    List<String> warnings = new ArrayList<>();
    if (request.astroMode() && !request.method().isClipping()) {
      warnings.add("astro mode without outlier rejection; sigma-clip or kappa-sigma removes cosmic rays");
    }
    metrics.observe("stack.rejectedPixels", outcome.rejectedPixels());
    double snr = PixelStatistics.signalToNoise(outcome.image());
    Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
    log.info(
        "Stacked {} images with {} into {} ({} rejected samples, SNR {})",
        images.size(),
        request.method(),
        output,
        outcome.rejectedPixels(),
        String.format("%.2f", snr));
    return new StackResult(
        true,
        NAME,
        output,
        request.method(),
        images.size(),
        outcome.rejectedPixels(),
        snr,
        elapsed,
        warnings);
  }

  private static Path resolveOutput(Path requested) {
    return Files.isDirectory(requested) ? requested.resolve(DEFAULT_OUTPUT_NAME) : requested;
  }
}
