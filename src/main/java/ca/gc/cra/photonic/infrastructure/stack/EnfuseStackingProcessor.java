package ca.gc.cra.photonic.infrastructure.stack;

import ca.gc.cra.photonic.application.port.JobContext;
import ca.gc.cra.photonic.application.port.StackingProcessor;
import ca.gc.cra.photonic.application.port.ToolCommand;
import ca.gc.cra.photonic.application.port.ToolOutcome;
import ca.gc.cra.photonic.application.port.ToolRunner;
import ca.gc.cra.photonic.application.stack.NativeStackingProcessor;
import ca.gc.cra.photonic.domain.error.InsufficientDataException;
import ca.gc.cra.photonic.domain.error.ProcessingException;
import ca.gc.cra.photonic.domain.error.ToolFailureException;
import ca.gc.cra.photonic.domain.stack.StackMethod;
import ca.gc.cra.photonic.domain.stack.StackRequest;
import ca.gc.cra.photonic.domain.stack.StackResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stacks with {@code enfuse}: exposure-weighted averaging for mean stacks and exposure fusion for HDR.
 * Writes an uncompressed 16-bit TIFF. enfuse reports neither rejected pixels nor noise, so both are zero.
 *
 * @since 0.1.0
 */
public final class EnfuseStackingProcessor implements StackingProcessor {
  private static final Logger log = LoggerFactory.getLogger(EnfuseStackingProcessor.class);

  public static final String NAME = "enfuse";
  private static final double QUALITY = 0.9d;
  private static final Set<StackMethod> SUPPORTED = EnumSet.of(StackMethod.MEAN, StackMethod.AVERAGE, StackMethod.HDR);

  private final ToolRunner runner;

  public EnfuseStackingProcessor(ToolRunner runner) {
    this.runner = Objects.requireNonNull(runner, "runner");
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public boolean isAvailable() {
    return runner.isInstalled(NAME);
  }

  @Override
  public boolean supports(StackMethod method) {
    return SUPPORTED.contains(method);
  }

  @Override
  public double estimateQuality(List<Path> inputs) {
    return QUALITY;
  }

  @Override
  public StackResult stack(StackRequest request, JobContext context) throws ProcessingException {
    if (request.images().size() < 2) {
      throw new InsufficientDataException("need at least 2 images for stacking, got " + request.images().size());
    }
    Path output = resolveOutput(request.output());
    ToolOutcome outcome;
    try {
      Path parent = output.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      outcome = runner.run(command(request, output), context);
    } catch (IOException ex) {
      throw new ToolFailureException(NAME, "cannot run: " + ex.getMessage(), ex);
    }
    if (!outcome.succeeded()) {
      throw new ToolFailureException(NAME, "exited with status " + outcome.exitCode(), outcome.output());
    }
    if (!Files.isRegularFile(output)) {
      throw new ToolFailureException(NAME, "output file not created: " + output, outcome.output());
    }
    log.info("enfuse stacked {} images into {}", request.images().size(), output);
    return new StackResult(
        true, NAME, output, request.method(), request.images().size(), 0L, 0d, outcome.elapsed(), List.of());
  }

  static ToolCommand command(StackRequest request, Path output) {
    List<String> argv =
        new ArrayList<>(List.of(NAME, "--output=" + output, "--depth=16", "--compression=none"));
    if (request.method() == StackMethod.HDR) {
      argv.addAll(List.of("--exposure-weight=1.0", "--saturation-weight=0.2", "--contrast-weight=0.0"));
    } else {
      argv.addAll(
          List.of(
              "--exposure-weight=1.0",
              "--saturation-weight=0.0",
              "--contrast-weight=0.0",
              "--entropy-weight=0.0",
              "--soft-mask"));
    }
    for (Path image : request.images()) {
      argv.add(image.toString());
    }
    return ToolCommand.of(argv);
  }

  static Path resolveOutput(Path requested) {
    if (Files.isDirectory(requested)) {
      return requested.resolve(NativeStackingProcessor.DEFAULT_OUTPUT_NAME);
    }
    String name = requested.getFileName() == null ? "" : requested.getFileName().toString();
    return name.contains(".") ? requested : requested.resolveSibling(name + ".tif");
  }
}
