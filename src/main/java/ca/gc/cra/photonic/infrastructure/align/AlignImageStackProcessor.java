package ca.gc.cra.photonic.infrastructure.align;

import ca.gc.cra.photonic.application.port.AlignmentProcessor;
import ca.gc.cra.photonic.application.port.JobContext;
import ca.gc.cra.photonic.application.port.ToolCommand;
import ca.gc.cra.photonic.application.port.ToolOutcome;
import ca.gc.cra.photonic.application.port.ToolRunner;
import ca.gc.cra.photonic.domain.align.AlignmentRequest;
import ca.gc.cra.photonic.domain.align.AlignmentResult;
import ca.gc.cra.photonic.domain.align.AlignmentType;
import ca.gc.cra.photonic.domain.error.InsufficientDataException;
import ca.gc.cra.photonic.domain.error.ProcessingException;
import ca.gc.cra.photonic.domain.error.ToolFailureException;
import ca.gc.cra.photonic.logging.Logs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aligns panoramic, general, and timelapse sequences with Hugin's {@code align_image_stack}.
 *
 * <p>Quality maps to control-point density: {@code ultra} uses {@code -g 10 -s 2}, {@code high}
 * {@code -g 8 -s 1}, {@code fast} {@code -g 4}; anything else keeps the tool defaults. Outputs are the
 * {@code <type>_aligned_NNNN.tif} files the tool writes into the request's output directory.
 *
 * @since 0.1.0
 */
public final class AlignImageStackProcessor implements AlignmentProcessor {
  private static final Logger log = LoggerFactory.getLogger(AlignImageStackProcessor.class);

  public static final String NAME = "align_image_stack";
  private static final double QUALITY = 0.6d;
  private static final int WARNING_TAIL_BYTES = 2048;

  private final Set<AlignmentType> enabledTypes;
  private final ToolRunner runner;

  /**
   * @param enabledTypes types turned on in configuration; {@link AlignmentType#ASTRO} is ignored
   * @param runner subprocess runner
   */
  public AlignImageStackProcessor(Set<AlignmentType> enabledTypes, ToolRunner runner) {
    EnumSet<AlignmentType> types = EnumSet.noneOf(AlignmentType.class);
    types.addAll(Objects.requireNonNull(enabledTypes, "enabledTypes"));
    types.remove(AlignmentType.ASTRO);
    this.enabledTypes = types;
    this.runner = Objects.requireNonNull(runner, "runner");
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public boolean isAvailable() {
    return !enabledTypes.isEmpty() && runner.isInstalled(NAME);
  }

  @Override
  public boolean supports(AlignmentType type) {
    return enabledTypes.contains(type);
  }

  @Override
  public double estimateQuality(List<Path> inputs) {
    return QUALITY;
  }

  @Override
  public AlignmentResult align(AlignmentRequest request, JobContext context) throws ProcessingException {
    if (request.images().size() < 2) {
      throw new InsufficientDataException("need at least 2 images to align, got " + request.images().size());
    }
    String prefix = request.type().wireName() + "_aligned_";
    ToolOutcome outcome;
    try {
      Files.createDirectories(request.outputDirectory());
      outcome = runner.run(command(request, request.outputDirectory().resolve(prefix)), context);
    } catch (IOException ex) {
      throw new ToolFailureException(NAME, "cannot run: " + ex.getMessage(), ex);
    }
    if (!outcome.succeeded()) {
      throw new ToolFailureException(NAME, "exited with status " + outcome.exitCode(), outcome.output());
    }

    List<Path> aligned = collectOutputs(request.outputDirectory(), prefix);
    List<String> warnings = new ArrayList<>();
    if (!outcome.output().isBlank()) {
      warnings.add(Logs.tail(outcome.output().strip(), WARNING_TAIL_BYTES));
    }
    log.info("{} aligned {} of {} images", NAME, aligned.size(), request.images().size());
    return new AlignmentResult(
        aligned.size() >= 2, NAME, aligned, Map.of(), 0, 0, outcome.elapsed(), warnings);
  }

  static ToolCommand command(AlignmentRequest request, Path prefix) {
    List<String> argv = new ArrayList<>(List.of(NAME, "-a", prefix.toString()));
    switch (request.quality().toLowerCase(Locale.ROOT)) {
      case "ultra" -> argv.addAll(List.of("-g", "10", "-s", "2"));
      case "high" -> argv.addAll(List.of("-g", "8", "-s", "1"));
      case "fast" -> argv.addAll(List.of("-g", "4"));
      default -> { }
    }
    for (Path image : request.images()) {
      argv.add(image.toString());
    }
    return ToolCommand.of(argv);
  }

  private static List<Path> collectOutputs(Path dir, String prefix) throws ProcessingException {
    try (Stream<Path> files = Files.list(dir)) {
      return files
          .filter(Files::isRegularFile)
          .filter(p -> {
            String name = p.getFileName().toString();
            return name.startsWith(prefix) && name.toLowerCase(Locale.ROOT).endsWith(".tif");
          })
          .sorted()
          .toList();
    } catch (IOException ex) {
      throw new ProcessingException("cannot list aligned images in " + dir + ": " + ex.getMessage(), ex);
    }
  }
}
