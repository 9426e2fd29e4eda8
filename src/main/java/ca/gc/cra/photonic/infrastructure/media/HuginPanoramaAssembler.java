package ca.gc.cra.photonic.infrastructure.media;

import ca.gc.cra.photonic.application.port.JobContext;
import ca.gc.cra.photonic.application.port.PanoramaAssembler;
import ca.gc.cra.photonic.application.port.ToolCommand;
import ca.gc.cra.photonic.application.port.ToolOutcome;
import ca.gc.cra.photonic.application.port.ToolRunner;
import ca.gc.cra.photonic.domain.error.InsufficientDataException;
import ca.gc.cra.photonic.domain.error.JobCancelledException;
import ca.gc.cra.photonic.domain.error.ProcessingException;
import ca.gc.cra.photonic.domain.error.ToolFailureException;
import ca.gc.cra.photonic.domain.media.PanoramaRequest;
import ca.gc.cra.photonic.domain.media.PanoramaResult;
import ca.gc.cra.photonic.infrastructure.exec.ScratchDirectory;
import ca.gc.cra.photonic.logging.Logs;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Stitches panoramas with the Hugin command-line tools.
 * <p><strong>Flow:</strong> {@code pto_gen}, {@code cpfind --multirow}, {@code cpclean} (distance from
 * aggression), {@code linefind}, {@code autooptimiser}, projection rewrite, {@code pano_modify}, then
 * {@code hugin_executor --stitching}. When the executor yields nothing the project is rendered with
 * {@code nona} and blended with {@code enblend}. Optional steps that fail degrade to the previous project
 * and add a warning.</p>
 * <p><strong>Fallback:</strong> Without Hugin, or when Hugin fails, ImageMagick {@code convert +append}
 * joins the frames side by side.</p>
 *
 * @since 0.1.0
 */
public final class HuginPanoramaAssembler implements PanoramaAssembler {
  private static final Logger log = LoggerFactory.getLogger(HuginPanoramaAssembler.class);

  /** File name used when the output path is a directory. */
  public static final String DEFAULT_OUTPUT_NAME = "panorama.tif";
  static final List<String> HUGIN_TOOLS =
      List.of("pto_gen", "cpfind", "cpclean", "linefind", "autooptimiser", "pano_modify", "nona", "enblend");
  private static final Map<String, String> PROJECTIONS =
      Map.of(
          "planar", "0",
          "cylindrical", "1",
          "spherical", "2",
          "fisheye", "3",
          "stereographic", "5",
          "mercator", "6");

  private final ToolRunner runner;

  public HuginPanoramaAssembler(ToolRunner runner) {
    this.runner = Objects.requireNonNull(runner, "runner");
  }

  @Override
  public PanoramaResult assemble(PanoramaRequest request, JobContext context) throws ProcessingException {
    if (request.images().size() < 2) {
      throw new InsufficientDataException("need at least 2 images for a panorama, got " + request.images().size());
    }
    Path output = resolveOutput(request.output());
    try {
      Path parent = output.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
    } catch (IOException ex) {
      throw new ProcessingException("cannot create output directory for " + output + ": " + ex.getMessage(), ex);
    }

    List<String> warnings = new ArrayList<>();
    if (HUGIN_TOOLS.stream().allMatch(runner::isInstalled)) {
      try {
        stitchWithHugin(request, output, warnings, context);
        return new PanoramaResult(output, request.images().size(), "hugin", warnings);
      } catch (JobCancelledException ex) {
        throw ex;
      } catch (ProcessingException ex) {
        log.warn("Hugin stitching failed, trying ImageMagick: {}", ex.getMessage());
        warnings.add("hugin failed: " + ex.getMessage());
      }
    } else {
      warnings.add("hugin tools not installed");
    }

    if (!runner.isInstalled("convert")) {
      throw new ToolFailureException("panorama", "no stitching tool available", String.join("\n", warnings));
    }
    List<String> argv = new ArrayList<>();
    argv.add("convert");
    request.images().forEach(p -> argv.add(p.toString()));
    argv.add("+append");
    argv.add(output.toString());
    ToolOutcome outcome = run(ToolCommand.of(argv), context);
    if (!outcome.succeeded()) {
      throw new ToolFailureException("imagemagick", "convert +append exited with status " + outcome.exitCode(), outcome.output());
    }
    return new PanoramaResult(output, request.images().size(), "imagemagick", warnings);
  }

  private void stitchWithHugin(PanoramaRequest request, Path output, List<String> warnings, JobContext context)
      throws ProcessingException {
    try (ScratchDirectory work = ScratchDirectory.create("photonic-hugin-")) {
      Path project = work.resolve("project.pto");
      List<String> ptoGen = new ArrayList<>(List.of("pto_gen", "-o", project.toString()));
      request.images().forEach(p -> ptoGen.add(p.toString()));
      required(ToolCommand.of(ptoGen), context);

      Path current = project;
      Path withPoints = work.resolve("project_cp.pto");
      if (optional(ToolCommand.of("cpfind", "--multirow", "-o", withPoints.toString(), current.toString()), warnings, context)) {
        current = withPoints;
        Path cleaned = work.resolve("project_cleaned.pto");
        if (optional(
            ToolCommand.of(
                "cpclean", "--max-distance", cleanDistance(request.aggression()), "-o", cleaned.toString(), current.toString()),
            warnings,
            context)
            || optional(ToolCommand.of("cpclean", "-o", cleaned.toString(), current.toString()), warnings, context)) {
          current = cleaned;
        }
      }

      Path lines = work.resolve("project_lines.pto");
      if (optional(ToolCommand.of("linefind", "-o", lines.toString(), current.toString()), warnings, context)) {
        current = lines;
      }

      Path optimized = work.resolve("optimized.pto");
      if (optional(ToolCommand.of("autooptimiser", "-a", "-m", "-l", "-s", "-o", optimized.toString(), current.toString()), warnings, context)
          || optional(ToolCommand.of("autooptimiser", "-a", "-s", "-o", optimized.toString(), current.toString()), warnings, context)) {
        current = optimized;
      }

      rewriteProjection(current, request.projection(), warnings);

      Path fin = work.resolve("final.pto");
      if (optional(ToolCommand.of("pano_modify", "--canvas=AUTO", "--crop=AUTO", "-o", fin.toString(), current.toString()), warnings, context)) {
        current = fin;
      }

      if (runner.isInstalled("hugin_executor")) {
        Path prefix = work.resolve("executor");
        if (optional(ToolCommand.of("hugin_executor", "--stitching", "--prefix=" + prefix, current.toString()), warnings, context)) {
          Optional<Path> stitched = firstMatch(work.path(), "executor", ".tif");
          if (stitched.isEmpty()) {
            stitched = firstMatch(work.path(), "executor", ".jpg");
          }
          if (stitched.isPresent()) {
            Files.copy(stitched.get(), output, StandardCopyOption.REPLACE_EXISTING);
            return;
          }
          warnings.add("hugin_executor produced no output; rendering with nona");
        }
      }

      Path prefix = work.resolve("pano");
      List<String> nona = new ArrayList<>(List.of("nona", "-o", prefix.toString(), "-m", "TIFF_m"));
      nona.addAll(interpolation(request.quality()));
      nona.add(current.toString());
      required(ToolCommand.of(nona), context);

      List<Path> remapped = matches(work.path(), "pano", ".tif");
      if (remapped.isEmpty()) {
        throw new ToolFailureException("nona", "produced no remapped images", "");
      }
      List<String> enblend = new ArrayList<>(List.of("enblend", "-o", output.toString(), blendOption(request.blending())));
      remapped.forEach(p -> enblend.add(p.toString()));
      required(ToolCommand.of(enblend), context);
    } catch (IOException ex) {
      throw new ToolFailureException("hugin", "stitching I/O failed: " + ex.getMessage(), ex);
    }
  }

  private void required(ToolCommand command, JobContext context) throws ProcessingException {
    ToolOutcome outcome = run(command, context);
    if (!outcome.succeeded()) {
      throw new ToolFailureException(command.executable(), "exited with status " + outcome.exitCode(), outcome.output());
    }
  }

  private boolean optional(ToolCommand command, List<String> warnings, JobContext context) throws ProcessingException {
    ToolOutcome outcome = run(command, context);
    if (!outcome.succeeded()) {
      log.warn("{} failed; continuing without it: {}", command.executable(), Logs.tail(outcome.output(), 256));
      warnings.add(command.executable() + " failed with status " + outcome.exitCode());
    }
    return outcome.succeeded();
  }

  private ToolOutcome run(ToolCommand command, JobContext context) throws ProcessingException {
    try {
      return runner.run(command, context);
    } catch (IOException ex) {
      throw new ToolFailureException(command.executable(), "cannot run: " + ex.getMessage(), ex);
    }
  }

  static void rewriteProjection(Path pto, String projection, List<String> warnings) {
    String code = PROJECTIONS.getOrDefault(projection.toLowerCase(Locale.ROOT), "1");
    try {
      List<String> lines = new ArrayList<>(Files.readAllLines(pto, StandardCharsets.UTF_8));
      for (int i = 0; i < lines.size(); i++) {
        String line = lines.get(i);
        if (!line.startsWith("p ")) {
          continue;
        }
        String[] parts = line.trim().split("\\s+");
        for (int j = 1; j < parts.length; j++) {
          if (parts[j].startsWith("f")) {
            parts[j] = "f" + code;
            break;
          }
        }
        lines.set(i, String.join(" ", parts));
        break;
      }
      Files.write(pto, lines, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      log.warn("Failed to set projection in {}", pto, ex);
      warnings.add("projection not applied: " + ex.getMessage());
    }
  }

  static String cleanDistance(String aggression) {
    return switch (aggression == null ? "" : aggression.toLowerCase(Locale.ROOT)) {
      case "low" -> "4";
      case "high" -> "2";
      default -> "3";
    };
  }

  static List<String> interpolation(String quality) {
    return switch (quality == null ? "" : quality.toLowerCase(Locale.ROOT)) {
      case "fast" -> List.of("-i", "0");
      case "high" -> List.of("-i", "2");
      case "ultra" -> List.of("-i", "3", "-a");
      default -> List.of("-i", "1");
    };
  }

  static String blendOption(String blending) {
    return switch (blending == null ? "" : blending.toLowerCase(Locale.ROOT)) {
      case "feather" -> "--no-optimize";
      case "none" -> "--no-blend";
      default -> "--levels=29";
    };
  }

  static Path resolveOutput(Path requested) {
    if (Files.isDirectory(requested)) {
      return requested.resolve(DEFAULT_OUTPUT_NAME);
    }
    String name = requested.getFileName() == null ? "" : requested.getFileName().toString();
    return name.contains(".") ? requested : requested.resolveSibling(name + ".tif");
  }

  private static Optional<Path> firstMatch(Path dir, String prefix, String suffix) throws IOException {
    return matches(dir, prefix, suffix).stream().findFirst();
  }

  private static List<Path> matches(Path dir, String prefix, String suffix) throws IOException {
    try (Stream<Path> files = Files.list(dir)) {
      return files
          .filter(p -> {
            String name = p.getFileName().toString();
            return name.startsWith(prefix) && name.toLowerCase(Locale.ROOT).endsWith(suffix);
          })
          .sorted()
          .toList();
    }
  }
}
