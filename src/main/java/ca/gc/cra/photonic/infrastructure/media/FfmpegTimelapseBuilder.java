package ca.gc.cra.photonic.infrastructure.media;

import ca.gc.cra.photonic.application.port.JobContext;
import ca.gc.cra.photonic.application.port.TimelapseBuilder;
import ca.gc.cra.photonic.application.port.ToolCommand;
import ca.gc.cra.photonic.application.port.ToolOutcome;
import ca.gc.cra.photonic.application.port.ToolRunner;
import ca.gc.cra.photonic.application.util.ImageFiles;
import ca.gc.cra.photonic.domain.error.InsufficientDataException;
import ca.gc.cra.photonic.domain.error.ProcessingException;
import ca.gc.cra.photonic.domain.error.ToolFailureException;
import ca.gc.cra.photonic.domain.media.TimelapseRequest;
import ca.gc.cra.photonic.domain.media.TimelapseResult;
import ca.gc.cra.photonic.infrastructure.exec.ScratchDirectory;
import ca.gc.cra.photonic.logging.Logs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Encodes frame sequences with {@code ffmpeg}.
 * <p><strong>Formats:</strong> {@code mp4} (H.264 high 4:4:4), {@code mp4-h265}, {@code 3gp},
 * {@code 3gp-h264}, {@code 3gp-mobile}, and {@code gif}. A failed format is reported and the others still
 * run; the build fails only when nothing was produced.</p>
 * <p>Frames are linked (or copied) into a scratch directory as {@code frame_NNNNNN.<ext>} so a single glob
 * picks up exactly the requested frames in order.</p>
 *
 * @since 0.1.0
 */
public final class FfmpegTimelapseBuilder implements TimelapseBuilder {
  private static final Logger log = LoggerFactory.getLogger(FfmpegTimelapseBuilder.class);

  /** Base name used when the output path is a directory. */
  public static final String DEFAULT_BASE_NAME = "timelapse";
  /** Formats this builder can encode. */
  public static final List<String> SUPPORTED_FORMATS =
      List.of("mp4", "mp4-h265", "3gp", "3gp-h264", "3gp-mobile", "gif");

  private final ToolRunner runner;

  public FfmpegTimelapseBuilder(ToolRunner runner) {
    this.runner = Objects.requireNonNull(runner, "runner");
  }

  @Override
  public TimelapseResult build(TimelapseRequest request, JobContext context) throws ProcessingException {
    if (request.frames().isEmpty()) {
      throw new InsufficientDataException("no frames to encode");
    }
    if (!runner.isInstalled("ffmpeg")) {
      throw new ToolFailureException("ffmpeg", "not installed", "");
    }
    Path base = baseOutput(request.output());
    List<Path> outputs = new ArrayList<>();
    List<String> failed = new ArrayList<>();
    try (ScratchDirectory scratch = ScratchDirectory.create("photonic-timelapse-")) {
      Path parent = base.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      String pattern = stageFrames(request.frames(), scratch);
      for (String format : request.formats()) {
        context.throwIfCancelled();
        String normalized = format.trim().toLowerCase(Locale.ROOT);
        if (!SUPPORTED_FORMATS.contains(normalized)) {
          failed.add(format + ": unsupported format");
          continue;
        }
        Path output = outputFor(base, normalized);
        ToolOutcome outcome = runner.run(command(pattern, output, normalized, request.fps(), request.resolution()), context);
        if (outcome.succeeded() && Files.isRegularFile(output)) {
          outputs.add(output);
          log.info("Encoded {} frames as {} into {}", request.frames().size(), normalized, output);
        } else {
          failed.add(normalized + ": ffmpeg exited with status " + outcome.exitCode());
          log.warn("ffmpeg failed for {}: {}", normalized, Logs.tail(outcome.output(), 512));
        }
      }
    } catch (IOException ex) {
      throw new ToolFailureException("ffmpeg", "cannot encode timelapse: " + ex.getMessage(), ex);
    }
    if (outputs.isEmpty()) {
      throw new ProcessingException("failed to generate any output formats: " + String.join("; ", failed));
    }
    return new TimelapseResult(outputs, request.frames().size(), failed);
  }

  private static String stageFrames(List<Path> frames, ScratchDirectory scratch) throws IOException {
    String ext = ImageFiles.extension(frames.get(0));
    for (int i = 0; i < frames.size(); i++) {
      Path frame = frames.get(i).toAbsolutePath();
      Path staged = scratch.resolve(String.format(Locale.ROOT, "frame_%06d.%s", i, ext));
      try {
        Files.createSymbolicLink(staged, frame);
      } catch (IOException | UnsupportedOperationException ex) {
        log.debug("Symlink unavailable for {}; copying", frame);
        Files.copy(frame, staged, StandardCopyOption.REPLACE_EXISTING);
      }
    }
    return scratch.resolve("frame_*." + ext).toString();
  }

  static Path baseOutput(Path requested) {
    if (Files.isDirectory(requested) || ImageFiles.extension(requested).isEmpty()) {
      return requested.resolve(DEFAULT_BASE_NAME);
    }
    String stem = ImageFiles.stem(requested);
    return requested.resolveSibling(stem);
  }

  static Path outputFor(Path base, String format) {
    String stem = base.getFileName().toString();
    String name =
        switch (format) {
          case "mp4" -> stem + ".mp4";
          case "mp4-h265" -> stem + "-h265.mp4";
          case "3gp" -> stem + "-compatible.3gp";
          case "3gp-h264" -> stem + "-h264.3gp";
          case "3gp-mobile" -> stem + "-mobile.3gp";
          case "gif" -> stem + ".gif";
          default -> throw new IllegalArgumentException("unsupported format: " + format);
        };
    return base.resolveSibling(name);
  }

  static ToolCommand command(String pattern, Path output, String format, int fps, String resolution) {
    List<String> argv =
        new ArrayList<>(List.of("ffmpeg", "-y", "-pattern_type", "glob", "-i", pattern, "-r", Integer.toString(fps)));
    switch (format) {
      case "mp4" -> {
        argv.addAll(
            List.of(
                "-c:v", "libx264", "-profile:v", "high444", "-level", "4.0", "-pix_fmt", "yuvj444p",
                "-b:v", "7600k", "-maxrate", "8000k", "-bufsize", "8000k"));
        addScale(argv, resolution);
      }
      case "mp4-h265" -> {
        argv.addAll(List.of("-c:v", "libx265", "-preset", "medium", "-crf", "28", "-pix_fmt", "yuv420p"));
        addScale(argv, resolution);
      }
      case "3gp" -> {
        argv.addAll(
            List.of(
                "-c:v", "mpeg4", "-profile:v", "0", "-level", "3", "-vtag", "mp4v", "-b:v", "960k",
                "-maxrate", "1200k", "-bufsize", "1200k", "-pix_fmt", "yuv420p", "-f", "3gp", "-brand", "3gp4"));
        addScale(argv, resolution);
      }
      case "3gp-h264" -> argv.addAll(
          List.of(
              "-c:v", "libx264", "-profile:v", "baseline", "-level", "3.0", "-b:v", "800k",
              "-maxrate", "1200k", "-bufsize", "1200k", "-vf", "scale=480:320"));
      case "3gp-mobile" -> argv.addAll(
          List.of(
              "-c:v", "mpeg4", "-profile:v", "0", "-level", "1", "-vtag", "mp4v", "-b:v", "300k",
              "-maxrate", "400k", "-bufsize", "400k", "-pix_fmt", "yuv420p", "-vf", "scale=320:240",
              "-r", "12", "-f", "3gp", "-brand", "3gp4"));
      case "gif" -> argv.addAll(
          List.of(
              "-vf",
              "fps=" + fps
                  + ",scale=480:480:force_original_aspect_ratio=decrease:flags=lanczos,pad=480:480:(ow-iw)/2:(oh-ih)/2"));
      default -> throw new IllegalArgumentException("unsupported format: " + format);
    }
    argv.add(output.toString());
    return ToolCommand.of(argv);
  }

  private static void addScale(List<String> argv, String resolution) {
    if (resolution != null && !resolution.isBlank()) {
      argv.add("-vf");
      argv.add(scaleFilter(resolution));
    }
  }

  static String scaleFilter(String resolution) {
    return switch (resolution.trim().toLowerCase(Locale.ROOT)) {
      case "720p" -> "scale=1280:720";
      case "480p" -> "scale=854:480";
      case "240p" -> "scale=426:240";
      default -> "scale=1920:1080";
    };
  }
}
