package ca.gc.cra.photonic.application.pipeline;

import ca.gc.cra.photonic.application.port.AlignmentProcessor;
import ca.gc.cra.photonic.application.port.JobContext;
import ca.gc.cra.photonic.application.port.JobProcessor;
import ca.gc.cra.photonic.application.port.PanoramaAssembler;
import ca.gc.cra.photonic.application.port.StackingProcessor;
import ca.gc.cra.photonic.application.port.TimelapseBuilder;
import ca.gc.cra.photonic.application.raw.RawPreprocessor;
import ca.gc.cra.photonic.application.scan.ImageScanner;
import ca.gc.cra.photonic.application.selection.ProcessorRegistry;
import ca.gc.cra.photonic.application.selection.RawProcessorRegistry;
import ca.gc.cra.photonic.application.util.ImageFiles;
import ca.gc.cra.photonic.domain.align.AlignmentRequest;
import ca.gc.cra.photonic.domain.align.AlignmentResult;
import ca.gc.cra.photonic.domain.align.AlignmentType;
import ca.gc.cra.photonic.domain.error.InsufficientDataException;
import ca.gc.cra.photonic.domain.error.JobCancelledException;
import ca.gc.cra.photonic.domain.error.ProcessingException;
import ca.gc.cra.photonic.domain.job.AlignOptions;
import ca.gc.cra.photonic.domain.job.Job;
import ca.gc.cra.photonic.domain.job.JobResult;
import ca.gc.cra.photonic.domain.job.PanoramicOptions;
import ca.gc.cra.photonic.domain.job.RawConvertOptions;
import ca.gc.cra.photonic.domain.job.ScanOptions;
import ca.gc.cra.photonic.domain.job.StackOptions;
import ca.gc.cra.photonic.domain.job.TimelapseOptions;
import ca.gc.cra.photonic.domain.media.PanoramaRequest;
import ca.gc.cra.photonic.domain.media.PanoramaResult;
import ca.gc.cra.photonic.domain.media.TimelapseRequest;
import ca.gc.cra.photonic.domain.media.TimelapseResult;
import ca.gc.cra.photonic.domain.raw.RawConvertRequest;
import ca.gc.cra.photonic.domain.raw.RawConvertResult;
import ca.gc.cra.photonic.domain.stack.StackMethod;
import ca.gc.cra.photonic.domain.stack.StackRequest;
import ca.gc.cra.photonic.domain.stack.StackResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns one job into one result by dispatching on its type.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Prepare inputs: list images and pre-convert RAW files for timelapse, panorama, and stacking.</li>
 *   <li>Pick the processor through the matching registry and run it.</li>
 *   <li>Package diagnostics into result metadata; expected failures become failed results.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from injected collaborators; shared by all workers.</p>
 *
 * @since 0.1.0
 */
public final class JobRouter implements JobProcessor {
  private static final Logger log = LoggerFactory.getLogger(JobRouter.class);

  /** Directory under the output parent that receives pre-aligned frames for stacking. */
  public static final String ALIGNED_DIR = "aligned";

  private final ImageScanner scanner;
  private final RawPreprocessor rawPreprocessor;
  private final RawProcessorRegistry rawProcessors;
  private final ProcessorRegistry<AlignmentType, AlignmentProcessor> aligners;
  private final ProcessorRegistry<StackMethod, StackingProcessor> stackers;
  private final TimelapseBuilder timelapseBuilder;
  private final PanoramaAssembler panoramaAssembler;

  /**
   * Creates a router.
   *
   * @param scanner directory scanner
   * @param rawProcessors RAW fallback chain
   * @param aligners alignment registry
   * @param stackers stacking registry
   * @param timelapseBuilder video encoder
   * @param panoramaAssembler stitcher
   */
  public JobRouter(
      ImageScanner scanner,
      RawProcessorRegistry rawProcessors,
      ProcessorRegistry<AlignmentType, AlignmentProcessor> aligners,
      ProcessorRegistry<StackMethod, StackingProcessor> stackers,
      TimelapseBuilder timelapseBuilder,
      PanoramaAssembler panoramaAssembler) {
    this.scanner = Objects.requireNonNull(scanner, "scanner");
    this.rawProcessors = Objects.requireNonNull(rawProcessors, "rawProcessors");
    this.rawPreprocessor = new RawPreprocessor(rawProcessors);
    this.aligners = Objects.requireNonNull(aligners, "aligners");
    this.stackers = Objects.requireNonNull(stackers, "stackers");
    this.timelapseBuilder = Objects.requireNonNull(timelapseBuilder, "timelapseBuilder");
    this.panoramaAssembler = Objects.requireNonNull(panoramaAssembler, "panoramaAssembler");
  }

  @Override
  public JobResult process(Job job, JobContext context) {
    Map<String, Object> meta = new LinkedHashMap<>();
    try {
      context.throwIfCancelled();
      switch (job.type()) {
        case SCAN -> scan(job, meta);
        case TIMELAPSE -> timelapse(job, context, meta);
        case PANORAMIC -> panoramic(job, context, meta);
        case STACK -> stack(job, context, meta);
        case ALIGN -> align(job, context, meta);
        case RAW_CONVERT -> rawConvert(job, context, meta);
      }
      return JobResult.success(job, meta);
    } catch (JobCancelledException ex) {
      return JobResult.failure(job, ex, meta);
    } catch (ProcessingException ex) {
      log.debug("{} job {} failed", job.type(), job.id(), ex);
      return JobResult.failure(job, ex, meta);
    }
  }

  private void scan(Job job, Map<String, Object> meta) throws ProcessingException {
    ScanOptions options = job.optionsAs(ScanOptions.class);
    ImageScanner.ScanReport report;
    try {
      report = scanner.scan(job.inputPath(), options);
    } catch (IOException ex) {
      throw new ProcessingException("cannot scan " + job.inputPath() + ": " + ex.getMessage(), ex);
    }
    List<Map<String, Object>> groups = new ArrayList<>();
    for (ImageScanner.ImageGroup group : report.groups()) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("groupType", group.groupType());
      entry.put("basePath", group.basePath().toString());
      entry.put("count", group.count());
      entry.put("detection", group.detection());
      groups.add(entry);
    }
    meta.put("images", report.images().size());
    meta.put("groups", groups);
  }

  private void timelapse(Job job, JobContext context, Map<String, Object> meta) throws ProcessingException {
    TimelapseOptions options = job.optionsAs(TimelapseOptions.class);
    List<Path> frames = prepare(job, options.rawTool(), options.noCache(), context);
    requireImages(frames, 1, job);
    TimelapseResult result =
        timelapseBuilder.build(
            new TimelapseRequest(frames, job.outputPath(), options.fps(), options.formats(), options.resolution()),
            context);
    meta.put("outputFiles", result.outputs().stream().map(Path::toString).toList());
    meta.put("frameCount", result.frameCount());
    meta.put("formats", options.formats());
    meta.put("failedFormats", result.failedFormats());
  }

  private void panoramic(Job job, JobContext context, Map<String, Object> meta) throws ProcessingException {
    PanoramicOptions options = job.optionsAs(PanoramicOptions.class);
    List<Path> images = prepare(job, options.rawTool(), options.noCache(), context);
    requireImages(images, 2, job);
    PanoramaResult result =
        panoramaAssembler.assemble(
            new PanoramaRequest(
                images,
                job.outputPath(),
                options.projection(),
                options.blending(),
                options.quality(),
                options.aggression()),
            context);
    meta.put("output", result.output().toString());
    meta.put("projection", options.projection());
    meta.put("blending", options.blending());
    meta.put("quality", options.quality());
    meta.put("aggression", options.aggression());
    meta.put("imageCount", result.imageCount());
    meta.put("toolUsed", result.tool());
    meta.put("warnings", result.warnings());
  }

  private void stack(Job job, JobContext context, Map<String, Object> meta) throws ProcessingException {
    StackOptions options = job.optionsAs(StackOptions.class);
    List<Path> images = prepare(job, options.rawTool(), options.noCache(), context);
    requireImages(images, 2, job);

    boolean aligned = false;
    if (options.requiresPreAlignment()) {
      AlignmentType type = alignmentTypeFor(options.alignment());
      Path alignedDir = alignedDirectory(job);
      log.info("Aligning {} images ({}) into {} before stacking", images.size(), type, alignedDir);
      AlignmentProcessor aligner = aligners.select(type, images, "");
      AlignmentResult alignment;
      try {
        alignment =
            aligner.align(
                new AlignmentRequest(images, alignedDir, type, "normal", AlignOptions.DEFAULT_STAR_THRESHOLD),
                context);
      } catch (JobCancelledException ex) {
        throw ex;
      } catch (ProcessingException ex) {
        throw new ProcessingException("alignment failed: " + ex.getMessage(), ex);
      }
      if (!alignment.success()) {
        throw new ProcessingException("alignment failed: " + String.join("; ", alignment.warnings()));
      }
      images = alignment.alignedImages();
      aligned = true;
      meta.put("alignmentTool", alignment.tool());
    }

    StackingProcessor stacker = stackers.select(options.method(), images, options.processor());
    StackResult result =
        stacker.stack(
            new StackRequest(images, job.outputPath(), options.method(), options.parameters(), options.astroMode()),
            context);
    if (!result.success()) {
      throw new ProcessingException(stacker.name() + " reported an unsuccessful stack");
    }
    meta.put("output", result.output() == null ? "" : result.output().toString());
    meta.put("method", result.method().wireName());
    meta.put("imageCount", result.imageCount());
    meta.put("rejectedPixels", result.rejectedPixels());
    meta.put("processingTimeMillis", result.elapsed().toMillis());
    meta.put("cosmicRayCount", result.cosmicRayEstimate());
    meta.put("signalToNoise", result.signalToNoise());
    meta.put("tool", result.tool());
    meta.put("aligned", aligned);
    meta.put("warnings", result.warnings());
  }

  private void align(Job job, JobContext context, Map<String, Object> meta) throws ProcessingException {
    AlignOptions options = job.optionsAs(AlignOptions.class);
    List<Path> images = options.images();
    if (images.isEmpty()) {
      images = listImages(job.inputPath());
    }
    AlignmentType type = options.requestedType().orElse(AlignmentType.infer(images.size()));
    meta.put("type", type.wireName());
    meta.put("starThreshold", options.starThreshold());
    AlignmentProcessor aligner = aligners.select(type, images, options.processor());
    AlignmentResult result =
        aligner.align(
            new AlignmentRequest(images, job.outputPath(), type, options.quality(), options.starThreshold()), context);
    meta.put("tool", result.tool());
    meta.put("success", result.success());
    meta.put("warn", result.warnings());
    meta.put("alignedImages", result.alignedImages().stream().map(Path::toString).toList());
    meta.put("referenceStars", result.referenceStars());
    meta.put("matchedStars", result.matchedStars());
    if (!result.success()) {
      throw new ProcessingException(result.tool() + " could not align the images");
    }
  }

  private void rawConvert(Job job, JobContext context, Map<String, Object> meta) throws ProcessingException {
    RawConvertOptions options = job.optionsAs(RawConvertOptions.class);
    Path input = job.inputPath();
    if (!Files.isDirectory(input)) {
      Path output = singleOutput(input, job.outputPath(), options.outputFormat());
      RawConvertResult result =
          rawProcessors.convertWithFallback(new RawConvertRequest(input, output, options.quality()), options.tool(), context);
      meta.put("converted", List.of(result.output().toString()));
      meta.put("tools", List.of(result.tool()));
      meta.put("failed", List.of());
      return;
    }

    List<Path> raws = listImages(input).stream().filter(ImageFiles::isRaw).toList();
    if (raws.isEmpty()) {
      throw new InsufficientDataException("no RAW files found in " + input);
    }
    List<String> converted = new ArrayList<>();
    List<String> tools = new ArrayList<>();
    List<String> failed = new ArrayList<>();
    for (Path raw : raws) {
      context.throwIfCancelled();
      Path output = job.outputPath().resolve(ImageFiles.stem(raw) + "." + options.outputFormat());
      try {
        RawConvertResult result =
            rawProcessors.convertWithFallback(new RawConvertRequest(raw, output, options.quality()), options.tool(), context);
        converted.add(result.output().toString());
        tools.add(result.tool());
      } catch (JobCancelledException ex) {
        throw ex;
      } catch (ProcessingException ex) {
        failed.add(raw.getFileName() + ": " + ex.getMessage());
        log.warn("RAW conversion failed for {}", raw.getFileName());
      }
    }
    meta.put("converted", converted);
    meta.put("tools", tools);
    meta.put("failed", failed);
    if (converted.isEmpty()) {
      throw new ProcessingException("no RAW files could be converted in " + input);
    }
  }

  private List<Path> prepare(Job job, String rawTool, boolean noCache, JobContext context)
      throws ProcessingException {
    Path input = job.inputPath();
    if (!Files.isDirectory(input)) {
      throw new ProcessingException("input is not a directory: " + input);
    }
    if (!rawProcessors.hasAvailableProcessor()) {
      return listImages(input).stream().filter(p -> !ImageFiles.isRaw(p)).toList();
    }
    return rawPreprocessor.prepare(input, rawTool, noCache, context).images();
  }

  private static List<Path> listImages(Path dir) throws ProcessingException {
    try {
      return ImageFiles.list(dir);
    } catch (IOException ex) {
      throw new ProcessingException("cannot list images in " + dir + ": " + ex.getMessage(), ex);
    }
  }

  private static void requireImages(List<Path> images, int minimum, Job job) throws InsufficientDataException {
    if (images.size() < minimum) {
      throw new InsufficientDataException(
          job.type() + " needs at least " + minimum + " image(s), found " + images.size() + " in " + job.inputPath());
    }
  }

  static AlignmentType alignmentTypeFor(String alignment) throws ProcessingException {
    String normalized = alignment.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "star", "astro" -> AlignmentType.ASTRO;
      case "feature", "general" -> AlignmentType.GENERAL;
      case "panoramic" -> AlignmentType.PANORAMIC;
      case "timelapse" -> AlignmentType.TIMELAPSE;
      default -> throw new ProcessingException("unknown alignment mode: " + alignment);
    };
  }

  static Path alignedDirectory(Job job) {
    Path output = job.outputPath().toAbsolutePath();
    Path parent = output.getParent() == null ? output : output.getParent();
    Path inputName = job.inputPath().toAbsolutePath().normalize().getFileName();
    return parent.resolve(ALIGNED_DIR).resolve(inputName == null ? "input" : inputName.toString());
  }

  private static Path singleOutput(Path input, Path requested, String format) {
    if (Files.isDirectory(requested) || ImageFiles.extension(requested).isEmpty()) {
      return requested.resolve(ImageFiles.stem(input) + "." + format);
    }
    return requested;
  }
}
