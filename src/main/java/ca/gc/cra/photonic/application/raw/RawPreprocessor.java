package ca.gc.cra.photonic.application.raw;

import ca.gc.cra.photonic.application.port.JobContext;
import ca.gc.cra.photonic.application.selection.RawProcessorRegistry;
import ca.gc.cra.photonic.application.util.ImageFiles;
import ca.gc.cra.photonic.domain.error.JobCancelledException;
import ca.gc.cra.photonic.domain.error.ProcessingException;
import ca.gc.cra.photonic.domain.raw.RawConvertRequest;
import ca.gc.cra.photonic.domain.raw.RawConvertResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Converts the RAW files of an input directory into {@code processed/<name>.jpg}.
 * <p><strong>Why:</strong> Stitchers and encoders cannot read camera RAW; converting once and caching the
 * result keeps repeated jobs on the same shoot cheap.</p>
 * <p><strong>Cache rule:</strong> an existing {@code processed/<name>.jpg} is reused when its modification
 * time is at or after the RAW file's, unless the caller asks to ignore the cache.</p>
 * <p><strong>Failures:</strong> a RAW file that no converter can handle is logged and left out; the job
 * continues with what converted.</p>
 *
 * @since 0.1.0
 */
public final class RawPreprocessor {
  private static final Logger log = LoggerFactory.getLogger(RawPreprocessor.class);

  /** Cache directory created inside the input directory. */
  public static final String CACHE_DIR = "processed";

  private static final int DEFAULT_QUALITY = 90;

  private final RawProcessorRegistry registry;

  /**
   * Outcome of preparing a directory.
   *
   * @param images working images: raster originals plus converted RAW files, sorted
   * @param converted RAW files converted during this call
   * @param cached RAW files served from the cache
   * @param failed RAW files no converter could handle
   */
  public record Prepared(List<Path> images, int converted, int cached, List<Path> failed) {
    public Prepared {
      images = List.copyOf(images);
      failed = List.copyOf(failed);
    }
  }

  /**
   * Creates the preprocessor.
   *
   * @param registry RAW fallback chain
   */
  public RawPreprocessor(RawProcessorRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  /**
   * Prepares the images of {@code inputDir} for a downstream tool.
   *
   * @param inputDir directory holding the shoot
   * @param preferredTool converter to try first; blank for the configured chain
   * @param ignoreCache reconvert even when a fresh cache entry exists
   * @param context cancellation signal
   * @return working images and conversion counts
   * @throws ProcessingException when the directory cannot be read or the job is cancelled
   */
  public Prepared prepare(Path inputDir, String preferredTool, boolean ignoreCache, JobContext context)
      throws ProcessingException {
    List<Path> listed;
    try {
      listed = ImageFiles.list(inputDir);
    } catch (IOException ex) {
      throw new ProcessingException("cannot list images in " + inputDir + ": " + ex.getMessage(), ex);
    }
    List<Path> images = new ArrayList<>();
    List<Path> raws = new ArrayList<>();
    for (Path file : listed) {
      if (ImageFiles.isRaw(file)) {
        raws.add(file);
      } else {
        images.add(file);
      }
    }
    if (raws.isEmpty()) {
      return new Prepared(images, 0, 0, List.of());
    }

    Path cacheDir = inputDir.resolve(CACHE_DIR);
    try {
      Files.createDirectories(cacheDir);
    } catch (IOException ex) {
      throw new ProcessingException("failed to create cache directory " + cacheDir + ": " + ex.getMessage(), ex);
    }

    int converted = 0;
    int cached = 0;
    List<Path> failed = new ArrayList<>();
    for (int i = 0; i < raws.size(); i++) {
      context.throwIfCancelled();
      Path raw = raws.get(i);
      Path target = cacheDir.resolve(ImageFiles.stem(raw) + ".jpg");
      if (!ignoreCache && isCacheValid(raw, target)) {
        images.add(target);
        cached++;
        continue;
      }
      log.info("Converting RAW {} ({}/{})", raw.getFileName(), i + 1, raws.size());
      try {
        RawConvertResult result =
            registry.convertWithFallback(new RawConvertRequest(raw, target, DEFAULT_QUALITY), preferredTool, context);
        images.add(result.output() == null ? target : result.output());
        converted++;
      } catch (JobCancelledException cancelled) {
        throw cancelled;
      } catch (ProcessingException ex) {
        failed.add(raw);
        log.warn("Skipping RAW {}: {}", raw.getFileName(), ex.getMessage());
      }
    }
    images.sort(null);
    log.info(
        "RAW preprocessing of {}: {} converted, {} cached, {} failed",
        inputDir,
        converted,
        cached,
        failed.size());
    return new Prepared(images, converted, cached, failed);
  }

  static boolean isCacheValid(Path raw, Path cached) {
    if (!Files.isRegularFile(cached)) {
      return false;
    }
    try {
      FileTime rawTime = Files.getLastModifiedTime(raw);
      FileTime cachedTime = Files.getLastModifiedTime(cached);
      return cachedTime.compareTo(rawTime) >= 0;
    } catch (IOException ex) {
      log.debug("Cannot compare timestamps of {} and {}: {}", raw, cached, ex.getMessage());
      return false;
    }
  }
}
