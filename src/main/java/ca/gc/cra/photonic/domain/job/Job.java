package ca.gc.cra.photonic.domain.job;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable unit of pipeline work.
 *
 * @param id identifier unique within a pipeline's lifetime
 * @param type job kind; must match {@code options.jobType()}
 * @param inputPath input file or directory
 * @param outputPath output file or directory
 * @param options typed options for {@code type}
 * @since 0.1.0
 */
public record Job(JobId id, JobType type, Path inputPath, Path outputPath, JobOptions options) {

  /**
   * Validates that every component is present and that the options belong to the job type.
   *
   * @throws IllegalArgumentException when the options variant does not match {@code type}
   */
  public Job {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(inputPath, "inputPath");
    Objects.requireNonNull(outputPath, "outputPath");
    Objects.requireNonNull(options, "options");
    if (options.jobType() != type) {
      throw new IllegalArgumentException(
          "options for " + options.jobType() + " cannot be used with a " + type + " job");
    }
  }

  /**
   * Creates a job whose type is derived from the options variant.
   *
   * @param id job identifier
   * @param inputPath input file or directory
   * @param outputPath output file or directory
   * @param options typed options
   * @return new job
   */
  public static Job of(JobId id, Path inputPath, Path outputPath, JobOptions options) {
    Objects.requireNonNull(options, "options");
    return new Job(id, options.jobType(), inputPath, outputPath, options);
  }

  /**
   * Returns the options cast to the expected variant.
   *
   * @param variant expected options class
   * @param <T> options type
   * @return options as {@code variant}
   * @throws IllegalStateException when the options are of a different variant
   */
  public <T extends JobOptions> T optionsAs(Class<T> variant) {
    if (!variant.isInstance(options)) {
      throw new IllegalStateException(
          "job " + id + " carries " + options.getClass().getSimpleName() + ", not " + variant.getSimpleName());
    }
    return variant.cast(options);
  }
}
