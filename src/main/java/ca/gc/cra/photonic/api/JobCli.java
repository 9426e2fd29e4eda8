package ca.gc.cra.photonic.api;

import ca.gc.cra.photonic.application.pipeline.JobCompletionWaiter;
import ca.gc.cra.photonic.application.pipeline.JobPipeline;
import ca.gc.cra.photonic.application.pipeline.JobRejectedException;
import ca.gc.cra.photonic.config.CompositionRoot;
import ca.gc.cra.photonic.config.ConfigMerger;
import ca.gc.cra.photonic.config.DefaultsForMode;
import ca.gc.cra.photonic.config.PipelineConfig;
import ca.gc.cra.photonic.config.YamlConfigLoader;
import ca.gc.cra.photonic.domain.job.Job;
import ca.gc.cra.photonic.domain.job.JobId;
import ca.gc.cra.photonic.domain.job.JobOptions;
import ca.gc.cra.photonic.domain.job.JobResult;
import ca.gc.cra.photonic.domain.job.JobType;
import ca.gc.cra.photonic.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.photonic.logging.LoggingConfigurator;
import ca.gc.cra.photonic.logging.Logs;
import ca.gc.cra.photonic.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one job from the command line: {@code photonic <type> in=PATH out=PATH [key=value...]}.
 *
 * <p>Arguments are split into configuration keys ({@link PipelineConfig#KEYS}), merged with the YAML file
 * and defaults, and job options, parsed by {@link JobOptionsParser}. The job then runs through a fresh
 * {@link JobPipeline}; the command waits for its result and prints the result metadata.
 *
 * @since 0.1.0
 */
public final class JobCli {
  private static final Logger log = LoggerFactory.getLogger(JobCli.class);
  private static final int MAX_VALUE_PRINT_BYTES = 512;

  private JobCli() {}

  /**
   * Runs a job with the process environment and the production composition root.
   *
   * @param type job type
   * @param args arguments after the job type
   * @return exit status
   */
  static ExitCode run(JobType type, String[] args) {
    return run(type, args, System.getenv(), CompositionRoot::new);
  }

  static ExitCode run(
      JobType type,
      String[] args,
      Map<String, String> environment,
      Function<PipelineConfig, CompositionRoot> rootFactory) {
    Objects.requireNonNull(type, "type");
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(helpText(type));
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {}", type.wireName());
    } else if (input.quiet()) {
      LoggingConfigurator.enableQuietLogging();
    }

    Map<String, String> kv;
    Optional<Path> configPath;
    Path inputPath;
    Path outputPath;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
      configPath = ConfigCliUtils.extractConfigPath(kv, environment);
      String in = kv.remove("in");
      String out = kv.remove("out");
      if (in == null || in.isBlank()) {
        throw new IllegalArgumentException("in=PATH is required");
      }
      if ((out == null || out.isBlank()) && type != JobType.SCAN) {
        throw new IllegalArgumentException("out=PATH is required");
      }
      inputPath = Paths.requireReadable("in", Path.of(in));
      outputPath = out == null || out.isBlank() ? inputPath : Path.of(out).toAbsolutePath().normalize();
      if (input.hasFlag("--no-cache") && JobOptionsParser.keysFor(type).contains("noCache")) {
        kv.put("noCache", "true");
      }
      if (input.hasFlag("--astro") && type == JobType.STACK) {
        kv.put("astroMode", "true");
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage(type));
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> cliConfig = ConfigCliUtils.extractConfigKeys(kv);
    PipelineConfig config;
    Map<String, String> effective;
    try {
      Optional<Map<String, String>> yaml = Optional.empty();
      if (configPath.isPresent()) {
        yaml = YamlConfigLoader.load(configPath.get(), type);
        if (yaml.isEmpty()) {
          log.warn("Configuration file {} not found; using defaults", configPath.get());
        }
      }
      effective = ConfigMerger.buildEffectiveConfig(
          type.wireName(), yaml, cliConfig, DefaultsForMode.asFlatMap(type.wireName()), log::warn);
      config = PipelineConfig.fromMap(effective);
    } catch (IOException ex) {
      log.error("Unable to read configuration {}", configPath.map(Path::toString).orElse(""), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    JobOptions options;
    try {
      options = JobOptionsParser.parse(type, kv, config.raw());
      Paths.requireWritableTarget("out", outputPath, !input.hasFlag("--dry-run"));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} options: {}", type.wireName(), ex.getMessage());
      CliPrinter.println(usage(type));
      return ExitCode.INVALID_ARGS;
    }

    Job job = new Job(JobId.random(), type, inputPath, outputPath, options);
    if (input.hasFlag("--dry-run")) {
      printDryRunPlan(job, config);
      return ExitCode.SUCCESS;
    }

    if (!config.metricsDisabled()) {
      try {
        TelemetryConfigurator.configureMetrics(config.metricsExporter(), effective);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid telemetry configuration: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      }
    }

    CompositionRoot root = rootFactory.apply(config);
    try {
      return execute(root, job);
    } finally {
      if (root.metrics() instanceof OpenTelemetryMetricsAdapter otel) {
        otel.close();
      }
    }
  }

  private static ExitCode execute(CompositionRoot root, Job job) {
    try (JobPipeline pipeline = root.newPipeline()) {
      pipeline.start();
      log.info("Running {} job {} on {}", job.type().wireName(), job.id(), job.inputPath());
      Optional<JobResult> result =
          new JobCompletionWaiter(pipeline).submitAndAwait(job, root.config().jobTimeout());
      if (result.isEmpty()) {
        log.error("Job {} did not finish within {}", job.id(), root.config().jobTimeout());
        return ExitCode.RUNTIME_FAILURE;
      }
      printResult(result.get());
      return result.get().isSuccess() ? ExitCode.SUCCESS : ExitCode.RUNTIME_FAILURE;
    } catch (JobRejectedException ex) {
      log.error("Job {} rejected ({}): {}", job.id(), ex.reason(), ex.getMessage());
      return ExitCode.RUNTIME_FAILURE;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Interrupted while waiting for job {}", job.id(), ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure running job {}", job.id(), ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static void printResult(JobResult result) {
    List<String> lines = new ArrayList<>();
    lines.add("Job " + result.jobId() + " " + result.status().wireName());
    for (Map.Entry<String, Object> entry : result.metadata().entrySet()) {
      lines.add(" " + entry.getKey() + ": " + Logs.truncate(String.valueOf(entry.getValue()), MAX_VALUE_PRINT_BYTES));
    }
    if (!result.isSuccess()) {
      lines.add(" error: " + result.errorMessage());
    }
    CliPrinter.printLines(lines.toArray(String[]::new));
  }

  private static void printDryRunPlan(Job job, PipelineConfig config) {
    CliPrinter.printLines(
        "Dry-run: the job will not be executed.",
        " Job type         : " + job.type().wireName(),
        " Input            : " + job.inputPath(),
        " Output           : " + job.outputPath(),
        " Options          : " + Logs.truncate(job.options().toMap().toString(), MAX_VALUE_PRINT_BYTES),
        " Workers          : " + config.workers(),
        " RAW default tool : " + (config.raw().defaultTool().isEmpty() ? "<none>" : config.raw().defaultTool()),
        " Journal          : " + config.journal().map(Path::toString).orElse("<disabled>"),
        " Metrics exporter : " + config.metricsExporter(),
        " Re-run without --dry-run to start processing.");
  }

  static String usage(JobType type) {
    String out = type == JobType.SCAN ? "[out=PATH]" : "out=PATH";
    return "usage: photonic " + type.wireName() + " in=PATH " + out + " [config=FILE] "
        + String.join(" ", new TreeSet<>(JobOptionsParser.keysFor(type)).stream().map(key -> "[" + key + "=...]").toList())
        + " [--dry-run] [--verbose|--quiet]";
  }

  private static String helpText(JobType type) {
    return """
        photonic %s

        Usage:
          %s

        Configuration keys (also accepted on the command line):
          workers=1-64 subscriberBuffer=N journal=DIR timeout=SECONDS
          metricsExporter=otlp|none otelEndpoint=URL otelResourceAttributes=K=V,...
          raw.defaultTool=NAME raw.<tool>.enabled=true|false alignment.<type>.enabled=true|false

        Flags:
          --dry-run   Validate inputs and print the plan without running the job
          --no-cache  Reconvert RAW files even when a cached conversion exists
          --verbose   Enable DEBUG logging
          --quiet     Log warnings and errors only
          --help      Show this message
        """.formatted(type.wireName(), usage(type)).stripTrailing();
  }
}
