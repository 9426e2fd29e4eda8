package ca.gc.cra.photonic.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import ca.gc.cra.photonic.application.port.ClockPort;
import ca.gc.cra.photonic.application.port.MetricsPort;
import ca.gc.cra.photonic.config.CompositionRoot;
import ca.gc.cra.photonic.config.PipelineConfig;
import ca.gc.cra.photonic.domain.job.Job;
import ca.gc.cra.photonic.domain.job.JobId;
import ca.gc.cra.photonic.domain.job.JobResult;
import ca.gc.cra.photonic.domain.job.JobType;
import ca.gc.cra.photonic.domain.job.ScanOptions;
import ca.gc.cra.photonic.testutil.ScriptedToolRunner;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class JobCliTest {
  private static final Function<PipelineConfig, CompositionRoot> UNUSED_ROOT = config -> {
    fail("composition root must not be built");
    return null;
  };

  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;
  private boolean originalAdditive;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(JobCli.class);
    originalLevel = logger.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
      appender.stop();
      logger.setAdditive(originalAdditive);
      logger.setLevel(originalLevel);
    }
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingInputReturnsUsageAndInvalidArgs() {
    ExitCode code = JobCli.run(JobType.STACK, new String[] {"out=" + tempDir.resolve("out.tif")}, Map.of(), UNUSED_ROOT);

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: photonic stack"));
    assertTrue(loggedError("in=PATH is required"));
  }

  @Test
  void nonexistentInputReturnsInvalidArgs() {
    ExitCode code = JobCli.run(JobType.TIMELAPSE, new String[] {
        "in=" + tempDir.resolve("missing"), "out=" + tempDir.resolve("movie")}, Map.of(), UNUSED_ROOT);

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void unknownOptionReturnsInvalidArgs() throws IOException {
    Path input = Files.createDirectories(tempDir.resolve("frames"));

    ExitCode code = JobCli.run(JobType.STACK, new String[] {
        "in=" + input, "out=" + tempDir.resolve("out.tif"), "methd=median"}, Map.of(), UNUSED_ROOT);

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(loggedError("unknown option(s) for stack: methd"));
  }

  @Test
  void invalidConfigurationReturnsConfigError() throws IOException {
    Path input = Files.createDirectories(tempDir.resolve("frames"));

    ExitCode code = JobCli.run(JobType.STACK, new String[] {
        "in=" + input, "out=" + tempDir.resolve("out.tif"), "workers=0"}, Map.of(), UNUSED_ROOT);

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void yamlFromEnvironmentIsApplied() throws IOException {
    Path input = Files.createDirectories(tempDir.resolve("frames"));
    Path yaml = tempDir.resolve("photonic.yaml");
    Files.writeString(yaml, """
        stack:
          workers: 3
          metricsExporter: none
        """);
    Path output = tempDir.resolve("result").resolve("out.tif");

    ExitCode code = JobCli.run(JobType.STACK, new String[] {
        "in=" + input, "out=" + output, "method=median", "--dry-run"},
        Map.of(ConfigCliUtils.CONFIG_ENV, yaml.toString()), UNUSED_ROOT);

    assertEquals(ExitCode.SUCCESS, code);
    String text = buffer.toString();
    assertTrue(text.contains("Dry-run: the job will not be executed."));
    assertTrue(text.contains(" Workers          : 3"));
    assertTrue(text.contains(" Metrics exporter : none"));
    assertTrue(text.contains("method=median"));
    assertFalse(Files.exists(output.getParent()), "dry-run should not create the output directory");
  }

  @Test
  void astroFlagEnablesAstroModeInPlan() throws IOException {
    Path input = Files.createDirectories(tempDir.resolve("frames"));

    ExitCode code = JobCli.run(JobType.STACK, new String[] {
        "in=" + input, "out=" + tempDir.resolve("out.tif"), "--astro", "--dry-run"}, Map.of(), UNUSED_ROOT);

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("astroMode=true"));
  }

  @Test
  void helpPrintsCommandUsage() {
    ExitCode code = JobCli.run(JobType.ALIGN, new String[] {"--help"}, Map.of(), UNUSED_ROOT);

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("photonic align"));
    assertTrue(buffer.toString().contains("[starThreshold=...]"));
  }

  @Test
  void scanRunsThroughPipelineAndPrintsMetadata() throws IOException {
    Path input = Files.createDirectories(tempDir.resolve("shoot"));
    for (int i = 1; i <= 3; i++) {
      Files.writeString(input.resolve(String.format("IMG_%04d.jpg", i)), "x");
    }

    ExitCode code = JobCli.run(JobType.SCAN, new String[] {"in=" + input, "metricsExporter=none"}, Map.of(),
        config -> new CompositionRoot(config, MetricsPort.NO_OP, new ScriptedToolRunner(), ClockPort.SYSTEM));

    assertEquals(ExitCode.SUCCESS, code);
    String text = buffer.toString();
    assertTrue(text.contains(" completed"), text);
    assertTrue(text.contains(" images: 3"), text);
  }

  @Test
  void printResultIncludesErrorForFailures() {
    Job job = Job.of(JobId.of("job-1"), tempDir, tempDir, ScanOptions.defaults());

    JobCli.printResult(JobResult.failure(job, new IllegalStateException("boom")));

    String text = buffer.toString();
    assertTrue(text.contains("Job job-1 failed"));
    assertTrue(text.contains(" error: boom"));
  }

  private boolean loggedError(String fragment) {
    return appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR && event.getFormattedMessage().contains(fragment));
  }
}
