package ca.gc.cra.photonic.infrastructure.exec;

import ca.gc.cra.photonic.application.port.JobContext;
import ca.gc.cra.photonic.application.port.ToolCommand;
import ca.gc.cra.photonic.application.port.ToolOutcome;
import ca.gc.cra.photonic.application.port.ToolRunner;
import ca.gc.cra.photonic.domain.error.JobCancelledException;
import ca.gc.cra.photonic.logging.Logs;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ToolRunner} backed by {@link ProcessBuilder}.
 * <p><strong>Why:</strong> External tools may run for minutes; the runner polls the job context so a
 * pipeline shutdown terminates them instead of waiting.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the locator; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Logs each command line at DEBUG and non-zero exits at WARN with the
 * tail of the captured output.</p>
 *
 * @since 0.1.0
 */
public final class ProcessToolRunner implements ToolRunner {
  private static final Logger log = LoggerFactory.getLogger(ProcessToolRunner.class);
  private static final long POLL_MILLIS = 100L;
  private static final long DESTROY_GRACE_MILLIS = 2_000L;
  /** Upper bound on captured output kept in memory per invocation. */
  static final int MAX_OUTPUT_BYTES = 64 * 1024;

  private final CommandLocator locator;

  /** Creates a runner resolving executables from {@code PATH}. */
  public ProcessToolRunner() {
    this(CommandLocator.fromEnvironment());
  }

  /**
   * Creates a runner with a custom locator.
   *
   * @param locator executable lookup
   */
  public ProcessToolRunner(CommandLocator locator) {
    this.locator = Objects.requireNonNull(locator, "locator");
  }

  @Override
  public ToolOutcome run(ToolCommand command, JobContext context) throws IOException, JobCancelledException {
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(context, "context");
    context.throwIfCancelled();

    Path capture = Files.createTempFile("photonic-tool-", ".log");
    try {
      ProcessBuilder builder = new ProcessBuilder(command.argv());
      if (command.workDir() != null) {
        builder.directory(command.workDir().toFile());
      }
      if (command.stdoutFile() != null) {
        builder.redirectOutput(command.stdoutFile().toFile());
        builder.redirectError(capture.toFile());
      } else {
        builder.redirectErrorStream(true);
        builder.redirectOutput(capture.toFile());
      }

      log.debug("Running {}", command);
      long started = System.nanoTime();
      Process process = builder.start();
      int exit = awaitExit(process, command, context);
      Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
      // tools may print Latin-1 or mixed encodings; malformed bytes decode as U+FFFD
      String output = Logs.tail(new String(Files.readAllBytes(capture), StandardCharsets.UTF_8), MAX_OUTPUT_BYTES);
      if (exit != 0) {
        log.warn("{} exited with status {}: {}", command.executable(), exit, Logs.tail(output, 512));
      }
      return new ToolOutcome(exit, output, elapsed);
    } finally {
      Files.deleteIfExists(capture);
    }
  }

  private static int awaitExit(Process process, ToolCommand command, JobContext context)
      throws JobCancelledException {
    try {
      while (!process.waitFor(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
        if (context.isCancelled()) {
          terminate(process, command);
          throw new JobCancelledException(command.executable() + " terminated: pipeline is shutting down");
        }
      }
      return process.exitValue();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      terminate(process, command);
      throw new JobCancelledException(command.executable() + " interrupted");
    }
  }

  private static void terminate(Process process, ToolCommand command) {
    log.warn("Terminating {}", command.executable());
    process.destroy();
    try {
      if (!process.waitFor(DESTROY_GRACE_MILLIS, TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
    }
  }

  @Override
  public boolean isInstalled(String executable) {
    return locator.find(executable).isPresent();
  }
}
