package ca.gc.cra.photonic.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.photonic.application.port.JobContext;
import ca.gc.cra.photonic.application.port.ToolCommand;
import ca.gc.cra.photonic.application.port.ToolOutcome;
import ca.gc.cra.photonic.domain.error.JobCancelledException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@DisabledOnOs(OS.WINDOWS)
class ProcessToolRunnerTest {
  @TempDir Path tempDir;

  private final ProcessToolRunner runner = new ProcessToolRunner(new CommandLocator(List.of(Path.of("/bin"), Path.of("/usr/bin"))));

  @Test
  void capturesOutputAndExitStatus() throws Exception {
    ToolOutcome outcome = runner.run(ToolCommand.of("sh", "-c", "echo converted; echo warn 1>&2; exit 3"), JobContext.NONE);

    assertEquals(3, outcome.exitCode());
    assertFalse(outcome.succeeded());
    assertTrue(outcome.output().contains("converted"));
    assertTrue(outcome.output().contains("warn"));
  }

  @Test
  void nonUtf8OutputIsDecodedLeniently() throws Exception {
    ToolOutcome outcome = runner.run(
        ToolCommand.of("sh", "-c", "printf 'Appareil \\351cran\\n'; exit 0"), JobContext.NONE);

    assertTrue(outcome.succeeded());
    assertTrue(outcome.output().contains("Appareil"));
    assertTrue(outcome.output().contains("\uFFFD"));
  }

  @Test
  void redirectsStdoutToFile() throws Exception {
    Path target = tempDir.resolve("out.ppm");

    ToolOutcome outcome = runner.run(
        ToolCommand.of("sh", "-c", "printf P6; echo note 1>&2").redirectStdoutTo(target), JobContext.NONE);

    assertTrue(outcome.succeeded());
    assertEquals("P6", Files.readString(target));
    assertTrue(outcome.output().contains("note"));
  }

  @Test
  void runsInWorkingDirectory() throws Exception {
    ToolOutcome outcome = runner.run(ToolCommand.of("sh", "-c", "pwd -P").inDirectory(tempDir), JobContext.NONE);

    assertEquals(tempDir.toRealPath().toString(), outcome.output().trim());
  }

  @Test
  void missingExecutableFailsToStart() {
    assertThrows(IOException.class,
        () -> runner.run(ToolCommand.of("photonic-no-such-tool"), JobContext.NONE));
  }

  @Test
  void cancelledContextIsRejectedBeforeStart() {
    JobContext cancelled = new JobContext() {
      @Override
      public boolean isCancelled() {
        return true;
      }
    };

    assertThrows(JobCancelledException.class, () -> runner.run(ToolCommand.of("true"), cancelled));
  }

  @Test
  @Timeout(10)
  void cancellationTerminatesRunningProcess() {
    AtomicBoolean cancel = new AtomicBoolean();
    JobContext context = cancel::get;
    Thread canceller = new Thread(() -> {
      try {
        Thread.sleep(300);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
      cancel.set(true);
    });
    canceller.start();

    long started = System.nanoTime();
    assertThrows(JobCancelledException.class, () -> runner.run(ToolCommand.of("sleep", "30"), context));
    assertTrue(Duration.ofNanos(System.nanoTime() - started).toSeconds() < 10);
  }

  @Test
  void locatesInstalledTools() {
    assertTrue(runner.isInstalled("sh"));
    assertFalse(runner.isInstalled("photonic-no-such-tool"));
  }
}
