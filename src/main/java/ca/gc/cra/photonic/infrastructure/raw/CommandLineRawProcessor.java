package ca.gc.cra.photonic.infrastructure.raw;

import ca.gc.cra.photonic.application.port.JobContext;
import ca.gc.cra.photonic.application.port.RawProcessor;
import ca.gc.cra.photonic.application.port.ToolCommand;
import ca.gc.cra.photonic.application.port.ToolOutcome;
import ca.gc.cra.photonic.application.port.ToolRunner;
import ca.gc.cra.photonic.domain.error.ProcessingException;
import ca.gc.cra.photonic.domain.error.ToolFailureException;
import ca.gc.cra.photonic.domain.raw.RawConvertRequest;
import ca.gc.cra.photonic.domain.raw.RawConvertResult;
import ca.gc.cra.photonic.infrastructure.exec.ScratchDirectory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Base class for RAW converters driven through external command lines.
 * <p><strong>Role:</strong> Subclasses describe the commands for one conversion; this class runs them in
 * order inside a {@link ScratchDirectory}, turns a non-zero exit into {@link ToolFailureException}, and
 * verifies the output file exists.</p>
 * <p><strong>Thread-safety:</strong> Immutable; each conversion owns its scratch directory.</p>
 *
 * @since 0.1.0
 */
public abstract class CommandLineRawProcessor implements RawProcessor {
  private static final Logger log = LoggerFactory.getLogger(CommandLineRawProcessor.class);

  private final String name;
  private final boolean enabled;
  private final List<String> executables;
  private final ToolRunner runner;

  /**
   * @param name registry key
   * @param enabled configuration switch
   * @param executables binaries that must all be installed
   * @param runner subprocess runner
   */
  protected CommandLineRawProcessor(String name, boolean enabled, List<String> executables, ToolRunner runner) {
    this.name = Objects.requireNonNull(name, "name");
    this.enabled = enabled;
    this.executables = List.copyOf(executables);
    this.runner = Objects.requireNonNull(runner, "runner");
  }

  @Override
  public final String name() {
    return name;
  }

  @Override
  public boolean isAvailable() {
    return enabled && executables.stream().allMatch(runner::isInstalled);
  }

  /**
   * Builds the commands for one conversion.
   *
   * @param request conversion request
   * @param scratch private temporary directory, deleted afterwards
   * @return commands executed in order
   */
  protected abstract List<ToolCommand> commands(RawConvertRequest request, Path scratch);

  /**
   * Finds the file the tool produced. Tools that pick their own file name override this.
   *
   * @param request conversion request
   * @return produced file, if any
   */
  protected Optional<Path> locateOutput(RawConvertRequest request) {
    return Files.isRegularFile(request.output()) ? Optional.of(request.output()) : Optional.empty();
  }

  @Override
  public final RawConvertResult convert(RawConvertRequest request, JobContext context) throws ProcessingException {
    Objects.requireNonNull(request, "request");
    StringBuilder processingLog = new StringBuilder();
    Duration elapsed = Duration.ZERO;
    try {
      Path parent = request.output().toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      try (ScratchDirectory scratch = ScratchDirectory.create("photonic-" + name + "-")) {
        for (ToolCommand command : commands(request, scratch.path())) {
          ToolOutcome outcome = runner.run(command, context);
          elapsed = elapsed.plus(outcome.elapsed());
          if (!outcome.output().isBlank()) {
            processingLog.append(outcome.output().strip()).append('\n');
          }
          if (!outcome.succeeded()) {
            throw new ToolFailureException(
                name, command.executable() + " exited with status " + outcome.exitCode(), processingLog.toString());
          }
        }
      }
    } catch (IOException ex) {
      throw new ToolFailureException(name, "cannot run conversion: " + ex.getMessage(), ex);
    }

    Optional<Path> produced = locateOutput(request);
    if (produced.isEmpty()) {
      log.debug("{} finished without producing {}", name, request.output());
      throw new ToolFailureException(name, "completed but output file not found", processingLog.toString());
    }
    return new RawConvertResult(true, name, request.input(), produced.get(), processingLog.toString(), elapsed);
  }
}
