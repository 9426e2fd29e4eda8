package ca.gc.cra.photonic.testutil;

import ca.gc.cra.photonic.application.port.JobContext;
import ca.gc.cra.photonic.application.port.ToolCommand;
import ca.gc.cra.photonic.application.port.ToolOutcome;
import ca.gc.cra.photonic.application.port.ToolRunner;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Test double standing in for subprocess execution. Records every command and answers with a scripted
 * outcome; by default every command succeeds without side effects.
 */
public final class ScriptedToolRunner implements ToolRunner {
  private final Set<String> installed;
  private final List<ToolCommand> commands = new CopyOnWriteArrayList<>();
  private volatile Function<ToolCommand, ToolOutcome> script = command -> success("");

  public ScriptedToolRunner(String... installed) {
    this.installed = Set.of(installed);
  }

  /**
   * Replaces the answer for subsequent commands.
   *
   * @param script maps a command to its outcome; may create files to mimic the tool
   * @return this runner
   */
  public ScriptedToolRunner answering(Function<ToolCommand, ToolOutcome> script) {
    this.script = script;
    return this;
  }

  @Override
  public ToolOutcome run(ToolCommand command, JobContext context) {
    commands.add(command);
    return script.apply(command);
  }

  @Override
  public boolean isInstalled(String executable) {
    return installed.contains(executable);
  }

  /** @return commands in execution order */
  public List<ToolCommand> commands() {
    return new ArrayList<>(commands);
  }

  /** @return argv of the only command run */
  public List<String> singleArgv() {
    if (commands.size() != 1) {
      throw new AssertionError("expected one command but ran " + commands);
    }
    return commands.get(0).argv();
  }

  public static ToolOutcome success(String output) {
    return new ToolOutcome(0, output, Duration.ofMillis(5));
  }

  public static ToolOutcome failure(int exitCode, String output) {
    return new ToolOutcome(exitCode, output, Duration.ofMillis(5));
  }

  /**
   * Creates a file the way a tool would, returning a successful outcome.
   *
   * @param file file to create, parents included
   * @return successful outcome
   */
  public static ToolOutcome producing(Path file) {
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.writeString(file, "output");
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
    return success("");
  }

  /**
   * Argument following {@code flag} in {@code command}.
   *
   * @param command command to inspect
   * @param flag flag such as {@code -o}
   * @return the value after the flag
   */
  public static String valueAfter(ToolCommand command, String flag) {
    List<String> argv = command.argv();
    int idx = argv.indexOf(flag);
    if (idx < 0 || idx + 1 >= argv.size()) {
      throw new AssertionError(flag + " missing from " + argv);
    }
    return argv.get(idx + 1);
  }
}
