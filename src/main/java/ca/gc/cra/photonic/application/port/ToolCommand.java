package ca.gc.cra.photonic.application.port;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * External command line to execute.
 *
 * @param argv executable followed by its arguments; never empty
 * @param workDir working directory, or {@code null} for the current one
 * @param stdoutFile file receiving standard output, or {@code null} to capture it with stderr
 * @since 0.1.0
 */
public record ToolCommand(List<String> argv, Path workDir, Path stdoutFile) {
  public ToolCommand {
    argv = List.copyOf(Objects.requireNonNull(argv, "argv"));
    if (argv.isEmpty()) {
      throw new IllegalArgumentException("argv must name an executable");
    }
  }

  /**
   * Builds a command with default working directory and captured output.
   *
   * @param argv executable and arguments
   * @return command
   */
  public static ToolCommand of(List<String> argv) {
    return new ToolCommand(argv, null, null);
  }

  /**
   * Builds a command from varargs.
   *
   * @param argv executable and arguments
   * @return command
   */
  public static ToolCommand of(String... argv) {
    return of(List.of(argv));
  }

  /**
   * Returns a copy that writes standard output to {@code file}.
   *
   * @param file destination for stdout
   * @return new command
   */
  public ToolCommand redirectStdoutTo(Path file) {
    return new ToolCommand(argv, workDir, Objects.requireNonNull(file, "file"));
  }

  /**
   * Returns a copy that runs inside {@code dir}.
   *
   * @param dir working directory
   * @return new command
   */
  public ToolCommand inDirectory(Path dir) {
    return new ToolCommand(argv, Objects.requireNonNull(dir, "dir"), stdoutFile);
  }

  /** @return executable name */
  public String executable() {
    return argv.get(0);
  }

  @Override
  public String toString() {
    return String.join(" ", argv);
  }
}
