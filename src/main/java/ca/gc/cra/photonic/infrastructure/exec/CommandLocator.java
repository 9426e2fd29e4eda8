package ca.gc.cra.photonic.infrastructure.exec;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Resolves bare executable names against a list of search directories, caching hits and misses.
 *
 * @since 0.1.0
 */
public final class CommandLocator {
  private final List<Path> searchPath;
  private final ConcurrentMap<String, Optional<Path>> cache = new ConcurrentHashMap<>();

  /**
   * Creates a locator over explicit directories.
   *
   * @param searchPath directories to search, in order
   */
  public CommandLocator(List<Path> searchPath) {
    this.searchPath = List.copyOf(Objects.requireNonNull(searchPath, "searchPath"));
  }

  /**
   * Creates a locator over the {@code PATH} environment variable.
   *
   * @return locator
   */
  public static CommandLocator fromEnvironment() {
    String raw = System.getenv("PATH");
    List<Path> dirs = new ArrayList<>();
    if (raw != null) {
      for (String entry : raw.split(File.pathSeparator)) {
        if (!entry.isBlank()) {
          dirs.add(Path.of(entry.trim()));
        }
      }
    }
    return new CommandLocator(dirs);
  }

  /**
   * Finds an executable.
   *
   * @param executable bare name, or an absolute path
   * @return resolved path when an executable file exists
   */
  public Optional<Path> find(String executable) {
    if (executable == null || executable.isBlank()) {
      return Optional.empty();
    }
    return cache.computeIfAbsent(executable, this::lookup);
  }

  private Optional<Path> lookup(String executable) {
    Path direct = Path.of(executable);
    if (direct.isAbsolute()) {
      return Files.isExecutable(direct) ? Optional.of(direct) : Optional.empty();
    }
    for (Path dir : searchPath) {
      Path candidate = dir.resolve(executable);
      if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
        return Optional.of(candidate);
      }
      Path windows = dir.resolve(executable + ".exe");
      if (Files.isRegularFile(windows) && Files.isExecutable(windows)) {
        return Optional.of(windows);
      }
    }
    return Optional.empty();
  }
}
