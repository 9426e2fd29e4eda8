package ca.gc.cra.photonic.infrastructure.exec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Temporary working directory removed, with its contents, on {@link #close()}.
 *
 * @since 0.1.0
 */
public final class ScratchDirectory implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ScratchDirectory.class);

  private final Path path;

  private ScratchDirectory(Path path) {
    this.path = path;
  }

  /**
   * Creates a new directory under {@code java.io.tmpdir}.
   *
   * @param prefix directory name prefix
   * @return scratch directory
   * @throws IOException when the directory cannot be created
   */
  public static ScratchDirectory create(String prefix) throws IOException {
    return new ScratchDirectory(Files.createTempDirectory(prefix));
  }

  /** @return directory path */
  public Path path() {
    return path;
  }

  /**
   * Resolves a child path.
   *
   * @param name child name
   * @return path inside the directory
   */
  public Path resolve(String name) {
    return path.resolve(name);
  }

  /** Deletes the tree; failures are logged because they never affect results. */
  @Override
  public void close() {
    if (!Files.exists(path)) {
      return;
    }
    try (Stream<Path> walk = Files.walk(path)) {
      List<Path> entries = walk.sorted(Comparator.reverseOrder()).toList();
      for (Path entry : entries) {
        Files.deleteIfExists(entry);
      }
    } catch (IOException ex) {
      log.warn("Unable to delete scratch directory {}", path, ex);
    }
  }
}
