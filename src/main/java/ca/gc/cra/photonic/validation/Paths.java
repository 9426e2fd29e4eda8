package ca.gc.cra.photonic.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for job inputs and outputs.
 * <p><strong>Why:</strong> Jobs run on worker threads long after submission; rejecting a missing input or
 * an unwritable output location at the CLI boundary gives the operator an immediate error instead of a
 * failed result.
 * <p><strong>Thread-safety:</strong> Stateless methods; concurrency limited by underlying filesystem semantics.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates that an input file or directory exists and is readable.
   *
   * @param name logical parameter name for diagnostics
   * @param path candidate input
   * @return absolute, normalized path
   * @throws IllegalArgumentException if the path is missing, contains control characters, or is unreadable
   */
  public static Path requireReadable(String name, Path path) {
    Path normalized = normalize(name, path);
    if (!Files.exists(normalized)) {
      throw new IllegalArgumentException(name + " does not exist: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " is not readable: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates that a file output location can be created: the nearest existing ancestor of the parent
   * must be a writable directory. Missing parents are created when {@code createParents} is set.
   *
   * @param name logical parameter name for diagnostics
   * @param path candidate output file or directory
   * @param createParents whether to create missing parent directories
   * @return absolute, normalized path
   * @throws IllegalArgumentException if no writable ancestor exists or creation fails
   */
  public static Path requireWritableTarget(String name, Path path, boolean createParents) {
    Path normalized = normalize(name, path);
    Path parent = normalized.getParent();
    if (parent == null) {
      throw new IllegalArgumentException(name + " has no parent directory: " + normalized);
    }
    try {
      if (createParents) {
        Files.createDirectories(parent);
      }
      Path existing = nearestExistingAncestor(parent);
      if (!Files.isDirectory(existing, LinkOption.NOFOLLOW_LINKS) && !Files.isDirectory(existing)) {
        throw new IllegalArgumentException(name + " parent is not a directory: " + existing);
      }
      if (!Files.isWritable(existing)) {
        throw new IllegalArgumentException(name + " parent directory is not writable: " + existing);
      }
      return normalized;
    } catch (IOException ex) {
      throw new IllegalArgumentException(
          "unable to prepare " + name + " location " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  private static Path normalize(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    String raw = path.toString();
    if (raw.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    if (containsControl(raw)) {
      throw new IllegalArgumentException(name + " must not contain control characters");
    }
    return path.toAbsolutePath().normalize();
  }

  private static Path nearestExistingAncestor(Path start) {
    Path current = start;
    while (current != null && !Files.exists(current)) {
      current = current.getParent();
    }
    if (current == null) {
      throw new IllegalArgumentException("no existing ancestor for " + start);
    }
    return current;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
