package ca.gc.cra.photonic.application.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Image file classification and directory listing.
 *
 * @since 0.1.0
 */
public final class ImageFiles {
  /** Camera RAW extensions. */
  public static final Set<String> RAW_EXTENSIONS =
      Set.of("dng", "nef", "cr2", "cr3", "arw", "rw2", "orf", "pef", "raf", "srw", "x3f");

  /** Already-developed raster extensions. */
  public static final Set<String> RASTER_EXTENSIONS = Set.of("jpg", "jpeg", "png", "tif", "tiff");

  private ImageFiles() {
    // Utility
  }

  /**
   * Lower-case extension without the dot.
   *
   * @param file file path
   * @return extension, or empty when there is none
   */
  public static String extension(Path file) {
    Path name = file.getFileName();
    if (name == null) {
      return "";
    }
    String text = name.toString();
    int dot = text.lastIndexOf('.');
    return dot < 0 || dot == text.length() - 1 ? "" : text.substring(dot + 1).toLowerCase(Locale.ROOT);
  }

  /**
   * File name without its extension.
   *
   * @param file file path
   * @return stem
   */
  public static String stem(Path file) {
    String text = file.getFileName().toString();
    int dot = text.lastIndexOf('.');
    return dot > 0 ? text.substring(0, dot) : text;
  }

  /**
   * @param file candidate
   * @return {@code true} for camera RAW files
   */
  public static boolean isRaw(Path file) {
    return RAW_EXTENSIONS.contains(extension(file));
  }

  /**
   * @param file candidate
   * @return {@code true} for any supported image, RAW or raster
   */
  public static boolean isImage(Path file) {
    String ext = extension(file);
    return RAW_EXTENSIONS.contains(ext) || RASTER_EXTENSIONS.contains(ext);
  }

  /**
   * Lists image files directly inside {@code dir}, sorted by path.
   *
   * @param dir directory
   * @return image files
   * @throws IOException when the directory cannot be read
   */
  public static List<Path> list(Path dir) throws IOException {
    try (Stream<Path> entries = Files.list(dir)) {
      return entries.filter(Files::isRegularFile).filter(ImageFiles::isImage).sorted().toList();
    }
  }

  /**
   * Lists image files anywhere under {@code root}, sorted by path.
   *
   * @param root directory tree root
   * @return image files
   * @throws IOException when the tree cannot be walked
   */
  public static List<Path> walk(Path root) throws IOException {
    try (Stream<Path> entries = Files.walk(root)) {
      return entries.filter(Files::isRegularFile).filter(ImageFiles::isImage).sorted().toList();
    }
  }
}
