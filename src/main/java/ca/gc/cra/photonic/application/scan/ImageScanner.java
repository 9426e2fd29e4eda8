package ca.gc.cra.photonic.application.scan;

import ca.gc.cra.photonic.application.util.ImageFiles;
import ca.gc.cra.photonic.domain.job.ScanOptions;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Walks a directory tree and proposes how its images group into jobs.
 * <p><strong>Detections</strong> (per directory):
 * <ul>
 *   <li>{@code directory_size}: every directory with images forms one group.</li>
 *   <li>{@code filename_sequence}: files sharing a prefix before a trailing number, at least
 *       {@code minGroupSize} of them.</li>
 *   <li>{@code timestamp_cluster}: runs of files whose modification times are no more than
 *       {@code clusterGap} apart, at least {@code minGroupSize} long.</li>
 * </ul>
 * Each group is classified by size: {@value #TIMELAPSE_MIN} or more images is a timelapse,
 * {@value #PANORAMIC_MIN} or more a panorama, anything smaller a stack. Groups with the same directory,
 * detection, and type are reported once; output is sorted by directory then detection.
 *
 * @since 0.1.0
 */
public final class ImageScanner {
  private static final Logger log = LoggerFactory.getLogger(ImageScanner.class);

  /** Minimum group size classified as a timelapse. */
  public static final int TIMELAPSE_MIN = 50;
  /** Minimum group size classified as a panorama. */
  public static final int PANORAMIC_MIN = 5;

  private static final Pattern SEQUENCE = Pattern.compile("^(.*?)(\\d+)(\\D*)$");

  /**
   * One proposed group.
   *
   * @param groupType {@code timelapse}, {@code panoramic}, or {@code stack}
   * @param basePath directory holding the group
   * @param count number of images
   * @param detection detection that produced it
   */
  public record ImageGroup(String groupType, Path basePath, int count, String detection) {
    public ImageGroup {
      Objects.requireNonNull(groupType, "groupType");
      Objects.requireNonNull(basePath, "basePath");
      Objects.requireNonNull(detection, "detection");
    }
  }

  /**
   * Scan output.
   *
   * @param images every image found, sorted
   * @param groups proposed groups
   */
  public record ScanReport(List<Path> images, List<ImageGroup> groups) {
    public ScanReport {
      images = List.copyOf(images);
      groups = List.copyOf(groups);
    }
  }

  /**
   * Scans {@code root}.
   *
   * @param root directory tree
   * @param options cluster gap and minimum group size
   * @return images and groups
   * @throws IOException when the tree cannot be walked
   */
  public ScanReport scan(Path root, ScanOptions options) throws IOException {
    Objects.requireNonNull(options, "options");
    List<Path> images = ImageFiles.walk(root);
    Map<Path, List<Path>> byDirectory = new TreeMap<>();
    for (Path image : images) {
      Path dir = image.toAbsolutePath().getParent();
      byDirectory.computeIfAbsent(dir, d -> new ArrayList<>()).add(image);
    }

    Set<String> seen = new LinkedHashSet<>();
    List<ImageGroup> groups = new ArrayList<>();
    for (Map.Entry<Path, List<Path>> entry : byDirectory.entrySet()) {
      Path dir = entry.getKey();
      List<Path> files = entry.getValue();
      List<ImageGroup> candidates = new ArrayList<>();
      candidates.addAll(bySequence(dir, files, options.minGroupSize()));
      candidates.addAll(byTimestamp(dir, files, options.clusterGap(), options.minGroupSize()));
      candidates.add(new ImageGroup(classify(files.size()), dir, files.size(), "directory_size"));
      for (ImageGroup group : candidates) {
        if (seen.add(group.basePath() + "|" + group.detection() + "|" + group.groupType())) {
          groups.add(group);
        }
      }
    }
    groups.sort(
        Comparator.comparing((ImageGroup g) -> g.basePath().toString()).thenComparing(ImageGroup::detection));
    log.info("Scanned {}: {} images in {} groups", root, images.size(), groups.size());
    return new ScanReport(images, groups);
  }

  /**
   * Classifies a group by size.
   *
   * @param count images in the group
   * @return group type
   */
  public static String classify(int count) {
    if (count >= TIMELAPSE_MIN) {
      return "timelapse";
    }
    if (count >= PANORAMIC_MIN) {
      return "panoramic";
    }
    return "stack";
  }

  static List<ImageGroup> bySequence(Path dir, List<Path> files, int minGroupSize) {
    Map<String, Integer> byPrefix = new LinkedHashMap<>();
    for (Path file : files) {
      Matcher matcher = SEQUENCE.matcher(ImageFiles.stem(file));
      if (matcher.matches()) {
        byPrefix.merge(matcher.group(1), 1, Integer::sum);
      }
    }
    List<ImageGroup> groups = new ArrayList<>();
    for (int count : byPrefix.values()) {
      if (count >= minGroupSize) {
        groups.add(new ImageGroup(classify(count), dir, count, "filename_sequence"));
      }
    }
    return groups;
  }

  static List<ImageGroup> byTimestamp(Path dir, List<Path> files, Duration gap, int minGroupSize) {
    List<FileTime> times = new ArrayList<>();
    for (Path file : files) {
      try {
        times.add(Files.getLastModifiedTime(file));
      } catch (IOException ex) {
        log.debug("Ignoring {} for timestamp clustering: {}", file, ex.getMessage());
      }
    }
    times.sort(null);
    List<ImageGroup> groups = new ArrayList<>();
    long gapMillis = gap.toMillis();
    int start = 0;
    for (int i = 1; i <= times.size(); i++) {
      boolean boundary =
          i == times.size() || times.get(i).toMillis() - times.get(i - 1).toMillis() > gapMillis;
      if (boundary) {
        int count = i - start;
        if (count >= minGroupSize) {
          groups.add(new ImageGroup(classify(count), dir, count, "timestamp_cluster"));
        }
        start = i;
      }
    }
    return groups;
  }
}
