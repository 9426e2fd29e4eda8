package ca.gc.cra.photonic.application.scan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.photonic.domain.job.ScanOptions;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ImageScannerTest {
  private static final Instant BASE = Instant.parse("2024-08-12T03:00:00Z");

  @TempDir Path tempDir;

  @Test
  void classifiesBySize() {
    assertEquals("stack", ImageScanner.classify(4));
    assertEquals("panoramic", ImageScanner.classify(ImageScanner.PANORAMIC_MIN));
    assertEquals("timelapse", ImageScanner.classify(ImageScanner.TIMELAPSE_MIN));
  }

  @Test
  void findsSequencesAndTimestampClustersPerDirectory() throws IOException {
    Path burst = Files.createDirectories(tempDir.resolve("burst"));
    for (int i = 1; i <= 6; i++) {
      image(burst.resolve(String.format("DSC_%04d.jpg", i)), BASE.plusSeconds(i * 5L));
    }
    Path mixed = Files.createDirectories(tempDir.resolve("mixed"));
    image(mixed.resolve("sunset.jpg"), BASE);
    image(mixed.resolve("beach.png"), BASE.plusSeconds(3600));
    Files.writeString(mixed.resolve("readme.txt"), "not an image");

    ImageScanner.ScanReport report = new ImageScanner().scan(tempDir, ScanOptions.defaults());

    assertEquals(8, report.images().size());
    List<ImageScanner.ImageGroup> burstGroups = report.groups().stream()
        .filter(g -> g.basePath().equals(burst.toAbsolutePath()))
        .toList();
    assertEquals(3, burstGroups.size());
    assertTrue(burstGroups.stream().allMatch(g -> g.count() == 6 && g.groupType().equals("panoramic")));
    assertEquals(
        List.of("directory_size", "filename_sequence", "timestamp_cluster"),
        burstGroups.stream().map(ImageScanner.ImageGroup::detection).toList());

    List<ImageScanner.ImageGroup> mixedGroups = report.groups().stream()
        .filter(g -> g.basePath().equals(mixed.toAbsolutePath()))
        .toList();
    assertEquals(1, mixedGroups.size());
    assertEquals("stack", mixedGroups.get(0).groupType());
  }

  @Test
  void timestampGapSplitsClusters() throws IOException {
    Path first = image(tempDir.resolve("a.jpg"), BASE);
    Path second = image(tempDir.resolve("b.jpg"), BASE.plusSeconds(10));
    Path third = image(tempDir.resolve("c.jpg"), BASE.plusSeconds(20));
    Path late = image(tempDir.resolve("d.jpg"), BASE.plusSeconds(500));

    List<ImageScanner.ImageGroup> groups = ImageScanner.byTimestamp(
        tempDir, List.of(first, second, third, late), Duration.ofSeconds(60), 3);

    assertEquals(1, groups.size());
    assertEquals(3, groups.get(0).count());
  }

  private static Path image(Path path, Instant modified) throws IOException {
    Files.writeString(path, "img");
    Files.setLastModifiedTime(path, FileTime.from(modified));
    return path;
  }
}
