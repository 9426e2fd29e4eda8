package ca.gc.cra.photonic.application.align;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.photonic.application.port.JobContext;
import ca.gc.cra.photonic.domain.align.AlignmentRequest;
import ca.gc.cra.photonic.domain.align.AlignmentResult;
import ca.gc.cra.photonic.domain.align.AlignmentType;
import ca.gc.cra.photonic.domain.error.InsufficientDataException;
import ca.gc.cra.photonic.domain.image.PixelBuffer;
import ca.gc.cra.photonic.domain.image.Translation;
import ca.gc.cra.photonic.testutil.InMemoryImageCodec;
import ca.gc.cra.photonic.testutil.RecordingMetricsPort;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StarAlignmentProcessorTest {
  private static final int[][] STARS = {{10, 10}, {40, 12}, {20, 40}, {50, 50}};

  @TempDir Path tempDir;

  private InMemoryImageCodec codec;
  private RecordingMetricsPort metrics;
  private StarAlignmentProcessor processor;
  private PixelBuffer reference;

  @BeforeEach
  void setUp() {
    codec = new InMemoryImageCodec();
    metrics = new RecordingMetricsPort();
    processor = new StarAlignmentProcessor(codec, metrics);
    reference = StarField.render(64, 64, STARS, 1.0f, 0.9f, 0.8f, 0.7f);
  }

  @Test
  void onlySupportsAstro() {
    assertTrue(processor.supports(AlignmentType.ASTRO));
    assertFalse(processor.supports(AlignmentType.PANORAMIC));
    assertEquals(StarAlignmentProcessor.NAME, processor.name());
  }

  @Test
  void alignsShiftedFrameBackOntoReference() throws Exception {
    Path ref = image("ref.tif", reference);
    Path shifted = image("shifted.tif", ImageShifter.roll(reference, 3, 2));
    Path out = tempDir.resolve("aligned");

    AlignmentResult result = processor.align(
        new AlignmentRequest(List.of(ref, shifted), out, AlignmentType.ASTRO, null, 2d), JobContext.NONE);

    assertTrue(result.success());
    assertEquals(List.of(out.resolve("aligned_000_ref.tif"), out.resolve("aligned_001_shifted.tif")),
        result.alignedImages());
    assertEquals(Translation.ZERO, result.translations().get(ref));
    assertEquals(new Translation(3d, 2d), result.translations().get(shifted));
    assertEquals(4, result.referenceStars());
    assertEquals(4, result.matchedStars());
    assertTrue(reference.contentEquals(codec.written(out.resolve("aligned_001_shifted.tif")), 0d));
  }

  @Test
  void skipsFrameWithoutStarsAndWarns() throws Exception {
    Path ref = image("ref.tif", reference);
    Path shifted = image("shifted.tif", ImageShifter.roll(reference, -4, 1));
    Path cloudy = image("cloudy.tif", PixelBuffer.blank(64, 64, 1));

    AlignmentResult result = processor.align(
        new AlignmentRequest(List.of(ref, cloudy, shifted), tempDir, AlignmentType.ASTRO, "high", 2d),
        JobContext.NONE);

    assertEquals(2, result.alignedImages().size());
    assertEquals(1, result.warnings().size());
    assertTrue(result.warnings().get(0).startsWith("cloudy.tif"));
    assertEquals(1, metrics.count("align.images.skipped"));
    assertEquals(new Translation(-4d, 1d), result.translations().get(shifted));
  }

  @Test
  void failsWhenNothingButReferenceAligns() throws Exception {
    Path ref = image("ref.tif", reference);
    Path cloudy = image("cloudy.tif", PixelBuffer.blank(64, 64, 1));

    AlignmentRequest request =
        new AlignmentRequest(List.of(ref, cloudy), tempDir, AlignmentType.ASTRO, null, 2d);

    assertThrows(InsufficientDataException.class, () -> processor.align(request, JobContext.NONE));
  }

  @Test
  void requiresTwoImages() {
    AlignmentRequest request =
        new AlignmentRequest(List.of(tempDir.resolve("a.tif")), tempDir, AlignmentType.ASTRO, null, 2d);

    assertThrows(InsufficientDataException.class, () -> processor.align(request, JobContext.NONE));
  }

  @Test
  void alignedNamePadsIndexAndKeepsStem() {
    assertEquals("aligned_007_IMG_0001.tif", StarAlignmentProcessor.alignedName(7, Path.of("IMG_0001.jpg")));
  }

  private Path image(String name, PixelBuffer buffer) {
    Path path = tempDir.resolve(name);
    codec.put(path, buffer);
    return path;
  }
}
