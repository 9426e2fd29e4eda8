package ca.gc.cra.photonic.application.stack;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.photonic.application.port.JobContext;
import ca.gc.cra.photonic.domain.error.InsufficientDataException;
import ca.gc.cra.photonic.domain.error.JobCancelledException;
import ca.gc.cra.photonic.domain.error.ProcessingException;
import ca.gc.cra.photonic.domain.image.ImageFormat;
import ca.gc.cra.photonic.domain.image.PixelBuffer;
import ca.gc.cra.photonic.domain.stack.StackMethod;
import ca.gc.cra.photonic.domain.stack.StackParameters;
import ca.gc.cra.photonic.domain.stack.StackRequest;
import ca.gc.cra.photonic.domain.stack.StackResult;
import ca.gc.cra.photonic.testutil.InMemoryImageCodec;
import ca.gc.cra.photonic.testutil.RecordingMetricsPort;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NativeStackingProcessorTest {
  @TempDir Path tempDir;

  private InMemoryImageCodec codec;
  private RecordingMetricsPort metrics;
  private NativeStackingProcessor processor;

  @BeforeEach
  void setUp() {
    codec = new InMemoryImageCodec();
    metrics = new RecordingMetricsPort();
    processor = new NativeStackingProcessor(codec, new StatisticalStackingEngine(), metrics);
  }

  @Test
  void stacksIntoDefaultNameWhenOutputIsDirectory() throws Exception {
    List<Path> inputs = frames(10f, 10f, 10f, 10f, 100f);

    StackResult result = processor.stack(
        new StackRequest(inputs, tempDir, StackMethod.SIGMA_CLIP, StackParameters.sigmaClip(1d, 1d, 3), true),
        JobContext.NONE);

    Path expected = tempDir.resolve(NativeStackingProcessor.DEFAULT_OUTPUT_NAME);
    assertTrue(result.success());
    assertEquals(expected, result.output());
    assertEquals(NativeStackingProcessor.NAME, result.tool());
    assertEquals(5, result.imageCount());
    assertEquals(1L, result.rejectedPixels());
    assertEquals(10f, codec.written(expected).sample(0), 1e-6f);
    assertEquals(ImageFormat.TIFF16, codec.formatOf(expected));
    assertTrue(result.warnings().isEmpty());
    assertEquals(List.of(1L), metrics.observed("stack.rejectedPixels"));
  }

  @Test
  void astroModeWithoutClippingWarns() throws Exception {
    StackResult result = processor.stack(
        new StackRequest(frames(0.2f, 0.4f), tempDir.resolve("out.png"), StackMethod.MEAN, null, true),
        JobContext.NONE);

    assertEquals(1, result.warnings().size());
    assertEquals(ImageFormat.PNG16, codec.formatOf(tempDir.resolve("out.png")));
  }

  @Test
  void requiresTwoImages() {
    StackRequest request =
        new StackRequest(frames(0.5f), tempDir.resolve("out.tif"), StackMethod.MEDIAN, null, false);

    assertThrows(InsufficientDataException.class, () -> processor.stack(request, JobContext.NONE));
  }

  @Test
  void hdrIsNotSupported() {
    assertFalse(processor.supports(StackMethod.HDR));
    StackRequest request =
        new StackRequest(frames(0.1f, 0.9f), tempDir.resolve("out.tif"), StackMethod.HDR, null, false);

    assertThrows(ProcessingException.class, () -> processor.stack(request, JobContext.NONE));
  }

  @Test
  void missingInputIsProcessingFailure() {
    StackRequest request = new StackRequest(
        List.of(tempDir.resolve("missing-1.tif"), tempDir.resolve("missing-2.tif")),
        tempDir.resolve("out.tif"),
        StackMethod.MEAN,
        null,
        false);

    assertThrows(ProcessingException.class, () -> processor.stack(request, JobContext.NONE));
  }

  @Test
  void cancelledContextStopsBeforeReading() {
    StackRequest request =
        new StackRequest(frames(0.1f, 0.9f), tempDir.resolve("out.tif"), StackMethod.MEAN, null, false);

    assertThrows(JobCancelledException.class, () -> processor.stack(request, () -> true));
  }

  private List<Path> frames(float... values) {
    List<Path> paths = new ArrayList<>();
    for (int i = 0; i < values.length; i++) {
      Path path = tempDir.resolve("frame_" + i + ".tif");
      codec.put(path, new PixelBuffer(1, 1, 1, new float[] {values[i]}));
      paths.add(path);
    }
    return paths;
  }
}
