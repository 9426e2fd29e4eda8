package ca.gc.cra.photonic.application.raw;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.photonic.application.port.JobContext;
import ca.gc.cra.photonic.application.port.RawProcessor;
import ca.gc.cra.photonic.application.selection.RawProcessorRegistry;
import ca.gc.cra.photonic.domain.error.JobCancelledException;
import ca.gc.cra.photonic.domain.error.ProcessingException;
import ca.gc.cra.photonic.domain.error.ToolFailureException;
import ca.gc.cra.photonic.domain.raw.RawConvertRequest;
import ca.gc.cra.photonic.domain.raw.RawConvertResult;
import ca.gc.cra.photonic.testutil.RecordingMetricsPort;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RawPreprocessorTest {
  @TempDir Path tempDir;

  private ConvertingProcessor converter;
  private RawPreprocessor preprocessor;

  @BeforeEach
  void setUp() {
    converter = new ConvertingProcessor();
    preprocessor = new RawPreprocessor(
        new RawProcessorRegistry("", new RecordingMetricsPort()).register(converter));
  }

  @Test
  void convertsRawFilesIntoCacheDirectory() throws Exception {
    Files.writeString(tempDir.resolve("a.jpg"), "jpeg");
    Files.writeString(tempDir.resolve("b.CR2"), "raw");

    RawPreprocessor.Prepared prepared = preprocessor.prepare(tempDir, "", false, JobContext.NONE);

    Path cached = tempDir.resolve(RawPreprocessor.CACHE_DIR).resolve("b.jpg");
    assertEquals(List.of(tempDir.resolve("a.jpg"), cached), prepared.images());
    assertEquals(1, prepared.converted());
    assertEquals(0, prepared.cached());
    assertTrue(Files.isRegularFile(cached));
  }

  @Test
  void reusesFreshCacheUnlessDisabled() throws Exception {
    Files.writeString(tempDir.resolve("b.nef"), "raw");
    preprocessor.prepare(tempDir, "", false, JobContext.NONE);

    RawPreprocessor.Prepared second = preprocessor.prepare(tempDir, "", false, JobContext.NONE);
    assertEquals(1, second.cached());
    assertEquals(1, converter.calls.get());

    RawPreprocessor.Prepared forced = preprocessor.prepare(tempDir, "", true, JobContext.NONE);
    assertEquals(1, forced.converted());
    assertEquals(2, converter.calls.get());
  }

  @Test
  void staleCacheIsIgnored() throws IOException {
    Path raw = Files.writeString(tempDir.resolve("c.dng"), "raw");
    Path cached = Files.writeString(tempDir.resolve("c.jpg"), "old");
    Files.setLastModifiedTime(cached, FileTime.from(Instant.parse("2020-01-01T00:00:00Z")));
    Files.setLastModifiedTime(raw, FileTime.from(Instant.parse("2021-01-01T00:00:00Z")));

    assertFalse(RawPreprocessor.isCacheValid(raw, cached));
    assertFalse(RawPreprocessor.isCacheValid(raw, tempDir.resolve("missing.jpg")));
  }

  @Test
  void failedConversionsAreReportedAndSkipped() throws Exception {
    Files.writeString(tempDir.resolve("broken.arw"), "raw");
    Files.writeString(tempDir.resolve("fine.jpg"), "jpeg");

    RawPreprocessor.Prepared prepared = preprocessor.prepare(tempDir, "", false, JobContext.NONE);

    assertEquals(List.of(tempDir.resolve("fine.jpg")), prepared.images());
    assertEquals(List.of(tempDir.resolve("broken.arw")), prepared.failed());
  }

  @Test
  void withoutRawFilesNothingIsCreated() throws Exception {
    Files.writeString(tempDir.resolve("only.png"), "png");

    RawPreprocessor.Prepared prepared = preprocessor.prepare(tempDir, "", false, JobContext.NONE);

    assertEquals(1, prepared.images().size());
    assertFalse(Files.exists(tempDir.resolve(RawPreprocessor.CACHE_DIR)));
  }

  @Test
  void cancellationStopsConversion() throws IOException {
    Files.writeString(tempDir.resolve("b.nef"), "raw");

    assertThrows(JobCancelledException.class, () -> preprocessor.prepare(tempDir, "", false, () -> true));
    assertEquals(0, converter.calls.get());
  }

  /** Registered as imagemagick; fails for files whose name starts with "broken". */
  private static final class ConvertingProcessor implements RawProcessor {
    final AtomicInteger calls = new AtomicInteger();

    @Override
    public String name() {
      return "imagemagick";
    }

    @Override
    public boolean isAvailable() {
      return true;
    }

    @Override
    public RawConvertResult convert(RawConvertRequest request, JobContext context) throws ProcessingException {
      calls.incrementAndGet();
      if (request.input().getFileName().toString().startsWith("broken")) {
        throw new ToolFailureException(name(), "unsupported camera", "");
      }
      try {
        Files.writeString(request.output(), "converted");
      } catch (IOException ex) {
        throw new ProcessingException(ex.getMessage(), ex);
      }
      return new RawConvertResult(true, name(), request.input(), request.output(), "", Duration.ZERO);
    }
  }
}
