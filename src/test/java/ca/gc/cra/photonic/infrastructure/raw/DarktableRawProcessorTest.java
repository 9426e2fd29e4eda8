package ca.gc.cra.photonic.infrastructure.raw;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.photonic.application.port.JobContext;
import ca.gc.cra.photonic.domain.raw.RawConvertRequest;
import ca.gc.cra.photonic.domain.raw.RawConvertResult;
import ca.gc.cra.photonic.testutil.ScriptedToolRunner;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DarktableRawProcessorTest {
  @TempDir Path tempDir;

  @Test
  void passesSidecarAndSettings() throws Exception {
    Path input = Files.writeString(tempDir.resolve("IMG_7.CR3"), "raw");
    Path sidecar = Files.writeString(tempDir.resolve("IMG_7.CR3.xmp"), "<xmp/>");
    Path output = tempDir.resolve("processed").resolve("IMG_7.jpg");
    ScriptedToolRunner runner = new ScriptedToolRunner("darktable-cli")
        .answering(command -> ScriptedToolRunner.producing(output));
    DarktableRawProcessor processor =
        new DarktableRawProcessor(true, new DarktableRawProcessor.Settings(false, true, 1920, 0), runner);

    processor.convert(new RawConvertRequest(input, output, 90), JobContext.NONE);

    List<String> argv = runner.singleArgv();
    assertEquals(
        List.of("darktable-cli", input.toString(), sidecar.toString(), output.getParent().toString(),
            "--apply-custom-presets", "false", "--hq", "true", "--width", "1920", "--out-ext", "jpg",
            "--core", "--configdir"),
        argv.subList(0, argv.size() - 1));
    assertTrue(argv.get(argv.size() - 1).endsWith("darktable-config"));
  }

  @Test
  void stemSidecarIsAccepted() throws Exception {
    Path input = Files.writeString(tempDir.resolve("IMG_8.NEF"), "raw");
    Path sidecar = Files.writeString(tempDir.resolve("IMG_8.xmp"), "<xmp/>");

    assertEquals(sidecar, DarktableRawProcessor.sidecar(input).orElseThrow());
    assertTrue(DarktableRawProcessor.sidecar(tempDir.resolve("other.NEF")).isEmpty());
  }

  @Test
  void findsOutputNamedAfterInputStem() throws Exception {
    Path input = tempDir.resolve("DSC_0100.ARW");
    Path requested = tempDir.resolve("out").resolve("converted.tif");
    Path written = tempDir.resolve("out").resolve("DSC_0100.tif");
    ScriptedToolRunner runner = new ScriptedToolRunner("darktable-cli")
        .answering(command -> ScriptedToolRunner.producing(written));
    DarktableRawProcessor processor =
        new DarktableRawProcessor(true, DarktableRawProcessor.Settings.defaults(), runner);

    RawConvertResult result = processor.convert(new RawConvertRequest(input, requested, 90), JobContext.NONE);

    assertEquals(written, result.output());
  }
}
