package ca.gc.cra.photonic.infrastructure.media;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.photonic.application.port.JobContext;
import ca.gc.cra.photonic.application.port.ToolCommand;
import ca.gc.cra.photonic.application.port.ToolOutcome;
import ca.gc.cra.photonic.domain.error.InsufficientDataException;
import ca.gc.cra.photonic.domain.error.ToolFailureException;
import ca.gc.cra.photonic.domain.media.PanoramaRequest;
import ca.gc.cra.photonic.domain.media.PanoramaResult;
import ca.gc.cra.photonic.testutil.ScriptedToolRunner;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HuginPanoramaAssemblerTest {
  @TempDir Path tempDir;

  @Test
  void optionMappings() {
    assertEquals("4", HuginPanoramaAssembler.cleanDistance("low"));
    assertEquals("3", HuginPanoramaAssembler.cleanDistance("moderate"));
    assertEquals(List.of("-i", "3", "-a"), HuginPanoramaAssembler.interpolation("ultra"));
    assertEquals(List.of("-i", "1"), HuginPanoramaAssembler.interpolation(null));
    assertEquals("--no-blend", HuginPanoramaAssembler.blendOption("none"));
    assertEquals("--levels=29", HuginPanoramaAssembler.blendOption("multiband"));
  }

  @Test
  void rewritesProjectionOnPanoramaLine() throws Exception {
    Path pto = tempDir.resolve("project.pto");
    Files.write(pto, List.of("# hugin project", "p f0 w3000 h1500 v360", "i w4000 h3000 f0"), StandardCharsets.UTF_8);
    List<String> warnings = new ArrayList<>();

    HuginPanoramaAssembler.rewriteProjection(pto, "Spherical", warnings);

    assertEquals(List.of("# hugin project", "p f2 w3000 h1500 v360", "i w4000 h3000 f0"),
        Files.readAllLines(pto, StandardCharsets.UTF_8));
    assertTrue(warnings.isEmpty());
  }

  @Test
  void stitchesWithHuginToolchain() throws Exception {
    Path output = tempDir.resolve("out").resolve("pano.tif");
    ScriptedToolRunner runner = new ScriptedToolRunner(HuginPanoramaAssembler.HUGIN_TOOLS.toArray(String[]::new))
        .answering(HuginPanoramaAssemblerTest::simulateHugin);
    HuginPanoramaAssembler assembler = new HuginPanoramaAssembler(runner);

    PanoramaResult result = assembler.assemble(request(output), JobContext.NONE);

    assertEquals("hugin", result.tool());
    assertEquals(output, result.output());
    assertEquals(2, result.imageCount());
    assertTrue(result.warnings().isEmpty(), result.warnings().toString());
    List<String> executables = runner.commands().stream().map(ToolCommand::executable).toList();
    assertEquals(
        List.of("pto_gen", "cpfind", "cpclean", "linefind", "autooptimiser", "pano_modify", "nona", "enblend"),
        executables);
    List<String> enblend = runner.commands().get(7).argv();
    assertEquals(List.of("enblend", "-o", output.toString(), "--levels=29"), enblend.subList(0, 4));
    assertEquals(2, enblend.size() - 4);
  }

  @Test
  void optionalStepFailuresBecomeWarnings() throws Exception {
    Path output = tempDir.resolve("pano.tif");
    ScriptedToolRunner runner = new ScriptedToolRunner(HuginPanoramaAssembler.HUGIN_TOOLS.toArray(String[]::new))
        .answering(command -> command.executable().equals("linefind")
            ? ScriptedToolRunner.failure(1, "no lines")
            : simulateHugin(command));
    HuginPanoramaAssembler assembler = new HuginPanoramaAssembler(runner);

    PanoramaResult result = assembler.assemble(request(output), JobContext.NONE);

    assertEquals("hugin", result.tool());
    assertEquals(List.of("linefind failed with status 1"), result.warnings());
  }

  @Test
  void fallsBackToImageMagickAppend() throws Exception {
    Path output = tempDir.resolve("wide");
    ScriptedToolRunner runner = new ScriptedToolRunner("convert")
        .answering(command -> ScriptedToolRunner.producing(Path.of(command.argv().get(command.argv().size() - 1))));
    HuginPanoramaAssembler assembler = new HuginPanoramaAssembler(runner);

    PanoramaResult result = assembler.assemble(request(output), JobContext.NONE);

    assertEquals("imagemagick", result.tool());
    assertEquals(tempDir.resolve("wide.tif"), result.output());
    assertEquals(List.of("hugin tools not installed"), result.warnings());
    List<String> argv = runner.singleArgv();
    assertEquals("+append", argv.get(argv.size() - 2));
  }

  @Test
  void failsWithoutAnyStitcher() {
    HuginPanoramaAssembler assembler = new HuginPanoramaAssembler(new ScriptedToolRunner());

    ToolFailureException ex = assertThrows(ToolFailureException.class,
        () -> assembler.assemble(request(tempDir.resolve("pano.tif")), JobContext.NONE));
    assertEquals("panorama: no stitching tool available", ex.getMessage());
    assertThrows(InsufficientDataException.class, () -> assembler.assemble(new PanoramaRequest(
        List.of(tempDir.resolve("a.jpg")), tempDir.resolve("pano.tif"), "cylindrical", "multiband", "normal", "moderate"),
        JobContext.NONE));
  }

  private PanoramaRequest request(Path output) {
    return new PanoramaRequest(
        List.of(tempDir.resolve("left.jpg"), tempDir.resolve("right.jpg")),
        output, "cylindrical", "multiband", "normal", "moderate");
  }

  private static ToolOutcome simulateHugin(ToolCommand command) {
    String out = ScriptedToolRunner.valueAfter(command, "-o");
    if (command.executable().equals("nona")) {
      ScriptedToolRunner.producing(Path.of(out + "0000.tif"));
      return ScriptedToolRunner.producing(Path.of(out + "0001.tif"));
    }
    return ScriptedToolRunner.producing(Path.of(out));
  }
}
