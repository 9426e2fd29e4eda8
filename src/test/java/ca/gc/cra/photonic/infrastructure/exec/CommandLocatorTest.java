package ca.gc.cra.photonic.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@DisabledOnOs(OS.WINDOWS)
class CommandLocatorTest {
  @TempDir Path tempDir;

  @Test
  void findsExecutableOnSearchPath() throws IOException {
    Path first = Files.createDirectories(tempDir.resolve("bin1"));
    Path second = Files.createDirectories(tempDir.resolve("bin2"));
    Path tool = Files.writeString(second.resolve("enfuse"), "#!/bin/sh\n");
    assertTrue(tool.toFile().setExecutable(true));

    CommandLocator locator = new CommandLocator(List.of(first, second));

    assertEquals(tool, locator.find("enfuse").orElseThrow());
  }

  @Test
  void ignoresNonExecutableFiles() throws IOException {
    Files.writeString(tempDir.resolve("dcraw"), "text");

    CommandLocator locator = new CommandLocator(List.of(tempDir));

    assertTrue(locator.find("dcraw").isEmpty());
  }

  @Test
  void absolutePathIsCheckedDirectly() throws IOException {
    Path tool = Files.writeString(tempDir.resolve("ffmpeg"), "#!/bin/sh\n");
    assertTrue(tool.toFile().setExecutable(true));

    CommandLocator locator = new CommandLocator(List.of());

    assertEquals(tool, locator.find(tool.toString()).orElseThrow());
    assertTrue(locator.find(tempDir.resolve("missing").toString()).isEmpty());
  }

  @Test
  void blankNameIsNeverFound() {
    CommandLocator locator = new CommandLocator(List.of(tempDir));

    assertTrue(locator.find(" ").isEmpty());
    assertTrue(locator.find(null).isEmpty());
  }
}
