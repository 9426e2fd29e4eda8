package ca.gc.cra.photonic.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class ScratchDirectoryTest {

  @Test
  void closeDeletesNestedContent() throws IOException {
    Path root;
    try (ScratchDirectory scratch = ScratchDirectory.create("photonic-test-")) {
      root = scratch.path();
      Files.createDirectories(scratch.resolve("frames"));
      Files.writeString(scratch.resolve("frames").resolve("frame_0001.jpg"), "x");
      assertTrue(Files.isDirectory(root));
    }

    assertFalse(Files.exists(root));
  }

  @Test
  void closeIsIdempotent() throws IOException {
    ScratchDirectory scratch = ScratchDirectory.create("photonic-test-");
    scratch.close();
    scratch.close();

    assertFalse(Files.exists(scratch.path()));
  }
}
