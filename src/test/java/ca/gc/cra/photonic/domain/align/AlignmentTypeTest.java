package ca.gc.cra.photonic.domain.align;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class AlignmentTypeTest {

  @Test
  void infersFromFrameCount() {
    assertEquals(AlignmentType.GENERAL, AlignmentType.infer(0));
    assertEquals(AlignmentType.PANORAMIC, AlignmentType.infer(2));
    assertEquals(AlignmentType.PANORAMIC, AlignmentType.infer(20));
    assertEquals(AlignmentType.TIMELAPSE, AlignmentType.infer(21));
  }

  @Test
  void resolvesWireNames() {
    assertEquals(AlignmentType.ASTRO, AlignmentType.fromWireName(" ASTRO "));
    assertThrows(IllegalArgumentException.class, () -> AlignmentType.fromWireName("hdr"));
  }
}
