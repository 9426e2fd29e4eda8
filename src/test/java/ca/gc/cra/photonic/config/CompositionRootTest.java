package ca.gc.cra.photonic.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.photonic.application.pipeline.JobPipeline;
import ca.gc.cra.photonic.application.port.ClockPort;
import ca.gc.cra.photonic.application.port.MetricsPort;
import ca.gc.cra.photonic.application.port.PersistencePort;
import ca.gc.cra.photonic.domain.align.AlignmentType;
import ca.gc.cra.photonic.infrastructure.persistence.JsonlJobJournalAdapter;
import ca.gc.cra.photonic.testutil.ScriptedToolRunner;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {

  @TempDir Path tempDir;

  @Test
  void registersProcessorsInFallbackOrder() {
    CompositionRoot root = newRoot(PipelineConfig.defaults());

    assertEquals(List.of("imagemagick", "darktable", "dcraw", "rawtherapee"), root.rawProcessors().names());
    assertEquals(List.of("native-star", "align_image_stack"), root.alignmentProcessors().names());
    assertEquals(List.of("native-statistical", "enfuse"), root.stackingProcessors().names());
  }

  @Test
  void disablingAstroAlignmentOmitsStarAligner() {
    CompositionRoot root = newRoot(PipelineConfig.fromMap(Map.of("alignment.astro.enabled", "false")));

    assertEquals(List.of("align_image_stack"), root.alignmentProcessors().names());
    assertTrue(root.alignmentProcessors().available(AlignmentType.ASTRO).isEmpty());
  }

  @Test
  void nothingIsAvailableWithoutTools() {
    CompositionRoot root = newRoot(PipelineConfig.defaults());

    assertFalse(root.rawProcessors().hasAvailableProcessor());
    assertEquals(1, root.alignmentProcessors().available(AlignmentType.ASTRO).size());
  }

  @Test
  void journalConfiguredOpensJsonlAdapter() {
    CompositionRoot root = newRoot(PipelineConfig.fromMap(Map.of("journal", tempDir.toString())));

    PersistencePort persistence = root.persistence();

    JsonlJobJournalAdapter journal = assertInstanceOf(JsonlJobJournalAdapter.class, persistence);
    assertEquals(tempDir.resolve(JsonlJobJournalAdapter.FILE_NAME), journal.file());
  }

  @Test
  void noJournalUsesNoOpPersistence() {
    assertSame(PersistencePort.NONE, newRoot(PipelineConfig.defaults()).persistence());
  }

  @Test
  void newPipelineUsesConfiguredSettings() {
    CompositionRoot root = newRoot(PipelineConfig.fromMap(Map.of("workers", "2", "subscriberBuffer", "5")));

    try (JobPipeline pipeline = root.newPipeline()) {
      assertEquals(2, pipeline.settings().workers());
      assertEquals(5, pipeline.settings().subscriberBuffer());
      assertFalse(pipeline.isStopped());
    }
  }

  private static CompositionRoot newRoot(PipelineConfig config) {
    return new CompositionRoot(config, MetricsPort.NO_OP, new ScriptedToolRunner(), ClockPort.SYSTEM);
  }
}
