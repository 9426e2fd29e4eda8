package ca.gc.cra.photonic.domain.job;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class JobTest {
  private static final Path IN = Path.of("frames");
  private static final Path OUT = Path.of("out");

  @Test
  void ofDerivesTypeFromOptions() {
    Job job = Job.of(JobId.of("a"), IN, OUT, TimelapseOptions.defaults());

    assertEquals(JobType.TIMELAPSE, job.type());
    assertSame(job.options(), job.optionsAs(TimelapseOptions.class));
  }

  @Test
  void rejectsOptionsOfAnotherType() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> new Job(JobId.of("a"), JobType.STACK, IN, OUT, ScanOptions.defaults()));
    assertEquals("options for scan cannot be used with a stack job", ex.getMessage());
  }

  @Test
  void optionsAsRejectsWrongVariant() {
    Job job = Job.of(JobId.of("a"), IN, OUT, StackOptions.defaults());

    assertThrows(IllegalStateException.class, () -> job.optionsAs(AlignOptions.class));
  }

  @Test
  void jobIdIsValidated() {
    assertEquals("abc", JobId.of("  abc ").value());
    assertThrows(IllegalArgumentException.class, () -> JobId.of(" "));
    assertThrows(IllegalArgumentException.class, () -> JobId.of("x".repeat(129)));
    assertEquals(36, JobId.random().value().length());
  }

  @Test
  void jobTypeWireNames() {
    assertEquals(JobType.RAW_CONVERT, JobType.fromWireName("RAW_CONVERT"));
    assertEquals(JobType.PANORAMIC, JobType.fromWireName(" panoramic "));
    assertEquals("raw-convert", JobType.RAW_CONVERT.toString());
    assertThrows(IllegalArgumentException.class, () -> JobType.fromWireName("hdr"));
    assertEquals("cancelled", JobStatus.CANCELLED.wireName());
  }
}
