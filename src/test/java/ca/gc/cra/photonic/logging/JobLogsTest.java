package ca.gc.cra.photonic.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import ca.gc.cra.photonic.domain.job.Job;
import ca.gc.cra.photonic.domain.job.JobId;
import ca.gc.cra.photonic.domain.job.RawConvertOptions;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class JobLogsTest {

  @AfterEach
  void clearMdc() {
    MDC.clear();
  }

  @Test
  void scopeTagsAndUntagsCurrentThread() {
    Job job = Job.of(JobId.of("job-7"), Path.of("in.cr2"), Path.of("out.jpg"), RawConvertOptions.defaults());
    MDC.put("requestId", "r1");

    try (JobLogs ignored = JobLogs.open("photonic", job)) {
      assertEquals("job-7", MDC.get(JobLogs.JOB_ID));
      assertEquals("raw-convert", MDC.get(JobLogs.JOB_TYPE));
      assertEquals("photonic", MDC.get(JobLogs.PIPELINE));
    }

    assertNull(MDC.get(JobLogs.JOB_ID));
    assertNull(MDC.get(JobLogs.PIPELINE));
    assertEquals("r1", MDC.get("requestId"));
  }
}
