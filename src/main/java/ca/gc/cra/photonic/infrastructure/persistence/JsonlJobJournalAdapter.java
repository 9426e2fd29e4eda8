package ca.gc.cra.photonic.infrastructure.persistence;

import ca.gc.cra.photonic.application.port.ClockPort;
import ca.gc.cra.photonic.application.port.PersistencePort;
import ca.gc.cra.photonic.domain.job.Job;
import ca.gc.cra.photonic.domain.job.JobId;
import ca.gc.cra.photonic.domain.job.JobStatus;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Journal adapter appending one JSON object per lifecycle event to
 * {@code jobs.jsonl}.
 * <p><strong>Why:</strong> A line-oriented journal survives crashes mid-run and can be tailed or grepped
 * without tooling.</p>
 * <p><strong>Thread-safety:</strong> Writes are serialized on the instance monitor so lines never
 * interleave.</p>
 * <p>Every line carries {@code event}, {@code jobId}, {@code status}, and an ISO-8601 {@code timestamp};
 * queued events add {@code type}, {@code input}, {@code output}, and {@code options}; result events add
 * {@code metadata} and {@code error}.</p>
 *
 * @since 0.1.0
 */
public final class JsonlJobJournalAdapter implements PersistencePort {
  /** Journal file name inside the configured directory. */
  public static final String FILE_NAME = "jobs.jsonl";

  private final JsonFactory jsonFactory = new JsonFactory();
  private final Path file;
  private final ClockPort clock;

  /**
   * Creates a journal inside {@code directory}; the directory is created on first write.
   *
   * @param directory journal directory
   * @param clock timestamp source
   */
  public JsonlJobJournalAdapter(Path directory, ClockPort clock) {
    this.file = Objects.requireNonNull(directory, "directory").resolve(FILE_NAME);
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** @return journal file path */
  public Path file() {
    return file;
  }

  @Override
  public void recordJobQueued(Job job, JobStatus status) throws IOException {
    StringWriter out = new StringWriter();
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      writeHeader(gen, "queued", job.id(), status);
      gen.writeStringField("type", job.type().wireName());
      gen.writeStringField("input", job.inputPath().toString());
      gen.writeStringField("output", job.outputPath().toString());
      gen.writeFieldName("options");
      writeValue(gen, job.options().toMap());
      gen.writeEndObject();
    }
    append(out.toString());
  }

  @Override
  public void recordJobStart(JobId id) throws IOException {
    StringWriter out = new StringWriter();
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      writeHeader(gen, "started", id, JobStatus.RUNNING);
      gen.writeEndObject();
    }
    append(out.toString());
  }

  @Override
  public void recordJobResult(JobId id, JobStatus status, Map<String, Object> metadata, String error)
      throws IOException {
    StringWriter out = new StringWriter();
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      writeHeader(gen, "finished", id, status);
      gen.writeFieldName("metadata");
      writeValue(gen, metadata == null ? Map.of() : metadata);
      gen.writeStringField("error", error == null ? "" : error);
      gen.writeEndObject();
    }
    append(out.toString());
  }

  private void writeHeader(JsonGenerator gen, String event, JobId id, JobStatus status) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("event", event);
    gen.writeStringField("jobId", id.value());
    gen.writeStringField("status", status.wireName());
    gen.writeStringField("timestamp", Instant.ofEpochMilli(clock.nowMillis()).toString());
  }

  private static void writeValue(JsonGenerator gen, Object value) throws IOException {
    if (value == null) {
      gen.writeNull();
    } else if (value instanceof Boolean b) {
      gen.writeBoolean(b);
    } else if (value instanceof Integer || value instanceof Long || value instanceof Short) {
      gen.writeNumber(((Number) value).longValue());
    } else if (value instanceof Number n) {
      gen.writeNumber(n.doubleValue());
    } else if (value instanceof Map<?, ?> map) {
      gen.writeStartObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        gen.writeFieldName(String.valueOf(entry.getKey()));
        writeValue(gen, entry.getValue());
      }
      gen.writeEndObject();
    } else if (value instanceof Collection<?> items) {
      gen.writeStartArray();
      for (Object item : items) {
        writeValue(gen, item);
      }
      gen.writeEndArray();
    } else {
      gen.writeString(value.toString());
    }
  }

  private synchronized void append(String line) throws IOException {
    Path parent = file.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.writeString(
        file,
        line + "\n",
        StandardCharsets.UTF_8,
        StandardOpenOption.CREATE,
        StandardOpenOption.APPEND);
  }
}
