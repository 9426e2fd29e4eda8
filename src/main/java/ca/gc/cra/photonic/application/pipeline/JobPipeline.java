package ca.gc.cra.photonic.application.pipeline;

import ca.gc.cra.photonic.application.port.JobProcessor;
import ca.gc.cra.photonic.application.port.MetricsPort;
import ca.gc.cra.photonic.application.port.PersistencePort;
import ca.gc.cra.photonic.domain.error.JobCancelledException;
import ca.gc.cra.photonic.domain.job.Job;
import ca.gc.cra.photonic.domain.job.JobId;
import ca.gc.cra.photonic.domain.job.JobResult;
import ca.gc.cra.photonic.domain.job.JobStatus;
import ca.gc.cra.photonic.infrastructure.exec.WorkerPools;
import ca.gc.cra.photonic.logging.JobLogs;
import java.lang.Thread.UncaughtExceptionHandler;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs jobs on a fixed worker pool and broadcasts every result to live subscribers.
 * <p><strong>Why:</strong> Image jobs take seconds to hours and mostly wait on subprocesses; a bounded pool
 * keeps the host responsive, and the bounded queue pushes back on callers instead of piling up work.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Accept jobs into a FIFO queue of {@code 2 x workers} slots without ever blocking the caller.</li>
 *   <li>Run each job to completion on one worker; any exception or error becomes a failed result.</li>
 *   <li>Offer each result to every subscriber's own bounded buffer; a full buffer drops that result for
 *       that subscriber only.</li>
 *   <li>Record lifecycle events through {@link PersistencePort}; persistence failures are logged and
 *       ignored.</li>
 *   <li>Stop idempotently: cancel running work, wait for it, discard queued jobs, close every stream.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #submit}, {@link #subscribe}, and {@link #stop} may be called
 * from any thread. The subscriber list is guarded by a lock and never iterated without it.</p>
 * <p><strong>Observability:</strong> Counters {@code pipeline.jobs.submitted|rejected|completed|failed|cancelled}
 * and {@code pipeline.results.dropped}; observations {@code pipeline.job.latencyMillis} and
 * {@code pipeline.queue.depth}.</p>
 *
 * @since 0.1.0
 */
public final class JobPipeline implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(JobPipeline.class);

  private static final String PIPELINE_NAME = "jobs";
  private static final int DEFAULT_WORKERS = Math.max(1, Runtime.getRuntime().availableProcessors() / 2);
  private static final int DEFAULT_SUBSCRIBER_BUFFER = 8;
  private static final Duration SHUTDOWN_PROGRESS_INTERVAL = Duration.ofSeconds(5);
  private static final long WORKER_IDLE_POLL_MILLIS = 25L;

  private final JobProcessor processor;
  private final PersistencePort persistence;
  private final MetricsPort metrics;
  private final PipelineSettings settings;
  private final BlockingQueue<Job> queue;
  private final Set<JobId> inFlight = ConcurrentHashMap.newKeySet();
  private final List<ResultSubscription> subscribers = new ArrayList<>();
  private final ReentrantLock lock = new ReentrantLock();
  private final PipelineContext context = new PipelineContext();
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean stopRequested = new AtomicBoolean();
  private final UncaughtExceptionHandler workerCrashHandler = this::handleWorkerCrash;

  private volatile ExecutorService executor;

  /**
   * Pipeline tuning.
   *
   * @param workers number of worker threads; at least 1
   * @param subscriberBuffer results buffered per subscriber; at least 1
   */
  public record PipelineSettings(int workers, int subscriberBuffer) {
    public PipelineSettings {
      workers = Math.max(1, workers);
      subscriberBuffer = Math.max(1, subscriberBuffer);
    }

    /** @return half the available processors and an 8-result subscriber buffer */
    public static PipelineSettings defaults() {
      return new PipelineSettings(DEFAULT_WORKERS, DEFAULT_SUBSCRIBER_BUFFER);
    }

    /** @return job queue capacity, twice the worker count */
    public int queueCapacity() {
      return workers * 2;
    }
  }

  /**
   * Creates a pipeline; call {@link #start()} before submitting.
   *
   * @param processor job executor, normally {@link JobRouter}
   * @param settings worker and buffer sizing
   * @param persistence lifecycle recorder; {@link PersistencePort#NONE} when absent
   * @param metrics metrics sink
   */
  public JobPipeline(
      JobProcessor processor, PipelineSettings settings, PersistencePort persistence, MetricsPort metrics) {
    this.processor = Objects.requireNonNull(processor, "processor");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.persistence = Objects.requireNonNullElse(persistence, PersistencePort.NONE);
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.queue = new ArrayBlockingQueue<>(settings.queueCapacity());
  }

  /** @return pipeline tuning */
  public PipelineSettings settings() {
    return settings;
  }

  /**
   * Launches the worker threads.
   *
   * @throws IllegalStateException if already started or stopped
   */
  public void start() {
    if (stopRequested.get()) {
      throw new IllegalStateException("Pipeline already stopped");
    }
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Pipeline already started");
    }
    ExecutorService pool =
        WorkerPools.jobWorkers("photonic-worker", settings.workers(), workerCrashHandler);
    for (int i = 0; i < settings.workers(); i++) {
      pool.execute(new Worker());
    }
    executor = pool;
    log.info(
        "Started {} workers with queue capacity {} and subscriber buffer {}",
        settings.workers(),
        settings.queueCapacity(),
        settings.subscriberBuffer());
  }

  /**
   * Queues a job without blocking.
   *
   * @param job job to run
   * @throws JobRejectedException when the queue is full, the pipeline is stopped, or the ID is in flight
   */
  public void submit(Job job) throws JobRejectedException {
    Objects.requireNonNull(job, "job");
    if (stopRequested.get() || !started.get()) {
      reject(job, JobRejectedException.Reason.STOPPED, "pipeline is not running");
    }
    if (!inFlight.add(job.id())) {
      reject(job, JobRejectedException.Reason.DUPLICATE_ID, "job " + job.id() + " is already queued or running");
    }
    safePersist("queued", () -> persistence.recordJobQueued(job, JobStatus.QUEUED));
    if (!queue.offer(job)) {
      inFlight.remove(job.id());
      reject(job, JobRejectedException.Reason.QUEUE_FULL,
          "job queue is full (" + settings.queueCapacity() + " slots)");
    }
    if (stopRequested.get() && queue.remove(job)) {
      inFlight.remove(job.id());
      reject(job, JobRejectedException.Reason.STOPPED, "pipeline is stopping");
    }
    metrics.increment("pipeline.jobs.submitted");
    metrics.observe("pipeline.queue.depth", queue.size());
    log.debug("Queued {} job {} ({} waiting)", job.type(), job.id(), queue.size());
  }

  /**
   * Opens a result stream. Results produced before this call are not replayed.
   *
   * @return new subscription; already closed when the pipeline has stopped
   */
  public ResultSubscription subscribe() {
    lock.lock();
    try {
      if (stopRequested.get()) {
        return ResultSubscription.alreadyClosed();
      }
      ResultSubscription subscription = new ResultSubscription(settings.subscriberBuffer(), this::unsubscribe);
      subscribers.add(subscription);
      return subscription;
    } finally {
      lock.unlock();
    }
  }

  /** @return {@code true} once {@link #stop()} has been called */
  public boolean isStopped() {
    return stopRequested.get();
  }

  /**
   * Stops the pipeline. Safe to call repeatedly and from any thread.
   *
   * <p>Running jobs are signalled through their {@code JobContext} and awaited without a time limit;
   * jobs still queued are discarded and recorded as cancelled; every subscription and the persistence
   * port are closed only after the last worker has exited.
   */
  public void stop() {
    lock.lock();
    try {
      if (!stopRequested.compareAndSet(false, true)) {
        return;
      }
    } finally {
      lock.unlock();
    }
    log.info("Stopping pipeline");
    context.cancel();
    awaitWorkers();

    List<Job> discarded = new ArrayList<>();
    queue.drainTo(discarded);
    for (Job job : discarded) {
      metrics.increment("pipeline.jobs.cancelled");
      safePersist("cancelled", () -> persistence.recordJobResult(
          job.id(), JobStatus.CANCELLED, Map.of(), "pipeline stopped before the job started"));
    }
    if (!discarded.isEmpty()) {
      log.warn("Discarded {} queued jobs at shutdown", discarded.size());
    }
    inFlight.clear();

    List<ResultSubscription> open;
    lock.lock();
    try {
      open = new ArrayList<>(subscribers);
      subscribers.clear();
    } finally {
      lock.unlock();
    }
    for (ResultSubscription subscription : open) {
      subscription.markClosed();
    }

    try {
      persistence.close();
    } catch (Exception ex) {
      log.error("Failed to close persistence", ex);
    }
    log.info("Pipeline stopped");
  }

  @Override
  public void close() {
    stop();
  }

  private final class Worker implements Runnable {
    @Override
    public void run() {
      try {
        while (!stopRequested.get()) {
          Job job = queue.poll(WORKER_IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
          if (job == null) {
            continue;
          }
          runJob(job);
        }
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        if (!stopRequested.get()) {
          log.warn("Worker {} interrupted while pipeline running", Thread.currentThread().getName());
        }
      }
    }
  }

  private void runJob(Job job) {
    long startNanos = System.nanoTime();
    JobResult result;
    try (JobLogs ignored = JobLogs.open(PIPELINE_NAME, job)) {
      safePersist("start", () -> persistence.recordJobStart(job.id()));
      log.info("Job started: input={} output={}", job.inputPath(), job.outputPath());
      result = execute(job);
      long latencyMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
      metrics.observe("pipeline.job.latencyMillis", latencyMillis);
      JobStatus status = statusOf(result);
      switch (status) {
        case COMPLETED -> {
          metrics.increment("pipeline.jobs.completed");
          log.info("Job completed in {} ms", latencyMillis);
        }
        case CANCELLED -> {
          metrics.increment("pipeline.jobs.cancelled");
          log.warn("Job cancelled after {} ms", latencyMillis);
        }
        default -> {
          metrics.increment("pipeline.jobs.failed");
          log.error("Job failed after {} ms: {}", latencyMillis, result.errorMessage());
        }
      }
      JobResult finished = result;
      safePersist("result", () -> persistence.recordJobResult(
          job.id(), status, finished.metadata(), finished.errorMessage()));
    } finally {
      inFlight.remove(job.id());
    }
    broadcast(result);
  }

  private JobResult execute(Job job) {
    try {
      JobResult result = processor.process(job, context);
      if (result == null) {
        return JobResult.failure(job, new IllegalStateException("processor returned no result"));
      }
      if (!result.jobId().equals(job.id())) {
        return JobResult.failure(job, new IllegalStateException(
            "processor returned a result for job " + result.jobId()), result.metadata());
      }
      return result;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return JobResult.failure(job, new JobCancelledException("interrupted"));
    } catch (Exception ex) {
      log.debug("Processor threw for job {}", job.id(), ex);
      return JobResult.failure(job, ex);
    } catch (Error err) {
      // a crashed job still yields a result and the worker keeps taking jobs
      log.error("Job {} crashed with {}", job.id(), err.toString(), err);
      return JobResult.failure(job, err);
    }
  }

  private static JobStatus statusOf(JobResult result) {
    if (result.isSuccess()) {
      return JobStatus.COMPLETED;
    }
    return result.error() instanceof JobCancelledException ? JobStatus.CANCELLED : JobStatus.FAILED;
  }

  private void broadcast(JobResult result) {
    lock.lock();
    try {
      for (ResultSubscription subscription : subscribers) {
        if (!subscription.offer(result)) {
          metrics.increment("pipeline.results.dropped");
          log.warn("Subscriber buffer full; dropped result for job {}", result.jobId());
        }
      }
    } finally {
      lock.unlock();
    }
  }

  private void unsubscribe(ResultSubscription subscription) {
    lock.lock();
    try {
      subscribers.remove(subscription);
    } finally {
      lock.unlock();
    }
  }

  private void reject(Job job, JobRejectedException.Reason reason, String message) throws JobRejectedException {
    metrics.increment("pipeline.jobs.rejected");
    if (reason != JobRejectedException.Reason.DUPLICATE_ID) {
      safePersist("rejected", () -> persistence.recordJobQueued(job, JobStatus.REJECTED));
    }
    log.warn("Rejected job {}: {}", job.id(), message);
    throw new JobRejectedException(job.id(), reason, message);
  }

  /**
   * Waits until every worker has finished its current job. There is no upper bound: persistence and
   * subscriptions are closed afterwards, so a job that outlives this wait would report into closed
   * streams. Interrupting the stopping thread escalates to {@link ExecutorService#shutdownNow()} but
   * the wait continues; the interrupt status is restored on return.
   */
  private void awaitWorkers() {
    ExecutorService pool = executor;
    if (pool == null) {
      return;
    }
    pool.shutdown();
    boolean interrupted = false;
    long waitedMillis = 0L;
    while (true) {
      try {
        if (pool.awaitTermination(SHUTDOWN_PROGRESS_INTERVAL.toMillis(), TimeUnit.MILLISECONDS)) {
          break;
        }
        waitedMillis += SHUTDOWN_PROGRESS_INTERVAL.toMillis();
        log.warn("Still waiting for {} running jobs after {} ms", inFlight.size(), waitedMillis);
      } catch (InterruptedException ie) {
        if (!interrupted) {
          log.warn("Interrupted while stopping; interrupting workers and waiting for them to finish");
          pool.shutdownNow();
        }
        interrupted = true;
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
    executor = null;
  }

  private void handleWorkerCrash(Thread thread, Throwable throwable) {
    metrics.increment("pipeline.worker.crashed");
    log.error("Worker {} terminated by uncaught throwable", thread.getName(), throwable);
  }

  private void safePersist(String event, PersistenceCall call) {
    try {
      call.run();
    } catch (Exception ex) {
      metrics.increment("pipeline.persistence.error");
      log.warn("Failed to record {} event: {}", event, ex.getMessage());
    }
  }

  @FunctionalInterface
  private interface PersistenceCall {
    void run() throws Exception;
  }
}
