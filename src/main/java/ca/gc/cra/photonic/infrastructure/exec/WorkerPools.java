package ca.gc.cra.photonic.infrastructure.exec;

import ca.gc.cra.photonic.validation.Strings;
import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools that host the job pipeline's worker loops.
 *
 * @since 0.1.0
 */
public final class WorkerPools {

  private WorkerPools() {}

  /**
   * Builds a pool for exactly {@code workers} long-lived job loops.
   *
   * <p>Threads are named {@code <threadPrefix>-1 .. <threadPrefix>-<workers>} and are non-daemon, so a
   * running job keeps the JVM alive until the pipeline has waited for it. Jobs are queued by the
   * pipeline, not by the pool: a loop submitted while every thread is busy is rejected with
   * {@link RejectedExecutionException}.
   *
   * @param threadPrefix thread name prefix, e.g. {@code photonic-worker}
   * @param workers number of loops, at least 1
   * @param crashHandler receives any throwable that escapes a loop
   * @return a pool sized for {@code workers} loops
   */
  public static ExecutorService jobWorkers(String threadPrefix, int workers, UncaughtExceptionHandler crashHandler) {
    String prefix = Strings.requireNonBlank("threadPrefix", threadPrefix);
    Objects.requireNonNull(crashHandler, "crashHandler");
    if (workers < 1) {
      throw new IllegalArgumentException("workers must be at least 1, got " + workers);
    }
    AtomicInteger next = new AtomicInteger(1);
    return new ThreadPoolExecutor(
        workers,
        workers,
        0L,
        TimeUnit.MILLISECONDS,
        new SynchronousQueue<>(),
        loop -> {
          Thread thread = new Thread(loop, prefix + "-" + next.getAndIncrement());
          thread.setDaemon(false);
          thread.setUncaughtExceptionHandler(crashHandler);
          return thread;
        },
        new ThreadPoolExecutor.AbortPolicy());
  }
}
