package ca.gc.cra.photonic.application.pipeline;

import ca.gc.cra.photonic.domain.job.JobResult;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * One subscriber's bounded result stream.
 *
 * <p>The pipeline offers results without blocking; when the buffer is full the offer fails and the
 * result is lost for this subscriber only. Once closed, buffered results can still be read, after which
 * {@link #next(Duration)} returns empty immediately.
 *
 * <p>Thread-safety: safe for one consuming thread and any number of producing threads.
 *
 * @since 0.1.0
 */
public final class ResultSubscription implements AutoCloseable {
  private final int capacity;
  private final ArrayDeque<JobResult> buffer;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();
  private final Consumer<ResultSubscription> onClose;
  private boolean closed;

  ResultSubscription(int capacity, Consumer<ResultSubscription> onClose) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
    this.buffer = new ArrayDeque<>(capacity);
    this.onClose = Objects.requireNonNull(onClose, "onClose");
  }

  static ResultSubscription alreadyClosed() {
    ResultSubscription subscription = new ResultSubscription(1, s -> {});
    subscription.markClosed();
    return subscription;
  }

  /**
   * Waits up to {@code timeout} for the next result.
   *
   * @param timeout maximum wait
   * @return next result; empty on timeout, or when closed and drained
   * @throws InterruptedException if interrupted while waiting
   */
  public Optional<JobResult> next(Duration timeout) throws InterruptedException {
    long remaining = Math.max(0L, timeout.toNanos());
    lock.lockInterruptibly();
    try {
      while (buffer.isEmpty()) {
        if (closed || remaining <= 0L) {
          return Optional.empty();
        }
        remaining = changed.awaitNanos(remaining);
      }
      return Optional.of(buffer.poll());
    } finally {
      lock.unlock();
    }
  }

  /** @return {@code true} once the pipeline stopped or the subscriber unsubscribed */
  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  /** @return number of results waiting to be read */
  public int buffered() {
    lock.lock();
    try {
      return buffer.size();
    } finally {
      lock.unlock();
    }
  }

  /** Unsubscribes. Idempotent. */
  @Override
  public void close() {
    if (markClosed()) {
      onClose.accept(this);
    }
  }

  boolean offer(JobResult result) {
    lock.lock();
    try {
      if (closed) {
        return true;
      }
      if (buffer.size() >= capacity) {
        return false;
      }
      buffer.add(result);
      changed.signalAll();
      return true;
    } finally {
      lock.unlock();
    }
  }

  boolean markClosed() {
    lock.lock();
    try {
      if (closed) {
        return false;
      }
      closed = true;
      changed.signalAll();
      return true;
    } finally {
      lock.unlock();
    }
  }
}
