package org.waabox.vigia.schedule;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link TaskScheduler} backed by a {@link ScheduledExecutorService}.
 *
 * <p>Tasks are wrapped so that an exception thrown by one execution is
 * logged instead of silently suppressing the following executions of a
 * periodic task.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ExecutorTaskScheduler implements TaskScheduler {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(ExecutorTaskScheduler.class);

  /** The underlying executor, never null. */
  private final ScheduledExecutorService executor;

  /**
   * Creates a scheduler with its own pool of daemon threads.
   *
   * @param threads the number of threads, must be positive
   */
  public ExecutorTaskScheduler(final int threads) {
    this(createExecutor(threads));
  }

  /**
   * Creates a scheduler on top of an existing executor.
   *
   * @param theExecutor the executor, never null
   */
  public ExecutorTaskScheduler(final ScheduledExecutorService theExecutor) {
    executor = Objects.requireNonNull(theExecutor,
        "executor must not be null");
  }

  /** {@inheritDoc} */
  @Override
  public ScheduledTask schedule(final Runnable task, final Duration delay) {
    Objects.requireNonNull(task, "task must not be null");
    Objects.requireNonNull(delay, "delay must not be null");
    final ScheduledFuture<?> future = executor.schedule(guard(task),
        delay.toMillis(), TimeUnit.MILLISECONDS);
    return new FutureTask(future);
  }

  /** {@inheritDoc} */
  @Override
  public ScheduledTask scheduleAtFixedRate(final Runnable task,
      final Duration initialDelay, final Duration period) {
    Objects.requireNonNull(task, "task must not be null");
    Objects.requireNonNull(initialDelay, "initialDelay must not be null");
    Objects.requireNonNull(period, "period must not be null");
    final ScheduledFuture<?> future = executor.scheduleAtFixedRate(
        guard(task), initialDelay.toMillis(), period.toMillis(),
        TimeUnit.MILLISECONDS);
    return new FutureTask(future);
  }

  /** {@inheritDoc} */
  @Override
  public void shutdown() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (final InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
    log.debug("ExecutorTaskScheduler stopped");
  }

  /** Wraps a task so that its failures are logged.
   *
   * @param task the task to wrap, never null
   * @return the guarded task, never null
   */
  private static Runnable guard(final Runnable task) {
    return () -> {
      try {
        task.run();
      } catch (final RuntimeException e) {
        log.error("Scheduled task failed: {}", e.getMessage(), e);
      }
    };
  }

  /** Creates the default executor with named daemon threads.
   *
   * @param threads the number of threads, must be positive
   * @return the executor, never null
   */
  private static ScheduledExecutorService createExecutor(final int threads) {
    if (threads <= 0) {
      throw new IllegalArgumentException(
          "threads must be greater than 0, got: " + threads);
    }
    final AtomicInteger counter = new AtomicInteger();
    return Executors.newScheduledThreadPool(threads, r -> {
      final Thread thread = new Thread(r,
          "vigia-scheduler-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
  }

  /** A {@link ScheduledTask} over a {@link ScheduledFuture}. */
  private static final class FutureTask implements ScheduledTask {

    /** The future of the scheduled execution, never null. */
    private final ScheduledFuture<?> future;

    /** Creates the handle.
     *
     * @param theFuture the future, never null
     */
    private FutureTask(final ScheduledFuture<?> theFuture) {
      future = theFuture;
    }

    @Override
    public void cancel() {
      future.cancel(false);
    }

    @Override
    public boolean isCancelled() {
      return future.isCancelled();
    }
  }
}
