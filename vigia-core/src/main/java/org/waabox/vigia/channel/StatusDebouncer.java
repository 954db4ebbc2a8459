package org.waabox.vigia.channel;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.vigia.schedule.ScheduledTask;
import org.waabox.vigia.schedule.TaskScheduler;

/**
 * Collapses bursts of raw channel statuses into a single settled status.
 *
 * <p>Every submitted status replaces the pending one and restarts the
 * window, so there is at most one scheduled settlement at any time. When
 * the window elapses without a new status, the handler receives the most
 * recent value. The handler runs on a scheduler thread, outside of this
 * debouncer's lock.
 *
 * <p>Once {@link #cancel()} returns the handler is never invoked again.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class StatusDebouncer {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(StatusDebouncer.class);

  /** The scheduler of the settlement timer, never null. */
  private final TaskScheduler scheduler;

  /** The quiet period before a status settles, never null. */
  private final Duration window;

  /** Receives settled statuses, never null. */
  private final Consumer<ChannelStatus> handler;

  /** Guards the pending timer and the generation counter. */
  private final Object lock = new Object();

  /** The pending settlement, null if none. */
  private ScheduledTask pending;

  /** Identifies the latest submission; stale timers compare against it. */
  private long generation;

  /** Whether the debouncer was cancelled. */
  private boolean cancelled;

  /**
   * Creates a new debouncer.
   *
   * @param theScheduler the scheduler for the settlement timer, never null
   * @param theWindow    the debounce window, never null or negative
   * @param theHandler   the settled-status handler, never null
   */
  public StatusDebouncer(final TaskScheduler theScheduler,
      final Duration theWindow, final Consumer<ChannelStatus> theHandler) {
    scheduler = Objects.requireNonNull(theScheduler,
        "scheduler must not be null");
    window = Objects.requireNonNull(theWindow, "window must not be null");
    handler = Objects.requireNonNull(theHandler, "handler must not be null");
    if (theWindow.isNegative()) {
      throw new IllegalArgumentException(
          "window must not be negative, got: " + theWindow);
    }
  }

  /**
   * Submits a raw status, restarting the debounce window.
   *
   * @param status the raw status, never null
   */
  public void submit(final ChannelStatus status) {
    enqueue(status, window);
  }

  /**
   * Submits a status that settles without waiting for the window. It
   * still replaces any pending status and is delivered on the scheduler.
   *
   * @param status the status, never null
   */
  public void submitNow(final ChannelStatus status) {
    enqueue(status, Duration.ZERO);
  }

  /**
   * Drops any pending settlement and makes this debouncer inert.
   */
  public void cancel() {
    synchronized (lock) {
      cancelled = true;
      generation++;
      if (pending != null) {
        pending.cancel();
        pending = null;
      }
    }
  }

  /**
   * Whether a settlement is scheduled.
   *
   * @return true if a status is waiting for its window to elapse
   */
  public boolean hasPending() {
    synchronized (lock) {
      return pending != null;
    }
  }

  /** Replaces the pending settlement.
   *
   * @param status the status, never null
   * @param delay  the delay before settling, never null
   */
  private void enqueue(final ChannelStatus status, final Duration delay) {
    Objects.requireNonNull(status, "status must not be null");
    synchronized (lock) {
      if (cancelled) {
        log.debug("Ignoring status {} on a cancelled debouncer", status);
        return;
      }
      if (pending != null) {
        pending.cancel();
      }
      final long current = ++generation;
      pending = scheduler.schedule(() -> settle(current, status), delay);
    }
  }

  /** Delivers a status if it is still the latest submission.
   *
   * @param submitted the generation of the submission
   * @param status    the status to deliver, never null
   */
  private void settle(final long submitted, final ChannelStatus status) {
    synchronized (lock) {
      if (cancelled || submitted != generation) {
        return;
      }
      pending = null;
    }
    log.debug("Channel status settled to {}", status);
    try {
      handler.accept(status);
    } catch (final RuntimeException e) {
      log.error("Settled status handler failed for {}: {}", status,
          e.getMessage(), e);
    }
  }
}
