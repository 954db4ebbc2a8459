package org.waabox.vigia.schedule;

import java.time.Duration;

/**
 * Runs the timers of the subscription layer: debounce windows, backoff
 * retries, poll intervals and reconnect attempts.
 *
 * <p>Every timer is owned by the component that scheduled it and is
 * explicitly cancelled on teardown through its {@link ScheduledTask}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface TaskScheduler {

  /**
   * Schedules a single execution of the task.
   *
   * @param task  the task, never null
   * @param delay the delay before the execution, never null or negative
   *
   * @return the handle of the scheduled task, never null
   */
  ScheduledTask schedule(Runnable task, Duration delay);

  /**
   * Schedules periodic executions of the task.
   *
   * <p>Executions of the same task never overlap.
   *
   * @param task         the task, never null
   * @param initialDelay the delay before the first execution, never null
   * @param period       the period between executions, must be positive
   *
   * @return the handle of the scheduled task, never null
   */
  ScheduledTask scheduleAtFixedRate(Runnable task, Duration initialDelay,
      Duration period);

  /**
   * Stops the scheduler. Pending tasks are discarded.
   */
  void shutdown();
}
