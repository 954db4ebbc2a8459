package org.waabox.vigia.schedule;

/**
 * A handle to a task registered with a {@link TaskScheduler}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ScheduledTask {

  /**
   * Cancels the task.
   *
   * <p>After this method returns the task will not start again. An
   * execution that is already running is not interrupted. Calling this
   * method more than once has no effect.
   */
  void cancel();

  /**
   * Whether {@link #cancel()} has been called.
   *
   * @return true if the task was cancelled
   */
  boolean isCancelled();
}
