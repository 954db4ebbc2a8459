package org.waabox.vigia.spring;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.waabox.vigia.BackoffPolicy;
import org.waabox.vigia.VigiaConfig;

/**
 * Configuration properties for Vigia, mapped from the {@code vigia.*}
 * prefix in application.yml or application.properties.
 *
 * <p>Supports:
 * <ul>
 *   <li>{@code vigia.poll-interval} - time between poll ticks.</li>
 *   <li>{@code vigia.poll-batch-size} - records fetched per tick.</li>
 *   <li>{@code vigia.debounce-window} - channel status debounce.</li>
 *   <li>{@code vigia.backoff.base}, {@code vigia.backoff.max} and
 *       {@code vigia.backoff.max-attempts} - channel retries.</li>
 *   <li>{@code vigia.reconnect-interval} - periodic re-attempt of
 *       abandoned channels, disabled when not set.</li>
 *   <li>{@code vigia.scheduler-threads} - threads of the timer pool.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "vigia")
public class VigiaProperties {

  /** The time between poll ticks. */
  private Duration pollInterval = VigiaConfig.DEFAULT_POLL_INTERVAL;

  /** The maximum number of records per poll tick. */
  private int pollBatchSize = VigiaConfig.DEFAULT_POLL_BATCH_SIZE;

  /** The window a channel status must hold before it is acted upon. */
  private Duration debounceWindow = VigiaConfig.DEFAULT_DEBOUNCE_WINDOW;

  /** The re-attempt interval of abandoned channels, null if disabled. */
  private Duration reconnectInterval;

  /** The number of scheduler threads. */
  private int schedulerThreads = VigiaConfig.DEFAULT_SCHEDULER_THREADS;

  /** The channel establishment backoff. */
  private final Backoff backoff = new Backoff();

  public Duration getPollInterval() {
    return pollInterval;
  }

  public void setPollInterval(final Duration pollInterval) {
    this.pollInterval = pollInterval;
  }

  public int getPollBatchSize() {
    return pollBatchSize;
  }

  public void setPollBatchSize(final int pollBatchSize) {
    this.pollBatchSize = pollBatchSize;
  }

  public Duration getDebounceWindow() {
    return debounceWindow;
  }

  public void setDebounceWindow(final Duration debounceWindow) {
    this.debounceWindow = debounceWindow;
  }

  /**
   * Returns the re-attempt interval of abandoned channels.
   *
   * @return the interval, or null if re-attempts are disabled
   */
  public Duration getReconnectInterval() {
    return reconnectInterval;
  }

  public void setReconnectInterval(final Duration reconnectInterval) {
    this.reconnectInterval = reconnectInterval;
  }

  public int getSchedulerThreads() {
    return schedulerThreads;
  }

  public void setSchedulerThreads(final int schedulerThreads) {
    this.schedulerThreads = schedulerThreads;
  }

  public Backoff getBackoff() {
    return backoff;
  }

  /**
   * Builds the core configuration out of these properties.
   *
   * @return the configuration, never null
   *
   * @throws IllegalArgumentException if a property is out of range
   */
  public VigiaConfig toConfig() {
    final VigiaConfig.Builder builder = VigiaConfig.builder()
        .pollInterval(pollInterval)
        .pollBatchSize(pollBatchSize)
        .debounceWindow(debounceWindow)
        .schedulerThreads(schedulerThreads)
        .backoffPolicy(BackoffPolicy.of(backoff.getBase(), backoff.getMax(),
            backoff.getMaxAttempts()));
    if (reconnectInterval != null) {
      builder.reconnectInterval(reconnectInterval);
    }
    return builder.build();
  }

  /** The {@code vigia.backoff.*} properties. */
  public static class Backoff {

    /** The delay before the first retry. */
    private Duration base = BackoffPolicy.defaultPolicy().base();

    /** The upper bound of any retry delay. */
    private Duration max = BackoffPolicy.defaultPolicy().max();

    /** The number of retries after the initial attempt. */
    private int maxAttempts = BackoffPolicy.defaultPolicy().maxAttempts();

    public Duration getBase() {
      return base;
    }

    public void setBase(final Duration base) {
      this.base = base;
    }

    public Duration getMax() {
      return max;
    }

    public void setMax(final Duration max) {
      this.max = max;
    }

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(final int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }
  }
}
