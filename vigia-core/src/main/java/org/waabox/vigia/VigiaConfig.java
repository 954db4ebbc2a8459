package org.waabox.vigia;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Tuning of a {@link Vigia} registry.
 *
 * <p>Defaults:
 * <ul>
 *   <li>pollInterval: 20 minutes</li>
 *   <li>pollBatchSize: 50</li>
 *   <li>debounceWindow: 500 ms</li>
 *   <li>backoffPolicy: {@link BackoffPolicy#defaultPolicy()}</li>
 *   <li>reconnectInterval: none, a subscription that exhausted its
 *       backoff keeps polling until reconnected on demand</li>
 *   <li>schedulerThreads: 2</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class VigiaConfig {

  /** Default time between poll ticks. */
  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMinutes(20);

  /** Default number of records per poll tick. */
  public static final int DEFAULT_POLL_BATCH_SIZE = 50;

  /** Default status debounce window. */
  public static final Duration DEFAULT_DEBOUNCE_WINDOW =
      Duration.ofMillis(500);

  /** Default number of threads of the owned scheduler. */
  public static final int DEFAULT_SCHEDULER_THREADS = 2;

  /** The time between poll ticks, never null. */
  private final Duration pollInterval;

  /** The records per poll tick. */
  private final int pollBatchSize;

  /** The status debounce window, never null. */
  private final Duration debounceWindow;

  /** The establishment backoff, never null. */
  private final BackoffPolicy backoffPolicy;

  /** The periodic re-establishment interval, null if disabled. */
  private final Duration reconnectInterval;

  /** The threads of the owned scheduler. */
  private final int schedulerThreads;

  /** Creates the configuration out of its builder.
   *
   * @param builder the builder, never null
   */
  private VigiaConfig(final Builder builder) {
    pollInterval = builder.pollInterval;
    pollBatchSize = builder.pollBatchSize;
    debounceWindow = builder.debounceWindow;
    backoffPolicy = builder.backoffPolicy;
    reconnectInterval = builder.reconnectInterval;
    schedulerThreads = builder.schedulerThreads;
  }

  /**
   * Creates a configuration with every default.
   *
   * @return the configuration, never null
   */
  public static VigiaConfig defaults() {
    return builder().build();
  }

  /**
   * Creates a new builder.
   *
   * @return the builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /** @return the time between poll ticks, never null */
  public Duration pollInterval() {
    return pollInterval;
  }

  /** @return the maximum records fetched per poll tick */
  public int pollBatchSize() {
    return pollBatchSize;
  }

  /** @return the status debounce window, never null */
  public Duration debounceWindow() {
    return debounceWindow;
  }

  /** @return the establishment backoff policy, never null */
  public BackoffPolicy backoffPolicy() {
    return backoffPolicy;
  }

  /** @return the periodic re-establishment interval, empty if disabled */
  public Optional<Duration> reconnectInterval() {
    return Optional.ofNullable(reconnectInterval);
  }

  /** @return the number of threads of the owned scheduler */
  public int schedulerThreads() {
    return schedulerThreads;
  }

  /** Builder of {@link VigiaConfig}. */
  public static final class Builder {

    /** The poll interval. */
    private Duration pollInterval = DEFAULT_POLL_INTERVAL;

    /** The poll batch size. */
    private int pollBatchSize = DEFAULT_POLL_BATCH_SIZE;

    /** The debounce window. */
    private Duration debounceWindow = DEFAULT_DEBOUNCE_WINDOW;

    /** The backoff policy. */
    private BackoffPolicy backoffPolicy = BackoffPolicy.defaultPolicy();

    /** The reconnect interval, null if disabled. */
    private Duration reconnectInterval;

    /** The scheduler threads. */
    private int schedulerThreads = DEFAULT_SCHEDULER_THREADS;

    /** Creates a builder with the defaults. */
    private Builder() {
    }

    /**
     * Sets the time between poll ticks.
     *
     * @param theInterval the interval, must be positive
     *
     * @return this builder for chaining, never null
     */
    public Builder pollInterval(final Duration theInterval) {
      pollInterval = requirePositive(theInterval, "pollInterval");
      return this;
    }

    /**
     * Sets the maximum number of records fetched per poll tick.
     *
     * @param theBatchSize the batch size, must be positive
     *
     * @return this builder for chaining, never null
     */
    public Builder pollBatchSize(final int theBatchSize) {
      if (theBatchSize <= 0) {
        throw new IllegalArgumentException(
            "pollBatchSize must be greater than 0, got: " + theBatchSize);
      }
      pollBatchSize = theBatchSize;
      return this;
    }

    /**
     * Sets the window a channel status must stay unchanged before it is
     * acted upon.
     *
     * @param theWindow the window, never null or negative
     *
     * @return this builder for chaining, never null
     */
    public Builder debounceWindow(final Duration theWindow) {
      Objects.requireNonNull(theWindow, "debounceWindow must not be null");
      if (theWindow.isNegative()) {
        throw new IllegalArgumentException(
            "debounceWindow must not be negative, got: " + theWindow);
      }
      debounceWindow = theWindow;
      return this;
    }

    /**
     * Sets the backoff policy of the live channel establishment.
     *
     * @param thePolicy the policy, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder backoffPolicy(final BackoffPolicy thePolicy) {
      backoffPolicy = Objects.requireNonNull(thePolicy,
          "backoffPolicy must not be null");
      return this;
    }

    /**
     * Makes subscriptions that exhausted their backoff re-attempt the live
     * channel periodically while polling.
     *
     * @param theInterval the interval, must be positive
     *
     * @return this builder for chaining, never null
     */
    public Builder reconnectInterval(final Duration theInterval) {
      reconnectInterval = requirePositive(theInterval, "reconnectInterval");
      return this;
    }

    /**
     * Sets the number of threads of the scheduler owned by the registry.
     * Ignored when the registry is given its own scheduler.
     *
     * @param theThreads the number of threads, must be positive
     *
     * @return this builder for chaining, never null
     */
    public Builder schedulerThreads(final int theThreads) {
      if (theThreads <= 0) {
        throw new IllegalArgumentException(
            "schedulerThreads must be greater than 0, got: " + theThreads);
      }
      schedulerThreads = theThreads;
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return the configuration, never null
     */
    public VigiaConfig build() {
      return new VigiaConfig(this);
    }

    /** Validates a positive duration.
     *
     * @param value the duration
     * @param name  the name used in error messages
     * @return the duration, never null
     */
    private static Duration requirePositive(final Duration value,
        final String name) {
      Objects.requireNonNull(value, name + " must not be null");
      if (value.isZero() || value.isNegative()) {
        throw new IllegalArgumentException(
            name + " must be positive, got: " + value);
      }
      return value;
    }
  }
}
