package org.waabox.vigia;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Defines the delays between attempts to establish a change channel.
 *
 * <p>The delay for attempt {@code n} (starting at zero) is
 * {@code base * 2^n}, capped at {@code max}. Only {@code maxAttempts}
 * retries are ever issued; once they are exhausted the subscription stops
 * retrying and relies on polling.
 *
 * <p>Instances are created through static factory methods. The default
 * policy uses a 1-second base, a 30-second cap and 3 attempts.
 *
 * <p>This class is immutable and thread-safe. The attempt counter lives in
 * the subscription that uses the policy.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class BackoffPolicy {

  /** The default number of retries. */
  private static final int DEFAULT_MAX_ATTEMPTS = 3;

  /** The default base delay. */
  private static final Duration DEFAULT_BASE = Duration.ofSeconds(1);

  /** The default delay cap. */
  private static final Duration DEFAULT_MAX = Duration.ofSeconds(30);

  /** The delay for the first retry. */
  private final Duration base;

  /** The upper bound of any computed delay. */
  private final Duration max;

  /** The number of retries this policy allows. */
  private final int maxAttempts;

  /**
   * Creates a new backoff policy.
   *
   * @param theBase        the base delay, never null
   * @param theMax         the delay cap, never null
   * @param theMaxAttempts the number of retries allowed
   */
  private BackoffPolicy(final Duration theBase, final Duration theMax,
      final int theMaxAttempts) {
    base = theBase;
    max = theMax;
    maxAttempts = theMaxAttempts;
  }

  /**
   * Creates a backoff policy with the given parameters.
   *
   * @param base        the delay of the first retry, must be positive
   * @param max         the delay cap, must not be smaller than base
   * @param maxAttempts the number of retries, zero disables retrying
   *
   * @return a new backoff policy, never null
   *
   * @throws NullPointerException     if base or max is null
   * @throws IllegalArgumentException if any value is out of range
   */
  public static BackoffPolicy of(final Duration base, final Duration max,
      final int maxAttempts) {
    Objects.requireNonNull(base, "base must not be null");
    Objects.requireNonNull(max, "max must not be null");
    if (base.isZero() || base.isNegative()) {
      throw new IllegalArgumentException(
          "base must be positive, got: " + base);
    }
    if (max.compareTo(base) < 0) {
      throw new IllegalArgumentException(
          "max must not be smaller than base, got: " + max);
    }
    if (maxAttempts < 0) {
      throw new IllegalArgumentException(
          "maxAttempts must not be negative, got: " + maxAttempts);
    }
    return new BackoffPolicy(base, max, maxAttempts);
  }

  /**
   * Creates a backoff policy with sensible defaults: 1 second base,
   * 30 seconds cap, 3 attempts.
   *
   * @return the default backoff policy, never null
   */
  public static BackoffPolicy defaultPolicy() {
    return new BackoffPolicy(DEFAULT_BASE, DEFAULT_MAX,
        DEFAULT_MAX_ATTEMPTS);
  }

  /**
   * Computes the delay before the given retry attempt.
   *
   * @param attempt the zero-based attempt number, must not be negative
   *
   * @return the delay, or empty if the attempt is beyond the cap
   *
   * @throws IllegalArgumentException if attempt is negative
   */
  public Optional<Duration> delayFor(final int attempt) {
    if (attempt < 0) {
      throw new IllegalArgumentException(
          "attempt must not be negative, got: " + attempt);
    }
    if (attempt >= maxAttempts) {
      return Optional.empty();
    }
    final long baseMillis = base.toMillis();
    final long maxMillis = max.toMillis();
    // Shifting past the cap would overflow; 62 bits is already beyond it.
    final int shift = Math.min(attempt, 62);
    final long factor = 1L << shift;
    final long delay = baseMillis > maxMillis / factor
        ? maxMillis : baseMillis * factor;
    return Optional.of(Duration.ofMillis(Math.min(delay, maxMillis)));
  }

  /**
   * Returns the delay of the first retry.
   *
   * @return the base delay, never null
   */
  public Duration base() {
    return base;
  }

  /**
   * Returns the delay cap.
   *
   * @return the maximum delay, never null
   */
  public Duration max() {
    return max;
  }

  /**
   * Returns the number of retries this policy allows.
   *
   * @return the maximum number of attempts, never negative
   */
  public int maxAttempts() {
    return maxAttempts;
  }
}
