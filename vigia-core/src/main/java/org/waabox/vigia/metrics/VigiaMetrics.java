package org.waabox.vigia.metrics;

import org.waabox.vigia.SubscriptionState;

/**
 * An abstraction for recording operational metrics of the subscription
 * layer.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer or Prometheus. Use {@link NoopVigiaMetrics} when metrics
 * collection is not required. Implementations are called from scheduler
 * and channel threads, so they must be thread-safe and must not block.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface VigiaMetrics {

  /**
   * Records a transition of a subscription's state.
   *
   * @param resource the subscribed resource, never null
   * @param from     the previous state, never null
   * @param to       the new state, never null
   */
  void stateChanged(String resource, SubscriptionState from,
      SubscriptionState to);

  /**
   * Records a failed attempt to establish the live channel.
   *
   * @param resource the subscribed resource, never null
   * @param attempt  the zero-based number of the failed attempt
   */
  void establishmentFailed(String resource, int attempt);

  /**
   * Records a completed poll tick.
   *
   * @param resource the polled resource, never null
   * @param records  the number of records delivered by the tick
   */
  void pollCompleted(String resource, int records);

  /**
   * Records a failed poll tick.
   *
   * @param resource the polled resource, never null
   * @param cause    the failure, never null
   */
  void pollFailed(String resource, Throwable cause);

  /**
   * Records an exception thrown by a subscriber's listener.
   *
   * @param resource the subscribed resource, never null
   * @param cause    the exception, never null
   */
  void listenerFailed(String resource, Throwable cause);
}
