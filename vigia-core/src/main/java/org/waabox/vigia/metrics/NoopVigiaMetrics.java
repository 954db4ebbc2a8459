package org.waabox.vigia.metrics;

import org.waabox.vigia.SubscriptionState;

/**
 * A no-operation implementation of {@link VigiaMetrics}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopVigiaMetrics implements VigiaMetrics {

  /** {@inheritDoc} */
  @Override
  public void stateChanged(final String resource,
      final SubscriptionState from, final SubscriptionState to) {
  }

  /** {@inheritDoc} */
  @Override
  public void establishmentFailed(final String resource, final int attempt) {
  }

  /** {@inheritDoc} */
  @Override
  public void pollCompleted(final String resource, final int records) {
  }

  /** {@inheritDoc} */
  @Override
  public void pollFailed(final String resource, final Throwable cause) {
  }

  /** {@inheritDoc} */
  @Override
  public void listenerFailed(final String resource, final Throwable cause) {
  }
}
