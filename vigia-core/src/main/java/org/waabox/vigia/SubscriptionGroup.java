package org.waabox.vigia;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subscriptions created together and released together.
 *
 * <p>{@link #close()} unsubscribes every member; it is idempotent and
 * never throws.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SubscriptionGroup implements AutoCloseable {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(SubscriptionGroup.class);

  /** The registry that owns the members, never null. */
  private final Vigia vigia;

  /** The members, never null. */
  private final List<Subscription> subscriptions;

  /** Whether the group was closed. */
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /**
   * Creates a new group.
   *
   * @param theVigia         the owning registry, never null
   * @param theSubscriptions the members, never null
   */
  SubscriptionGroup(final Vigia theVigia,
      final List<Subscription> theSubscriptions) {
    vigia = Objects.requireNonNull(theVigia, "vigia must not be null");
    subscriptions = List.copyOf(theSubscriptions);
  }

  /** @return the members of this group, never null */
  public List<Subscription> subscriptions() {
    return subscriptions;
  }

  /** @return true after {@link #close()} */
  public boolean isClosed() {
    return closed.get();
  }

  /** Unsubscribes every member. */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    for (final Subscription subscription : subscriptions) {
      try {
        vigia.unsubscribe(subscription);
      } catch (final RuntimeException e) {
        log.error("Failed to release subscription {}", subscription.id(), e);
      }
    }
  }
}
