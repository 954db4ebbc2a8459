package org.waabox.vigia;

import java.util.Objects;

/**
 * Selects which mutations of a resource a subscription is interested in.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum EventFilter {

  /** Only inserts. */
  INSERT,

  /** Only updates. */
  UPDATE,

  /** Only deletes. */
  DELETE,

  /** Every mutation. */
  ANY;

  /**
   * Checks whether the given event type passes this filter.
   *
   * @param type the event type, never null
   *
   * @return true if events of the given type are selected
   */
  public boolean matches(final EventType type) {
    Objects.requireNonNull(type, "type must not be null");
    if (this == ANY) {
      return true;
    }
    return name().equals(type.name());
  }

  /**
   * Checks whether the given event should be delivered to a subscription
   * using this filter.
   *
   * <p>Live events are selected by their type. Synthesized events produced
   * by polling cannot tell an insert from an update, so they are accepted
   * by every filter except {@link #DELETE}: a deleted row is never returned
   * by a poll.
   *
   * @param event the event, never null
   *
   * @return true if the event should be delivered
   */
  public boolean accepts(final ChangeEvent event) {
    Objects.requireNonNull(event, "event must not be null");
    if (event.isSynthesized()) {
      return this != DELETE;
    }
    return matches(event.eventType());
  }
}
