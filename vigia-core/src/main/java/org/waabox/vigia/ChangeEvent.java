package org.waabox.vigia;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A mutation of one record of a resource.
 *
 * <p>Events come from two places: the live change channel, which knows the
 * exact {@link EventType} and may carry both images of the record, and the
 * poll engine, which only sees the current row. Polled events are a
 * distinct variant: their {@link #origin()} is {@link Origin#POLLED}, their
 * type is always {@link EventType#UPDATE} and {@link #before()} is always
 * null. Consumers that need precise typing must not rely on them.
 *
 * <p>Record images are unmodifiable copies; their values may be null.
 *
 * @param resource  the resource the record belongs to, never null
 * @param eventType the type of mutation, never null
 * @param before    the record before the mutation, null if unknown
 * @param after     the record after the mutation, null for deletes
 * @param origin    where the event was produced, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ChangeEvent(
    String resource,
    EventType eventType,
    Map<String, Object> before,
    Map<String, Object> after,
    Origin origin
) {

  /** Where a change event was produced. */
  public enum Origin {

    /** Pushed by the change channel. */
    LIVE,

    /** Synthesized from a polled record. */
    POLLED
  }

  /**
   * Validates the components and copies the record images.
   *
   * @param resource  the resource name, never null
   * @param eventType the event type, never null
   * @param before    the previous image, may be null
   * @param after     the new image, may be null
   * @param origin    the origin, never null
   */
  public ChangeEvent {
    Objects.requireNonNull(resource, "resource must not be null");
    Objects.requireNonNull(eventType, "eventType must not be null");
    Objects.requireNonNull(origin, "origin must not be null");
    before = copyOf(before);
    after = copyOf(after);
  }

  /**
   * Creates an event delivered by a change channel.
   *
   * @param resource  the resource name, never null
   * @param eventType the event type, never null
   * @param before    the previous image, may be null
   * @param after     the new image, may be null
   *
   * @return a new live event, never null
   */
  public static ChangeEvent live(final String resource,
      final EventType eventType, final Map<String, Object> before,
      final Map<String, Object> after) {
    return new ChangeEvent(resource, eventType, before, after, Origin.LIVE);
  }

  /**
   * Creates a synthesized event for a record returned by a poll.
   *
   * @param resource the resource name, never null
   * @param record   the polled record, never null
   *
   * @return a new polled event of type UPDATE, never null
   */
  public static ChangeEvent polled(final String resource,
      final Map<String, Object> record) {
    Objects.requireNonNull(record, "record must not be null");
    return new ChangeEvent(resource, EventType.UPDATE, null, record,
        Origin.POLLED);
  }

  /**
   * Whether this event was synthesized by polling instead of being pushed
   * by the change channel.
   *
   * @return true for polled events
   */
  public boolean isSynthesized() {
    return origin == Origin.POLLED;
  }

  /** Returns an unmodifiable copy that tolerates null values.
   *
   * @param image the record image, may be null
   * @return the copy, or null if the image is null
   */
  private static Map<String, Object> copyOf(final Map<String, Object> image) {
    if (image == null) {
      return null;
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(image));
  }
}
