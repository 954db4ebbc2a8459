package org.waabox.vigia;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The lifecycle states of a {@link Subscription}.
 *
 * <p>The legal transitions are:
 * <ul>
 *   <li>{@code ESTABLISHING} to {@code LIVE}, {@code POLLING} or
 *       {@code DISCONNECTED}</li>
 *   <li>{@code LIVE} to {@code POLLING} or {@code DISCONNECTED}</li>
 *   <li>{@code POLLING} to {@code LIVE}</li>
 *   <li>{@code DISCONNECTED} to {@code LIVE}</li>
 *   <li>any state but {@code TORN_DOWN} to {@code TORN_DOWN}</li>
 * </ul>
 * {@code TORN_DOWN} is terminal.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum SubscriptionState {

  /** The live channel is being opened. */
  ESTABLISHING,

  /** Events arrive through the live channel. */
  LIVE,

  /** The live channel is not trusted; events arrive through polling. */
  POLLING,

  /** The live channel is not trusted and polling is disabled. */
  DISCONNECTED,

  /** The subscription was released; no more events are delivered. */
  TORN_DOWN;

  /** The legal targets of each state. */
  private static final Map<SubscriptionState, Set<SubscriptionState>>
      TRANSITIONS = createTransitions();

  /**
   * Checks whether this state may move to the given one.
   *
   * @param target the target state, never null
   *
   * @return true if the transition is legal
   */
  public boolean canTransitionTo(final SubscriptionState target) {
    Objects.requireNonNull(target, "target must not be null");
    return TRANSITIONS.get(this).contains(target);
  }

  /**
   * Whether this state is terminal.
   *
   * @return true only for {@link #TORN_DOWN}
   */
  public boolean isTerminal() {
    return this == TORN_DOWN;
  }

  /** Builds the transition table.
   *
   * @return the table, never null
   */
  private static Map<SubscriptionState, Set<SubscriptionState>>
      createTransitions() {
    final Map<SubscriptionState, Set<SubscriptionState>> table =
        new EnumMap<>(SubscriptionState.class);
    table.put(ESTABLISHING, EnumSet.of(LIVE, POLLING, DISCONNECTED,
        TORN_DOWN));
    table.put(LIVE, EnumSet.of(POLLING, DISCONNECTED, TORN_DOWN));
    table.put(POLLING, EnumSet.of(LIVE, TORN_DOWN));
    table.put(DISCONNECTED, EnumSet.of(LIVE, TORN_DOWN));
    table.put(TORN_DOWN, EnumSet.noneOf(SubscriptionState.class));
    return Collections.unmodifiableMap(table);
  }
}
