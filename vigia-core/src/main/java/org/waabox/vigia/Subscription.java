package org.waabox.vigia;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.vigia.channel.ChannelStatus;
import org.waabox.vigia.channel.LiveChannelClient;
import org.waabox.vigia.poll.PollEngine;
import org.waabox.vigia.schedule.ScheduledTask;

/**
 * A subscriber's interest in the changes of one resource.
 *
 * <p>A subscription owns its live channel client, its backoff timer, its
 * reconnect timer and, while degraded, its poll engine. It decides which
 * of the live channel and polling drives its events: the live channel
 * while it reports {@link ChannelStatus#LIVE}, polling otherwise. The two
 * may overlap for one tick during a handoff, so a few duplicate events
 * are possible.
 *
 * <p>Subscriptions are created and released through {@link Vigia}. All
 * state changes happen under the subscription's own monitor; listeners
 * are invoked outside of it.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Subscription {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(Subscription.class);

  /** The unique id, never null. */
  private final String id;

  /** The subscribed resource, never null. */
  private final String resource;

  /** The mutations of interest, never null. */
  private final EventFilter eventFilter;

  /** The subscriber, never null. */
  private final ChangeListener listener;

  /** Whether polling replaces the live channel when it is not live. */
  private final boolean fallbackEnabled;

  /** The shared collaborators, never null. */
  private final SubscriptionContext context;

  /** Guards every mutable field below. */
  private final Object lock = new Object();

  /** The current state, written under the lock. */
  private volatile SubscriptionState state = SubscriptionState.ESTABLISHING;

  /** The current live channel client, null when abandoned. */
  private LiveChannelClient channelClient;

  /** The running poll engine, null when not polling. */
  private PollEngine pollEngine;

  /** The cursor value saved from the last stopped poll engine. */
  private Object lastCursorValue;

  /** The pending establishment retry, null if none. */
  private ScheduledTask retryTask;

  /** The periodic re-establishment, null if none. */
  private ScheduledTask reconnectTask;

  /** The number of failed establishment attempts since the last success. */
  private int attempt;

  /** Whether the lack of polling support was already reported. */
  private boolean pollingUnavailableReported;

  /**
   * Creates a new subscription. Nothing happens until {@link #start()}.
   *
   * @param theId          the unique id, never null
   * @param theResource    the resource, never null
   * @param theEventFilter the mutations of interest, never null
   * @param theListener    the subscriber, never null
   * @param fallback       whether to poll when the channel is not live
   * @param theContext     the shared collaborators, never null
   */
  Subscription(final String theId, final String theResource,
      final EventFilter theEventFilter, final ChangeListener theListener,
      final boolean fallback, final SubscriptionContext theContext) {
    id = Objects.requireNonNull(theId, "id must not be null");
    resource = Objects.requireNonNull(theResource,
        "resource must not be null");
    eventFilter = Objects.requireNonNull(theEventFilter,
        "eventFilter must not be null");
    listener = Objects.requireNonNull(theListener,
        "listener must not be null");
    context = Objects.requireNonNull(theContext, "context must not be null");
    fallbackEnabled = fallback;
  }

  /** @return the unique id of this subscription, never null */
  public String id() {
    return id;
  }

  /** @return the subscribed resource, never null */
  public String resource() {
    return resource;
  }

  /** @return the mutations of interest, never null */
  public EventFilter eventFilter() {
    return eventFilter;
  }

  /** @return the current state, never null */
  public SubscriptionState state() {
    return state;
  }

  /** @return true if events currently arrive through the live channel */
  public boolean isLive() {
    return state == SubscriptionState.LIVE;
  }

  /** @return true if polling replaces the live channel when not live */
  public boolean isFallbackEnabled() {
    return fallbackEnabled;
  }

  /**
   * Attempts the initial establishment of the live channel.
   *
   * <p>With fallback enabled a failure schedules backoff retries. With
   * fallback disabled a failure is final and nothing is scheduled.
   *
   * @return false if the subscription failed and must be discarded
   */
  boolean start() {
    synchronized (lock) {
      if (state.isTerminal()) {
        return false;
      }
      if (openChannel()) {
        return true;
      }
      if (!fallbackEnabled) {
        log.warn("Live channel for resource {} failed and fallback is"
            + " disabled, discarding subscription {}", resource, id);
        return false;
      }
      onEstablishmentFailed();
      return true;
    }
  }

  /**
   * Re-attempts the establishment of the live channel with a fresh
   * backoff sequence. Polling, if running, continues until the new
   * channel reports live.
   *
   * @return true if an attempt was started, false if the subscription is
   *         live or torn down
   */
  boolean reconnect() {
    synchronized (lock) {
      if (state.isTerminal() || state == SubscriptionState.LIVE) {
        return false;
      }
      log.info("Reconnecting subscription {} on resource {}", id, resource);
      cancelRetry();
      closeChannel();
      attempt = 0;
      establish();
      return true;
    }
  }

  /**
   * Releases every resource of this subscription. After this method
   * returns the listener is not invoked again by this subscription.
   *
   * @return false if the subscription was already torn down
   */
  boolean tearDown() {
    final SubscriptionState previous;
    synchronized (lock) {
      previous = state;
      if (previous.isTerminal()) {
        return false;
      }
      state = SubscriptionState.TORN_DOWN;
      cancelRetry();
      cancelReconnect();
      stopPolling();
      closeChannel();
    }
    context.metrics().stateChanged(resource, previous,
        SubscriptionState.TORN_DOWN);
    log.info("Subscription {} on resource {} torn down", id, resource);
    return true;
  }

  /**
   * The most recent cursor value delivered by polling.
   *
   * @return the value, empty if polling never delivered an ordered record
   */
  Optional<Object> lastCursorValue() {
    synchronized (lock) {
      if (pollEngine != null) {
        final Optional<Object> current = pollEngine.lastCursorValue();
        if (current.isPresent()) {
          return current;
        }
      }
      return Optional.ofNullable(lastCursorValue);
    }
  }

  /**
   * Whether a poll engine is running.
   *
   * @return true while polling
   */
  boolean isPolling() {
    synchronized (lock) {
      return pollEngine != null && pollEngine.isRunning();
    }
  }

  /**
   * Delivers an event to the listener unless this subscription is torn
   * down or filters it out. While polling, only polled events are
   * delivered; live events that slip through a channel still settling are
   * dropped, the poll cursor picks their rows up. Listener failures are
   * logged.
   *
   * @param event the event, never null
   */
  void dispatch(final ChangeEvent event) {
    if (state.isTerminal() || !eventFilter.accepts(event)) {
      return;
    }
    if (state == SubscriptionState.POLLING && !event.isSynthesized()) {
      log.debug("Dropping live {} event on resource {} while polling",
          event.eventType(), resource);
      return;
    }
    try {
      listener.onChange(event);
    } catch (final RuntimeException e) {
      log.error("Listener of subscription {} failed on resource {}", id,
          resource, e);
      context.metrics().listenerFailed(resource, e);
    }
  }

  /**
   * Acts upon a debounced channel status.
   *
   * @param status the settled status, never null
   */
  void onSettledStatus(final ChannelStatus status) {
    synchronized (lock) {
      if (state.isTerminal()) {
        return;
      }
      if (status.isLive()) {
        if (transition(SubscriptionState.LIVE)) {
          stopPolling();
        }
        cancelReconnect();
        attempt = 0;
      } else if (status.isError()) {
        log.warn("Live channel of resource {} is not live ({})", resource,
            status);
        markNotLive();
        if (fallbackEnabled) {
          scheduleReconnect();
        }
      }
    }
  }

  /** Opens a new channel client, keeping it only if it connected.
   *
   * @return true if the channel was requested
   */
  private boolean openChannel() {
    final LiveChannelClient client = context.newChannelClient(resource,
        eventFilter, this::dispatch, this::onSettledStatus);
    if (client.connect()) {
      channelClient = client;
      attempt = 0;
      log.info("Live channel requested for resource {} (subscription {})",
          resource, id);
      return true;
    }
    client.close();
    context.metrics().establishmentFailed(resource, attempt);
    return false;
  }

  /** Opens the channel, scheduling a retry on failure. */
  private void establish() {
    if (state.isTerminal()) {
      return;
    }
    if (!openChannel()) {
      onEstablishmentFailed();
    }
  }

  /** Schedules the next retry, or gives up on the live channel. */
  private void onEstablishmentFailed() {
    final Optional<Duration> delay =
        context.config().backoffPolicy().delayFor(attempt);
    if (delay.isPresent()) {
      attempt++;
      log.warn("Retrying live channel for resource {} in {} ms"
          + " (retry {})", resource, delay.get().toMillis(), attempt);
      retryTask = context.scheduler().schedule(this::retry, delay.get());
      return;
    }
    log.warn("Gave up on the live channel for resource {} after {}"
        + " attempts", resource, attempt + 1);
    closeChannel();
    markNotLive();
    if (fallbackEnabled) {
      scheduleReconnect();
    }
  }

  /** Runs a scheduled establishment retry. */
  private void retry() {
    synchronized (lock) {
      retryTask = null;
      establish();
    }
  }

  /** Runs a scheduled re-establishment of a channel that is not live. */
  private void reconnectIfNotLive() {
    synchronized (lock) {
      if (state != SubscriptionState.POLLING || retryTask != null) {
        return;
      }
      log.info("Re-attempting live channel for resource {}", resource);
      closeChannel();
      attempt = 0;
      establish();
    }
  }

  /** Moves to the degraded state that matches the fallback setting. */
  private void markNotLive() {
    if (fallbackEnabled) {
      transition(SubscriptionState.POLLING);
      if (state == SubscriptionState.POLLING) {
        startPolling();
      }
    } else {
      transition(SubscriptionState.DISCONNECTED);
    }
  }

  /**
   * Moves to the target state if the transition is legal.
   *
   * @param target the target state, never null
   * @return true if the state changed
   */
  private boolean transition(final SubscriptionState target) {
    final SubscriptionState current = state;
    if (!current.canTransitionTo(target)) {
      log.debug("Ignoring transition {} -> {} of subscription {}", current,
          target, id);
      return false;
    }
    state = target;
    log.info("Subscription {} on resource {}: {} -> {}", id, resource,
        current, target);
    context.metrics().stateChanged(resource, current, target);
    return true;
  }

  /** Starts the poll engine if polling is possible and not running. */
  private void startPolling() {
    if (!context.pollingAvailable()) {
      if (!pollingUnavailableReported) {
        pollingUnavailableReported = true;
        log.warn("No resource query configured, resource {} will not be"
            + " polled", resource);
      }
      return;
    }
    if (pollEngine != null) {
      return;
    }
    pollEngine = context.newPollEngine(resource, this::dispatch,
        lastCursorValue);
    pollEngine.start();
  }

  /** Stops the poll engine, keeping its cursor value. */
  private void stopPolling() {
    if (pollEngine == null) {
      return;
    }
    lastCursorValue = pollEngine.lastCursorValue().orElse(lastCursorValue);
    pollEngine.stop();
    pollEngine = null;
  }

  /** Closes the current channel client, if any. */
  private void closeChannel() {
    if (channelClient != null) {
      channelClient.close();
      channelClient = null;
    }
  }

  /** Cancels the pending retry, if any. */
  private void cancelRetry() {
    if (retryTask != null) {
      retryTask.cancel();
      retryTask = null;
    }
  }

  /** Schedules the periodic re-establishment if configured. */
  private void scheduleReconnect() {
    final Optional<Duration> interval = context.config().reconnectInterval();
    if (interval.isEmpty() || reconnectTask != null) {
      return;
    }
    reconnectTask = context.scheduler().scheduleAtFixedRate(
        this::reconnectIfNotLive, interval.get(), interval.get());
  }

  /** Cancels the periodic re-establishment, if any. */
  private void cancelReconnect() {
    if (reconnectTask != null) {
      reconnectTask.cancel();
      reconnectTask = null;
    }
  }

  @Override
  public String toString() {
    return "Subscription[id=" + id + ", resource=" + resource
        + ", filter=" + eventFilter + ", state=" + state + "]";
  }
}
