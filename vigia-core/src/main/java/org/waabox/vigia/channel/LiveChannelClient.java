package org.waabox.vigia.channel;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.vigia.ChangeEvent;
import org.waabox.vigia.EventFilter;
import org.waabox.vigia.schedule.TaskScheduler;

/**
 * Owns one push channel scoped to a resource and a filter.
 *
 * <p>Events that pass the filter are forwarded to the sink as soon as they
 * arrive. Status changes go through a {@link StatusDebouncer}; transport
 * errors skip the debounce window and settle as
 * {@link ChannelStatus#CHANNEL_ERROR} right away.
 *
 * <p>A client is used for a single establishment attempt: once closed it
 * ignores every callback of its channel.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class LiveChannelClient implements ChannelListener {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(LiveChannelClient.class);

  /** The transport, never null. */
  private final ChangeChannel channel;

  /** The watched resource, never null. */
  private final String resource;

  /** The mutations of interest, never null. */
  private final EventFilter filter;

  /** Receives the events that pass the filter, never null. */
  private final Consumer<ChangeEvent> sink;

  /** Debounces the channel statuses, never null. */
  private final StatusDebouncer debouncer;

  /** Whether the client was closed. */
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /** The open channel, null until connected. */
  private volatile ChannelHandle handle;

  /**
   * Creates a new client. No channel is opened until {@link #connect()}.
   *
   * @param theChannel     the transport, never null
   * @param theResource    the resource to watch, never null
   * @param theFilter      the mutations of interest, never null
   * @param theSink        receives the filtered events, never null
   * @param statusHandler  receives the settled statuses, never null
   * @param scheduler      the scheduler of the debounce timer, never null
   * @param debounceWindow the debounce window, never null
   */
  public LiveChannelClient(final ChangeChannel theChannel,
      final String theResource, final EventFilter theFilter,
      final Consumer<ChangeEvent> theSink,
      final Consumer<ChannelStatus> statusHandler,
      final TaskScheduler scheduler, final Duration debounceWindow) {
    channel = Objects.requireNonNull(theChannel, "channel must not be null");
    resource = Objects.requireNonNull(theResource,
        "resource must not be null");
    filter = Objects.requireNonNull(theFilter, "filter must not be null");
    sink = Objects.requireNonNull(theSink, "sink must not be null");
    debouncer = new StatusDebouncer(scheduler, debounceWindow, statusHandler);
  }

  /**
   * Opens the channel.
   *
   * @return true if the channel was requested, false if the transport
   *         failed synchronously or the client is already closed
   */
  public boolean connect() {
    if (closed.get()) {
      return false;
    }
    final ChannelHandle opened;
    try {
      opened = channel.open(resource, filter, this);
    } catch (final RuntimeException e) {
      log.warn("Could not open change channel for resource {}: {}",
          resource, e.getMessage());
      return false;
    }
    handle = opened;
    if (closed.get()) {
      closeQuietly(opened);
      return false;
    }
    log.debug("Change channel requested for resource {} ({})", resource,
        filter);
    return true;
  }

  /**
   * Closes the channel and cancels the debouncer. Safe to call more than
   * once.
   */
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    debouncer.cancel();
    final ChannelHandle current = handle;
    if (current != null) {
      closeQuietly(current);
    }
    log.debug("Change channel closed for resource {}", resource);
  }

  /**
   * Whether this client was closed.
   *
   * @return true after {@link #close()}
   */
  public boolean isClosed() {
    return closed.get();
  }

  /** {@inheritDoc} */
  @Override
  public void onStatus(final ChannelStatus status) {
    if (closed.get()) {
      return;
    }
    log.debug("Raw channel status {} for resource {}", status, resource);
    debouncer.submit(status);
  }

  /** {@inheritDoc} */
  @Override
  public void onEvent(final ChangeEvent event) {
    if (closed.get() || !filter.accepts(event)) {
      return;
    }
    sink.accept(event);
  }

  /** {@inheritDoc} */
  @Override
  public void onError(final Throwable cause) {
    if (closed.get()) {
      return;
    }
    log.warn("Change channel error for resource {}: {}", resource,
        cause.getMessage());
    debouncer.submitNow(ChannelStatus.CHANNEL_ERROR);
  }

  /** Closes a handle, logging instead of propagating failures.
   *
   * @param target the handle to close, never null
   */
  private void closeQuietly(final ChannelHandle target) {
    try {
      target.close();
    } catch (final RuntimeException e) {
      log.warn("Failed to close change channel for resource {}: {}",
          resource, e.getMessage(), e);
    }
  }
}
