package org.waabox.vigia;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

import org.waabox.vigia.channel.ChangeChannel;
import org.waabox.vigia.channel.ChannelStatus;
import org.waabox.vigia.channel.LiveChannelClient;
import org.waabox.vigia.metrics.VigiaMetrics;
import org.waabox.vigia.poll.CursorDiscovery;
import org.waabox.vigia.poll.PollEngine;
import org.waabox.vigia.poll.ResourceQuery;
import org.waabox.vigia.poll.SchemaIntrospection;
import org.waabox.vigia.schedule.TaskScheduler;

/**
 * The collaborators a registry shares with its subscriptions.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class SubscriptionContext {

  /** The live transport, never null. */
  private final ChangeChannel changeChannel;

  /** The record source for polling, null if polling is unavailable. */
  private final ResourceQuery resourceQuery;

  /** The metadata source for polling, null if polling is unavailable. */
  private final SchemaIntrospection schemaIntrospection;

  /** The shared cursor discovery, null if polling is unavailable. */
  private final CursorDiscovery cursorDiscovery;

  /** The timers of every subscription, never null. */
  private final TaskScheduler scheduler;

  /** Runs the poll ticks, never null. */
  private final Executor pollExecutor;

  /** The tuning, never null. */
  private final VigiaConfig config;

  /** The metrics, never null. */
  private final VigiaMetrics metrics;

  /**
   * Creates a new context.
   *
   * @param theChangeChannel       the live transport, never null
   * @param theResourceQuery       the record source, may be null
   * @param theSchemaIntrospection the metadata source, may be null
   * @param theScheduler           the scheduler, never null
   * @param thePollExecutor        runs the poll ticks, never null
   * @param theConfig              the tuning, never null
   * @param theMetrics             the metrics, never null
   */
  SubscriptionContext(final ChangeChannel theChangeChannel,
      final ResourceQuery theResourceQuery,
      final SchemaIntrospection theSchemaIntrospection,
      final TaskScheduler theScheduler, final Executor thePollExecutor,
      final VigiaConfig theConfig, final VigiaMetrics theMetrics) {
    changeChannel = Objects.requireNonNull(theChangeChannel,
        "changeChannel must not be null");
    resourceQuery = theResourceQuery;
    schemaIntrospection = theSchemaIntrospection;
    scheduler = Objects.requireNonNull(theScheduler,
        "scheduler must not be null");
    pollExecutor = Objects.requireNonNull(thePollExecutor,
        "pollExecutor must not be null");
    config = Objects.requireNonNull(theConfig, "config must not be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
    cursorDiscovery = theSchemaIntrospection != null
        ? new CursorDiscovery(theSchemaIntrospection) : null;
  }

  /** @return the live transport, never null */
  ChangeChannel changeChannel() {
    return changeChannel;
  }

  /** @return the scheduler, never null */
  TaskScheduler scheduler() {
    return scheduler;
  }

  /** @return the tuning, never null */
  VigiaConfig config() {
    return config;
  }

  /** @return the metrics, never null */
  VigiaMetrics metrics() {
    return metrics;
  }

  /**
   * Whether subscriptions can fall back to polling.
   *
   * @return true if both a resource query and a schema introspection were
   *         configured
   */
  boolean pollingAvailable() {
    return resourceQuery != null && schemaIntrospection != null;
  }

  /**
   * Creates a poll engine for a resource. Requires
   * {@link #pollingAvailable()}.
   *
   * @param resource      the resource, never null
   * @param sink          receives the polled events, never null
   * @param initialCursor the cursor value to resume from, may be null
   *
   * @return a stopped poll engine, never null
   */
  PollEngine newPollEngine(final String resource,
      final Consumer<ChangeEvent> sink, final Object initialCursor) {
    if (!pollingAvailable()) {
      throw new IllegalStateException("Polling is not configured");
    }
    return new PollEngine(resource, resourceQuery, schemaIntrospection,
        cursorDiscovery, scheduler, pollExecutor, config.pollInterval(),
        config.pollBatchSize(), sink, metrics, initialCursor);
  }

  /**
   * Creates a live channel client for a resource.
   *
   * @param resource      the resource, never null
   * @param filter        the mutations of interest, never null
   * @param sink          receives the live events, never null
   * @param statusHandler receives the settled statuses, never null
   *
   * @return an unconnected client, never null
   */
  LiveChannelClient newChannelClient(final String resource,
      final EventFilter filter, final Consumer<ChangeEvent> sink,
      final Consumer<ChannelStatus> statusHandler) {
    return new LiveChannelClient(changeChannel, resource, filter, sink,
        statusHandler, scheduler, config.debounceWindow());
  }
}
