package org.waabox.vigia;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.vigia.channel.ChangeChannel;
import org.waabox.vigia.channel.ChannelHandle;
import org.waabox.vigia.channel.ChannelListener;
import org.waabox.vigia.channel.ChannelStatus;
import org.waabox.vigia.metrics.NoopVigiaMetrics;
import org.waabox.vigia.metrics.VigiaMetrics;
import org.waabox.vigia.poll.ResourceQuery;
import org.waabox.vigia.poll.SchemaIntrospection;
import org.waabox.vigia.schedule.ExecutorTaskScheduler;
import org.waabox.vigia.schedule.TaskScheduler;

/**
 * The registry of change subscriptions.
 *
 * <p>Vigia keeps track of every {@link Subscription} it creates. Each
 * subscription listens to a live {@link ChangeChannel}; when the channel
 * cannot be established or stops being live, the subscription polls the
 * resource through a {@link ResourceQuery} until the channel recovers.
 *
 * <p>Usage example:
 * <pre>{@code
 * Vigia vigia = Vigia.builder()
 *     .changeChannel(channel)
 *     .resourceQuery(query)
 *     .schemaIntrospection(introspection)
 *     .build();
 *
 * vigia.subscribe("widgets", EventFilter.ANY, event -> cache.apply(event));
 * ...
 * vigia.shutdown();
 * }</pre>
 *
 * <p>Multiple registries may coexist; they share nothing.
 *
 * <p>Thread safety: this class is thread-safe. Failures of the
 * collaborators are handled locally and never reach the caller; only
 * misuse (null arguments, use after {@link #shutdown()}) raises an
 * exception.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Vigia {

  /** Class logger. */
  private static final Logger log = LoggerFactory.getLogger(Vigia.class);

  /** The collaborators shared with the subscriptions, never null. */
  private final SubscriptionContext context;

  /** Whether the scheduler was created by this registry. */
  private final boolean ownsScheduler;

  /** The poll executor created by this registry, null if supplied. */
  private final ExecutorService ownedPollExecutor;

  /** The tracked subscriptions, keyed by id. */
  private final Map<String, Subscription> subscriptions =
      new ConcurrentHashMap<>();

  /** Whether {@link #shutdown()} was called. */
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  /**
   * Creates a new registry.
   *
   * @param theContext       the shared collaborators, never null
   * @param theOwnsScheduler whether to shut the scheduler down on shutdown
   * @param theOwnedPollExecutor the poll executor to shut down on
   *        shutdown, null if it was supplied by the caller
   */
  private Vigia(final SubscriptionContext theContext,
      final boolean theOwnsScheduler,
      final ExecutorService theOwnedPollExecutor) {
    context = theContext;
    ownsScheduler = theOwnsScheduler;
    ownedPollExecutor = theOwnedPollExecutor;
  }

  /**
   * Creates a new builder for constructing a Vigia instance.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Subscribes to the changes of a resource, falling back to polling when
   * the live channel is not live.
   *
   * @param resource the resource, never null
   * @param filter   the mutations of interest, never null
   * @param listener the subscriber, never null
   *
   * @return the subscription, never empty with fallback enabled
   *
   * @throws IllegalStateException if this registry was shut down
   */
  public Optional<Subscription> subscribe(final String resource,
      final EventFilter filter, final ChangeListener listener) {
    return subscribe(resource, filter, listener, true);
  }

  /**
   * Subscribes to the changes of a resource.
   *
   * <p>With fallback enabled the subscription survives a failed
   * establishment: it retries with backoff and polls once the retries are
   * exhausted. With fallback disabled a failed initial establishment
   * discards the subscription.
   *
   * @param resource       the resource, never null
   * @param filter         the mutations of interest, never null
   * @param listener       the subscriber, never null
   * @param enableFallback whether to poll when the channel is not live
   *
   * @return the subscription, empty if the initial establishment failed
   *         and fallback is disabled
   *
   * @throws IllegalStateException if this registry was shut down
   */
  public Optional<Subscription> subscribe(final String resource,
      final EventFilter filter, final ChangeListener listener,
      final boolean enableFallback) {
    Objects.requireNonNull(resource, "resource must not be null");
    Objects.requireNonNull(filter, "filter must not be null");
    Objects.requireNonNull(listener, "listener must not be null");
    requireRunning();

    final Subscription subscription = new Subscription(
        UUID.randomUUID().toString(), resource, filter, listener,
        enableFallback, context);
    subscriptions.put(subscription.id(), subscription);

    if (!subscription.start()) {
      subscriptions.remove(subscription.id());
      subscription.tearDown();
      return Optional.empty();
    }
    log.info("Subscribed to resource {} ({}), subscription {}", resource,
        filter, subscription.id());
    return Optional.of(subscription);
  }

  /**
   * Subscribes to every mutation of several resources at once.
   *
   * @param listeners the subscriber of each resource, never null
   *
   * @return the group of the created subscriptions, never null
   *
   * @throws IllegalStateException if this registry was shut down
   */
  public SubscriptionGroup subscribeAll(
      final Map<String, ChangeListener> listeners) {
    Objects.requireNonNull(listeners, "listeners must not be null");
    requireRunning();
    final List<Subscription> created = new ArrayList<>();
    for (final Map.Entry<String, ChangeListener> entry
        : listeners.entrySet()) {
      subscribe(entry.getKey(), EventFilter.ANY, entry.getValue())
          .ifPresent(created::add);
    }
    return new SubscriptionGroup(this, created);
  }

  /**
   * Releases a subscription. Its listener is not invoked again once this
   * method returns. Releasing an already released subscription has no
   * effect.
   *
   * @param subscription the subscription, never null
   */
  public void unsubscribe(final Subscription subscription) {
    Objects.requireNonNull(subscription, "subscription must not be null");
    subscriptions.remove(subscription.id(), subscription);
    try {
      subscription.tearDown();
    } catch (final RuntimeException e) {
      log.error("Failed to tear down subscription {}", subscription.id(), e);
    }
  }

  /**
   * Releases every tracked subscription. Each release is attempted even if
   * a previous one failed.
   */
  public void cleanupAll() {
    final List<Subscription> all = new ArrayList<>(subscriptions.values());
    int released = 0;
    for (final Subscription subscription : all) {
      subscriptions.remove(subscription.id(), subscription);
      try {
        if (subscription.tearDown()) {
          released++;
        }
      } catch (final RuntimeException e) {
        log.error("Failed to tear down subscription {}", subscription.id(),
            e);
      }
    }
    log.info("Released {} subscriptions", released);
  }

  /**
   * Re-attempts the live channel of a subscription that is not live,
   * starting a fresh backoff sequence. A polling subscription keeps
   * polling until the new channel reports live.
   *
   * @param subscription the subscription, never null
   *
   * @return true if an attempt was started, false if the subscription is
   *         live, released or not tracked by this registry
   */
  public boolean reconnect(final Subscription subscription) {
    Objects.requireNonNull(subscription, "subscription must not be null");
    if (subscriptions.get(subscription.id()) != subscription) {
      return false;
    }
    return subscription.reconnect();
  }

  /**
   * Reports, for each resource, whether a tracked subscription currently
   * receives it through the live channel.
   *
   * @param resources the resources, never null
   *
   * @return each resource mapped to its live status, in iteration order
   */
  public Map<String, Boolean> liveStatus(final Collection<String> resources) {
    Objects.requireNonNull(resources, "resources must not be null");
    final Map<String, Boolean> result = new LinkedHashMap<>();
    for (final String resource : resources) {
      result.put(resource, subscriptions.values().stream()
          .anyMatch(s -> s.resource().equals(resource) && s.isLive()));
    }
    return result;
  }

  /**
   * Checks whether the change channel can go live for a resource.
   *
   * <p>Opens a temporary channel, waits for it to report live and closes
   * it.
   *
   * @param resource the resource, never null
   * @param timeout  the maximum time to wait, never null
   *
   * @return true if the channel reported live within the timeout
   */
  public boolean probe(final String resource, final Duration timeout) {
    Objects.requireNonNull(resource, "resource must not be null");
    Objects.requireNonNull(timeout, "timeout must not be null");
    requireRunning();

    final CountDownLatch live = new CountDownLatch(1);
    final ChannelHandle handle;
    try {
      handle = context.changeChannel().open(resource, EventFilter.ANY,
          new ProbeListener(live));
    } catch (final RuntimeException e) {
      log.warn("Probe of resource {} failed: {}", resource, e.getMessage());
      return false;
    }

    try {
      return live.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    } finally {
      try {
        handle.close();
      } catch (final RuntimeException e) {
        log.warn("Failed to close probe channel of resource {}", resource, e);
      }
    }
  }

  /**
   * Returns the tracked subscriptions.
   *
   * @return an unmodifiable snapshot of the subscriptions, never null
   */
  public Collection<Subscription> subscriptions() {
    return List.copyOf(subscriptions.values());
  }

  /**
   * Releases every subscription and stops the scheduler and poll executor
   * this registry created. Further subscriptions are rejected. Safe to call more than
   * once.
   */
  public void shutdown() {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }
    cleanupAll();
    if (ownsScheduler) {
      context.scheduler().shutdown();
    }
    if (ownedPollExecutor != null) {
      stopPollExecutor(ownedPollExecutor);
    }
    log.info("Vigia shut down");
  }

  /** Stops the owned poll executor, interrupting ticks stuck in a query.
   *
   * @param executor the executor, never null
   */
  private static void stopPollExecutor(final ExecutorService executor) {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (final InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Rejects calls after {@link #shutdown()}. */
  private void requireRunning() {
    if (stopped.get()) {
      throw new IllegalStateException("Vigia has been shut down");
    }
  }

  /** Waits for a temporary channel to report live. */
  private static final class ProbeListener implements ChannelListener {

    /** Released on the first live status. */
    private final CountDownLatch live;

    /** Creates the listener.
     *
     * @param theLive the latch to release, never null
     */
    private ProbeListener(final CountDownLatch theLive) {
      live = theLive;
    }

    @Override
    public void onStatus(final ChannelStatus status) {
      if (status.isLive()) {
        live.countDown();
      }
    }

    @Override
    public void onEvent(final ChangeEvent event) {
    }

    @Override
    public void onError(final Throwable cause) {
      log.debug("Probe channel error: {}", cause.getMessage());
    }
  }

  /**
   * Builder for {@link Vigia} instances.
   *
   * <p>Defaults:
   * <ul>
   *   <li>resourceQuery, schemaIntrospection: none, subscriptions never
   *       poll</li>
   *   <li>config: {@link VigiaConfig#defaults()}</li>
   *   <li>scheduler: an {@link ExecutorTaskScheduler} owned by the
   *       registry</li>
   *   <li>pollExecutor: a cached pool of daemon threads owned by the
   *       registry</li>
   *   <li>metrics: {@link NoopVigiaMetrics}</li>
   * </ul>
   */
  public static final class Builder {

    /** The live transport, required. */
    private ChangeChannel changeChannel;

    /** The optional record source. */
    private ResourceQuery resourceQuery;

    /** The optional metadata source. */
    private SchemaIntrospection schemaIntrospection;

    /** The optional tuning. */
    private VigiaConfig config;

    /** The optional scheduler. */
    private TaskScheduler scheduler;

    /** The optional executor of the poll ticks. */
    private Executor pollExecutor;

    /** The optional metrics. */
    private VigiaMetrics metrics;

    /** Creates a new builder with default settings. */
    private Builder() {
    }

    /**
     * Sets the live transport.
     *
     * @param theChangeChannel the change channel, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder changeChannel(final ChangeChannel theChangeChannel) {
      Objects.requireNonNull(theChangeChannel,
          "changeChannel must not be null");
      this.changeChannel = theChangeChannel;
      return this;
    }

    /**
     * Sets the record source used while polling.
     *
     * @param theResourceQuery the resource query, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder resourceQuery(final ResourceQuery theResourceQuery) {
      Objects.requireNonNull(theResourceQuery,
          "resourceQuery must not be null");
      this.resourceQuery = theResourceQuery;
      return this;
    }

    /**
     * Sets the metadata source used to find cursor fields.
     *
     * @param theSchemaIntrospection the schema introspection, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder schemaIntrospection(
        final SchemaIntrospection theSchemaIntrospection) {
      Objects.requireNonNull(theSchemaIntrospection,
          "schemaIntrospection must not be null");
      this.schemaIntrospection = theSchemaIntrospection;
      return this;
    }

    /**
     * Sets the tuning.
     *
     * @param theConfig the configuration, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder config(final VigiaConfig theConfig) {
      Objects.requireNonNull(theConfig, "config must not be null");
      this.config = theConfig;
      return this;
    }

    /**
     * Sets the scheduler of every timer. A scheduler set here is not shut
     * down by {@link Vigia#shutdown()}.
     *
     * @param theScheduler the scheduler, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder scheduler(final TaskScheduler theScheduler) {
      Objects.requireNonNull(theScheduler, "scheduler must not be null");
      this.scheduler = theScheduler;
      return this;
    }

    /**
     * Sets the metrics reporter.
     *
     * @param theMetrics the metrics reporter, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder metrics(final VigiaMetrics theMetrics) {
      Objects.requireNonNull(theMetrics, "metrics must not be null");
      this.metrics = theMetrics;
      return this;
    }

    /**
     * Sets the executor that runs the poll queries. The scheduler only
     * triggers the ticks, so a slow query never delays a debounce, backoff
     * or reconnect timer. An executor set here is not shut down by
     * {@link Vigia#shutdown()}.
     *
     * @param thePollExecutor the executor, never null
     *
     * @return this builder, never null
     */
    public Builder pollExecutor(final Executor thePollExecutor) {
      Objects.requireNonNull(thePollExecutor,
          "pollExecutor must not be null");
      this.pollExecutor = thePollExecutor;
      return this;
    }

    /**
     * Builds the Vigia instance with the configured settings.
     *
     * @return a new Vigia instance, never null
     *
     * @throws NullPointerException if no change channel was set
     */
    public Vigia build() {
      Objects.requireNonNull(changeChannel, "changeChannel must be set");

      final VigiaConfig resolvedConfig = config != null
          ? config : VigiaConfig.defaults();
      final VigiaMetrics resolvedMetrics = metrics != null
          ? metrics : new NoopVigiaMetrics();
      final boolean owned = scheduler == null;
      final TaskScheduler resolvedScheduler = owned
          ? new ExecutorTaskScheduler(resolvedConfig.schedulerThreads())
          : scheduler;
      final ExecutorService ownedPollExecutor = pollExecutor == null
          ? newPollExecutor() : null;
      final Executor resolvedPollExecutor = pollExecutor == null
          ? ownedPollExecutor : pollExecutor;

      if (resourceQuery == null || schemaIntrospection == null) {
        log.warn("No resource query or schema introspection configured,"
            + " subscriptions will not fall back to polling");
      }

      final SubscriptionContext context = new SubscriptionContext(
          changeChannel, resourceQuery, schemaIntrospection,
          resolvedScheduler, resolvedPollExecutor, resolvedConfig,
          resolvedMetrics);
      return new Vigia(context, owned, ownedPollExecutor);
    }

    /** Creates the default poll executor with named daemon threads.
     *
     * @return the executor, never null
     */
    private static ExecutorService newPollExecutor() {
      final AtomicInteger counter = new AtomicInteger();
      return Executors.newCachedThreadPool(r -> {
        final Thread thread = new Thread(r,
            "vigia-poll-" + counter.incrementAndGet());
        thread.setDaemon(true);
        return thread;
      });
    }
  }
}
