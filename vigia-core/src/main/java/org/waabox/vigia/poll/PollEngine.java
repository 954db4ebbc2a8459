package org.waabox.vigia.poll;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.vigia.ChangeEvent;
import org.waabox.vigia.metrics.VigiaMetrics;
import org.waabox.vigia.schedule.ScheduledTask;
import org.waabox.vigia.schedule.TaskScheduler;

/**
 * Periodically queries a resource for records newer than the last seen
 * cursor value and turns them into synthesized change events.
 *
 * <p>The first tick runs one interval after {@link #start()}. Ticks never
 * overlap: a tick that fires while the previous one is still running is
 * skipped. The scheduler only triggers ticks; each tick runs on the tick
 * executor, so a slow query never holds a scheduler thread. The last
 * cursor value only moves forward, to the greatest non-null value of a
 * batch, and only when the cursor field is ordered; with an identifier
 * cursor every tick refetches the most recent records.
 *
 * <p>Thread safety: this class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PollEngine {

  /** Class logger. */
  private static final Logger log = LoggerFactory.getLogger(PollEngine.class);

  /** The polled resource, never null. */
  private final String resource;

  /** Fetches the records, never null. */
  private final ResourceQuery resourceQuery;

  /** Checks that the resource exists, never null. */
  private final SchemaIntrospection schemaIntrospection;

  /** Resolves the cursor field, never null. */
  private final CursorDiscovery cursorDiscovery;

  /** Triggers the ticks, never null. */
  private final TaskScheduler scheduler;

  /** Runs the ticks, never null. */
  private final Executor tickExecutor;

  /** The time between ticks, never null. */
  private final Duration interval;

  /** The maximum number of records fetched per tick. */
  private final int batchSize;

  /** Receives the synthesized events, never null. */
  private final Consumer<ChangeEvent> sink;

  /** Records tick outcomes, never null. */
  private final VigiaMetrics metrics;

  /** Whether a tick is running. */
  private final AtomicBoolean inFlight = new AtomicBoolean(false);

  /** Guards the scheduled task. */
  private final Object lock = new Object();

  /** The periodic task, null while stopped. */
  private ScheduledTask task;

  /** The most recent cursor value delivered, null if none yet. */
  private volatile Object lastCursorValue;

  /**
   * Creates a new poll engine whose ticks run on the scheduler thread.
   * Nothing runs until {@link #start()}.
   *
   * @param theResource            the resource, never null
   * @param theResourceQuery       the record source, never null
   * @param theSchemaIntrospection the metadata source, never null
   * @param theCursorDiscovery     the cursor discovery, never null
   * @param theScheduler           the scheduler, never null
   * @param theInterval            the tick interval, must be positive
   * @param theBatchSize           the records per tick, must be positive
   * @param theSink                receives the events, never null
   * @param theMetrics             the metrics, never null
   * @param initialCursorValue     the cursor value to resume from, may be
   *                               null
   */
  public PollEngine(final String theResource,
      final ResourceQuery theResourceQuery,
      final SchemaIntrospection theSchemaIntrospection,
      final CursorDiscovery theCursorDiscovery,
      final TaskScheduler theScheduler, final Duration theInterval,
      final int theBatchSize, final Consumer<ChangeEvent> theSink,
      final VigiaMetrics theMetrics, final Object initialCursorValue) {
    this(theResource, theResourceQuery, theSchemaIntrospection,
        theCursorDiscovery, theScheduler, Runnable::run, theInterval,
        theBatchSize, theSink, theMetrics, initialCursorValue);
  }

  /**
   * Creates a new poll engine. Nothing runs until {@link #start()}.
   *
   * @param theResource            the resource, never null
   * @param theResourceQuery       the record source, never null
   * @param theSchemaIntrospection the metadata source, never null
   * @param theCursorDiscovery     the cursor discovery, never null
   * @param theScheduler           triggers the ticks, never null
   * @param theTickExecutor        runs the ticks, never null
   * @param theInterval            the tick interval, must be positive
   * @param theBatchSize           the records per tick, must be positive
   * @param theSink                receives the events, never null
   * @param theMetrics             the metrics, never null
   * @param initialCursorValue     the cursor value to resume from, may be
   *                               null
   */
  public PollEngine(final String theResource,
      final ResourceQuery theResourceQuery,
      final SchemaIntrospection theSchemaIntrospection,
      final CursorDiscovery theCursorDiscovery,
      final TaskScheduler theScheduler, final Executor theTickExecutor,
      final Duration theInterval, final int theBatchSize,
      final Consumer<ChangeEvent> theSink, final VigiaMetrics theMetrics,
      final Object initialCursorValue) {
    resource = Objects.requireNonNull(theResource,
        "resource must not be null");
    resourceQuery = Objects.requireNonNull(theResourceQuery,
        "resourceQuery must not be null");
    schemaIntrospection = Objects.requireNonNull(theSchemaIntrospection,
        "schemaIntrospection must not be null");
    cursorDiscovery = Objects.requireNonNull(theCursorDiscovery,
        "cursorDiscovery must not be null");
    scheduler = Objects.requireNonNull(theScheduler,
        "scheduler must not be null");
    tickExecutor = Objects.requireNonNull(theTickExecutor,
        "tickExecutor must not be null");
    interval = Objects.requireNonNull(theInterval,
        "interval must not be null");
    sink = Objects.requireNonNull(theSink, "sink must not be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
    if (theInterval.isNegative() || theInterval.isZero()) {
      throw new IllegalArgumentException(
          "interval must be positive, got: " + theInterval);
    }
    if (theBatchSize <= 0) {
      throw new IllegalArgumentException(
          "batchSize must be greater than 0, got: " + theBatchSize);
    }
    batchSize = theBatchSize;
    lastCursorValue = initialCursorValue;
  }

  /** Starts the periodic ticks. Has no effect if already started. */
  public void start() {
    synchronized (lock) {
      if (task != null) {
        return;
      }
      task = scheduler.scheduleAtFixedRate(this::trigger, interval,
          interval);
    }
    log.info("Polling resource {} every {} ms", resource,
        interval.toMillis());
  }

  /**
   * Stops the periodic ticks. A running tick is allowed to complete. Has
   * no effect if already stopped.
   */
  public void stop() {
    synchronized (lock) {
      if (task == null) {
        return;
      }
      task.cancel();
      task = null;
    }
    log.info("Stopped polling resource {}", resource);
  }

  /**
   * Whether the periodic ticks are scheduled.
   *
   * @return true between {@link #start()} and {@link #stop()}
   */
  public boolean isRunning() {
    synchronized (lock) {
      return task != null;
    }
  }

  /**
   * The most recent cursor value delivered.
   *
   * @return the value, empty before the first ordered delivery
   */
  public Optional<Object> lastCursorValue() {
    return Optional.ofNullable(lastCursorValue);
  }

  /** Hands a tick to the tick executor unless one is in flight. */
  private void trigger() {
    if (inFlight.get()) {
      log.debug("Previous poll of resource {} still running, skipping",
          resource);
      return;
    }
    try {
      tickExecutor.execute(this::poll);
    } catch (final RejectedExecutionException e) {
      log.debug("Tick executor rejected poll of resource {}", resource);
    }
  }

  /** Runs one tick unless another one is in flight. */
  void poll() {
    if (!inFlight.compareAndSet(false, true)) {
      log.debug("Previous poll of resource {} still running, skipping",
          resource);
      return;
    }
    try {
      tick();
    } finally {
      inFlight.set(false);
    }
  }

  /** Queries the resource and dispatches the new records. */
  private void tick() {
    try {
      if (!schemaIntrospection.resourceExists(resource)) {
        log.error("Resource {} does not exist, skipping poll", resource);
        return;
      }
    } catch (final RuntimeException e) {
      log.warn("Could not check resource {}, skipping poll: {}", resource,
          e.getMessage());
      return;
    }

    final CursorResolution resolution = cursorDiscovery.resolve(resource);
    if (resolution.isUnavailable()) {
      log.debug("Cursor of resource {} unavailable, skipping poll",
          resource);
      return;
    }
    final Optional<CursorField> field = resolution.cursorField();
    if (field.isEmpty()) {
      log.warn("Resource {} has no cursor field, skipping poll", resource);
      return;
    }

    final CursorField cursor = field.get();
    final Object last = lastCursorValue;
    final boolean filtered = cursor.isOrdered() && last != null;
    final QueryRequest request = filtered
        ? QueryRequest.after(cursor.name(), last, batchSize)
        : QueryRequest.latest(cursor.name(), batchSize);

    final List<Map<String, Object>> records;
    try {
      records = resourceQuery.query(resource, request);
    } catch (final RuntimeException e) {
      log.error("Poll of resource {} failed", resource, e);
      metrics.pollFailed(resource, e);
      return;
    }

    int delivered = 0;
    for (final Map<String, Object> record : records) {
      if (filtered && !isNewer(record.get(cursor.name()), last)) {
        log.debug("Skipping record of resource {} at or before cursor {}",
            resource, last);
        continue;
      }
      try {
        sink.accept(ChangeEvent.polled(resource, record));
        delivered++;
      } catch (final RuntimeException e) {
        log.error("Failed to dispatch polled record of resource {}",
            resource, e);
      }
    }

    if (cursor.isOrdered()) {
      final Object newest = newestCursorValue(records, cursor.name(), last);
      if (newest != last) {
        lastCursorValue = newest;
      }
    }

    log.debug("Poll of resource {} delivered {} records", resource,
        delivered);
    metrics.pollCompleted(resource, delivered);
  }

  /**
   * Finds the greatest non-null cursor value among the records. Records
   * without a cursor value are ignored wherever the query placed them.
   *
   * @param records the fetched records, never null
   * @param field   the cursor field, never null
   * @param last    the current cursor value, may be null
   *
   * @return the greatest value, or {@code last} if no record is newer
   */
  static Object newestCursorValue(final List<Map<String, Object>> records,
      final String field, final Object last) {
    Object newest = last;
    for (final Map<String, Object> record : records) {
      final Object value = record.get(field);
      if (value != null && (newest == null || isNewer(value, newest))) {
        newest = value;
      }
    }
    return newest;
  }

  /**
   * Checks whether a cursor value is strictly after another one.
   *
   * <p>Values that cannot be compared are trusted to be newer, as the
   * query already filtered them.
   *
   * @param value the candidate value, may be null
   * @param last  the reference value, never null
   *
   * @return true if the value is after the reference
   */
  @SuppressWarnings({"unchecked", "rawtypes"})
  static boolean isNewer(final Object value, final Object last) {
    if (value == null) {
      return false;
    }
    if (value instanceof Number && last instanceof Number) {
      return new BigDecimal(value.toString()).compareTo(
          new BigDecimal(last.toString())) > 0;
    }
    if (value instanceof Comparable
        && value.getClass().isInstance(last)) {
      return ((Comparable) value).compareTo(last) > 0;
    }
    return true;
  }
}
