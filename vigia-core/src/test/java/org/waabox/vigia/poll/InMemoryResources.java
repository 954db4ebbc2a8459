package org.waabox.vigia.poll;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import org.waabox.vigia.VigiaException;

/**
 * An in-memory store of resources serving as both {@link ResourceQuery}
 * and {@link SchemaIntrospection}.
 *
 * <p>Each resource has a fixed list of columns; fields whose name ends
 * with {@code _at} are timestamps, {@code id} and {@code seq} are
 * integers.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class InMemoryResources implements ResourceQuery,
    SchemaIntrospection {

  /** The columns of each resource. */
  private final Map<String, List<String>> columns = new LinkedHashMap<>();

  /** The rows of each resource. */
  private final Map<String, List<Map<String, Object>>> rows =
      new LinkedHashMap<>();

  /** Every query received, in order. */
  private final List<QueryRequest> requests = new ArrayList<>();

  /** The number of queries received. */
  private final AtomicInteger queryCount = new AtomicInteger();

  /** Whether queries fail. */
  private volatile boolean queryFailing;

  /**
   * Declares a resource.
   *
   * @param resource    the resource name
   * @param columnNames its columns
   *
   * @return this store
   */
  public synchronized InMemoryResources define(final String resource,
      final String... columnNames) {
    columns.put(resource, List.of(columnNames));
    rows.put(resource, new ArrayList<>());
    return this;
  }

  /**
   * Adds a row.
   *
   * @param resource the resource name
   * @param row      the row
   *
   * @return this store
   */
  public synchronized InMemoryResources insert(final String resource,
      final Map<String, Object> row) {
    rows.get(resource).add(new LinkedHashMap<>(row));
    return this;
  }

  /**
   * Creates a row with an id and an update time.
   *
   * @param id        the id
   * @param updatedAt the update time
   *
   * @return the row
   */
  public static Map<String, Object> row(final long id,
      final Instant updatedAt) {
    final Map<String, Object> row = new LinkedHashMap<>();
    row.put("id", id);
    row.put("updated_at", updatedAt);
    return row;
  }

  /**
   * Makes queries fail, or succeed again.
   *
   * @param failing whether queries fail
   */
  public void queryFailing(final boolean failing) {
    queryFailing = failing;
  }

  /** @return the number of queries received */
  public int queryCount() {
    return queryCount.get();
  }

  /** @return every query received */
  public synchronized List<QueryRequest> requests() {
    return List.copyOf(requests);
  }

  @Override
  @SuppressWarnings({"unchecked", "rawtypes"})
  public List<Map<String, Object>> query(final String resource,
      final QueryRequest request) {
    queryCount.incrementAndGet();
    synchronized (this) {
      requests.add(request);
    }
    if (queryFailing) {
      throw new VigiaException("query failed for " + resource);
    }
    final List<Map<String, Object>> result = new ArrayList<>();
    synchronized (this) {
      for (final Map<String, Object> row : rows.get(resource)) {
        final Object value = row.get(request.cursorField());
        if (!request.hasCursorValue()
            || ((Comparable) value).compareTo(request.cursorValue()) > 0) {
          result.add(new LinkedHashMap<>(row));
        }
      }
    }
    final String field = request.cursorField();
    final Comparator<Map<String, Object>> byCursor = (a, b) ->
        ((Comparable) a.get(field)).compareTo(b.get(field));
    result.sort(request.order() == SortOrder.DESC
        ? byCursor.reversed() : byCursor);
    return result.size() > request.limit()
        ? result.subList(0, request.limit()) : result;
  }

  @Override
  public synchronized boolean resourceExists(final String resource) {
    return columns.containsKey(resource);
  }

  @Override
  public synchronized boolean columnExists(final String resource,
      final String field) {
    final List<String> names = columns.get(resource);
    return names != null && names.contains(field);
  }

  @Override
  public synchronized List<String> fieldsByType(final String resource,
      final Set<FieldType> types) {
    final List<String> result = new ArrayList<>();
    for (final String name : columns.getOrDefault(resource, List.of())) {
      if (types.contains(FieldType.TIMESTAMP) && name.endsWith("_at")) {
        result.add(name);
      } else if (types.contains(FieldType.INTEGER)
          && (name.equals("id") || name.equals("seq"))) {
        result.add(name);
      }
    }
    return result;
  }
}
