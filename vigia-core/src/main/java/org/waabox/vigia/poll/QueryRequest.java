package org.waabox.vigia.poll;

import java.util.Objects;

/**
 * The parameters of a {@link ResourceQuery}.
 *
 * @param cursorField the field to order and filter by, never null
 * @param cursorValue the exclusive lower bound of the cursor field, null
 *                    to fetch the latest records
 * @param order       the sort direction, never null
 * @param limit       the maximum number of records, positive
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record QueryRequest(
    String cursorField,
    Object cursorValue,
    SortOrder order,
    int limit
) {

  /**
   * Validates the components.
   *
   * @param cursorField the cursor field, never null
   * @param cursorValue the lower bound, may be null
   * @param order       the order, never null
   * @param limit       the limit, positive
   */
  public QueryRequest {
    Objects.requireNonNull(cursorField, "cursorField must not be null");
    Objects.requireNonNull(order, "order must not be null");
    if (limit <= 0) {
      throw new IllegalArgumentException(
          "limit must be greater than 0, got: " + limit);
    }
  }

  /**
   * Requests the most recent records, newest first.
   *
   * @param cursorField the cursor field, never null
   * @param limit       the maximum number of records, positive
   *
   * @return the request, never null
   */
  public static QueryRequest latest(final String cursorField,
      final int limit) {
    return new QueryRequest(cursorField, null, SortOrder.DESC, limit);
  }

  /**
   * Requests the records newer than the given cursor value, newest first.
   *
   * @param cursorField the cursor field, never null
   * @param cursorValue the exclusive lower bound, never null
   * @param limit       the maximum number of records, positive
   *
   * @return the request, never null
   */
  public static QueryRequest after(final String cursorField,
      final Object cursorValue, final int limit) {
    Objects.requireNonNull(cursorValue, "cursorValue must not be null");
    return new QueryRequest(cursorField, cursorValue, SortOrder.DESC, limit);
  }

  /**
   * Whether the request filters by a cursor value.
   *
   * @return true if a lower bound is set
   */
  public boolean hasCursorValue() {
    return cursorValue != null;
  }
}
