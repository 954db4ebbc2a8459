package org.waabox.vigia.poll;

import java.util.List;
import java.util.Map;

/**
 * Fetches a page of records of a resource ordered by a cursor field.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface ResourceQuery {

  /**
   * Runs a query.
   *
   * <p>When the request carries a cursor value, only records whose cursor
   * field is strictly greater than it are returned.
   *
   * @param resource the resource name, never null
   * @param request  the query parameters, never null
   *
   * @return the records in the requested order, at most
   *         {@link QueryRequest#limit()} of them, never null
   */
  List<Map<String, Object>> query(String resource, QueryRequest request);
}
