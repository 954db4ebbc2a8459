package org.waabox.vigia.poll;

/**
 * Sort direction of a {@link QueryRequest}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum SortOrder {

  /** Oldest first. */
  ASC,

  /** Most recent first. */
  DESC
}
