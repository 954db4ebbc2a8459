package org.waabox.vigia.poll;

import java.util.Objects;

/**
 * The field used to order and filter polled records of a resource.
 *
 * @param name the field name, never null
 * @param kind how the field was discovered, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CursorField(String name, Kind kind) {

  /** How trustworthy a cursor field is. */
  public enum Kind {

    /** A date or timestamp field. */
    TIMESTAMP,

    /** An integral, monotonically increasing field. */
    SEQUENCE,

    /** A plain identifier; ordering it says nothing about recency. */
    IDENTIFIER
  }

  /**
   * Validates the components.
   *
   * @param name the field name, never null
   * @param kind the kind, never null
   */
  public CursorField {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(kind, "kind must not be null");
  }

  /**
   * Whether values of this field can be used as an exclusive lower bound
   * between polls.
   *
   * @return false for {@link Kind#IDENTIFIER}
   */
  public boolean isOrdered() {
    return kind != Kind.IDENTIFIER;
  }
}
