package org.waabox.vigia.poll;

/**
 * Coarse field types a {@link SchemaIntrospection} can search for.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum FieldType {

  /** Date, time and timestamp fields. */
  TIMESTAMP,

  /** Integral numeric fields. */
  INTEGER
}
