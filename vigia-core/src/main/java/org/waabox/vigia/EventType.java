package org.waabox.vigia;

/**
 * The kind of mutation a {@link ChangeEvent} describes.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum EventType {

  /** A record was created. */
  INSERT,

  /** A record was modified. */
  UPDATE,

  /** A record was removed. */
  DELETE
}
