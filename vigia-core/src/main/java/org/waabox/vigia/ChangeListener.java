package org.waabox.vigia;

/**
 * Receives the change events of a subscribed resource.
 *
 * <p>Delivery is at-least-once: a few duplicates are possible when a
 * subscription hands off between its live channel and polling, so
 * implementations should be idempotent on the record's identifying key.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface ChangeListener {

  /**
   * Called for every change event of the subscribed resource.
   *
   * @param event the change event, never null
   */
  void onChange(ChangeEvent event);
}
