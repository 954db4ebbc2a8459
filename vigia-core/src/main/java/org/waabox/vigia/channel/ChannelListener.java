package org.waabox.vigia.channel;

import org.waabox.vigia.ChangeEvent;

/**
 * Receives the callbacks of an open change channel.
 *
 * <p>Callbacks may arrive on any thread owned by the transport. Events of
 * a single channel are delivered in the order the transport received
 * them.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ChannelListener {

  /**
   * Called when the channel's status changes. Statuses may flap; callers
   * debounce them.
   *
   * @param status the raw status, never null
   */
  void onStatus(ChannelStatus status);

  /**
   * Called for every change event delivered by the channel.
   *
   * @param event the event, never null
   */
  void onEvent(ChangeEvent event);

  /**
   * Called when the transport reports a system error. The channel is no
   * longer trusted to deliver events.
   *
   * @param cause the error, never null
   */
  void onError(Throwable cause);
}
