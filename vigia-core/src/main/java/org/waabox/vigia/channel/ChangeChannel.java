package org.waabox.vigia.channel;

import org.waabox.vigia.EventFilter;

/**
 * The push transport that delivers change events of a resource.
 *
 * <p>Implementations define how events reach the process: a message
 * broker topic, a database replication slot, a websocket. Each call to
 * {@link #open(String, EventFilter, ChannelListener)} creates an
 * independent channel.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ChangeChannel {

  /**
   * Opens a channel scoped to one resource.
   *
   * <p>This method returns once the channel has been requested. Its
   * readiness is reported asynchronously through
   * {@link ChannelListener#onStatus(ChannelStatus)}.
   *
   * @param resource the resource to watch, never null
   * @param filter   the mutations of interest, never null
   * @param listener the callbacks of the channel, never null
   *
   * @return the handle of the open channel, never null
   *
   * @throws ChannelException if the channel cannot be opened
   */
  ChannelHandle open(String resource, EventFilter filter,
      ChannelListener listener);
}
