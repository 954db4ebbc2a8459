package org.waabox.vigia.channel;

/**
 * An open change channel.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface ChannelHandle {

  /**
   * Closes the channel and releases its transport resources.
   *
   * <p>After this method returns the channel must not invoke its
   * listener anymore. Implementations must tolerate repeated calls.
   */
  void close();
}
