package org.waabox.vigia.channel;

/**
 * Raw status values reported by a change channel.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum ChannelStatus {

  /** The channel is being established. */
  CONNECTING,

  /** The channel delivers events. */
  LIVE,

  /** The transport reported an error. */
  CHANNEL_ERROR,

  /** The transport closed the channel. */
  CLOSED,

  /** The transport gave up waiting for the channel. */
  TIMED_OUT;

  /**
   * Whether this status means the channel delivers events.
   *
   * @return true only for {@link #LIVE}
   */
  public boolean isLive() {
    return this == LIVE;
  }

  /**
   * Whether this status means the channel cannot be trusted to deliver
   * events. Every error-class value is treated the same way.
   *
   * @return true for {@link #CHANNEL_ERROR}, {@link #CLOSED} and
   *         {@link #TIMED_OUT}
   */
  public boolean isError() {
    return this == CHANNEL_ERROR || this == CLOSED || this == TIMED_OUT;
  }
}
