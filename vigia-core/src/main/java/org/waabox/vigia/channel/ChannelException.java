package org.waabox.vigia.channel;

import org.waabox.vigia.VigiaException;

/**
 * Thrown by a {@link ChangeChannel} when a channel cannot be opened.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class ChannelException extends VigiaException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public ChannelException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public ChannelException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
