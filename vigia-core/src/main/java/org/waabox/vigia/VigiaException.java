package org.waabox.vigia;

/**
 * Base exception for Vigia infrastructure errors.
 *
 * <p>This is an unchecked exception used by the collaborator
 * implementations (queries, schema introspection, channels) to wrap
 * failures of the underlying technology. The subscription layer recovers
 * from them locally and never lets them reach the caller.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class VigiaException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public VigiaException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public VigiaException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
