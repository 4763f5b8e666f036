package org.waabox.filedex;

/**
 * Wraps a failure raised by a storage engine driver.
 *
 * <p>The message always names the operation that failed; the engine's
 * exception is kept as the cause.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class BackendException extends FiledexException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public BackendException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the engine failure, cannot be null.
   */
  public BackendException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
