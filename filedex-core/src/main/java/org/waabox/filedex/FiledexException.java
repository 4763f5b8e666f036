package org.waabox.filedex;

/**
 * Base exception for all catalog errors.
 *
 * <p>This is an unchecked exception. Storage adapters translate engine
 * failures into one of its subclasses so callers never depend on a
 * particular driver's exception types.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class FiledexException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public FiledexException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public FiledexException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
