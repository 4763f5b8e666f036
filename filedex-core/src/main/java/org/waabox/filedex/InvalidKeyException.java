package org.waabox.filedex;

/**
 * Thrown when a file key or a key-value key does not have the expected
 * shape.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class InvalidKeyException extends FiledexException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public InvalidKeyException(final String message) {
    super(message);
  }
}
