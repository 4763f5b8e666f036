package org.waabox.filedex;

/**
 * Thrown when a query is rejected before it reaches storage, for example a
 * time-range query without any bound.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DisallowedQueryException extends FiledexException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public DisallowedQueryException(final String message) {
    super(message);
  }
}
