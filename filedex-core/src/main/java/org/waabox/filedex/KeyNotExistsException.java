package org.waabox.filedex;

/**
 * Thrown when a key lookup or a delete does not find the requested entry.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class KeyNotExistsException extends FiledexException {

  private static final long serialVersionUID = 1L;

  /** The key that was not found, never null. */
  private final String key;

  /** Creates a new exception for the given key.
   *
   * @param theKey the missing key, cannot be null.
   */
  public KeyNotExistsException(final String theKey) {
    super("Key not exists: " + theKey);
    key = theKey;
  }

  /** Returns the key that was not found.
   *
   * @return the key, never null.
   */
  public String key() {
    return key;
  }
}
