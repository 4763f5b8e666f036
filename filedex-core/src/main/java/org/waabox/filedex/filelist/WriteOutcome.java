package org.waabox.filedex.filelist;

/**
 * The result of a chunk write as seen above the storage adapter.
 *
 * <p>Adapters translate the engine's unique-constraint signal into
 * {@link #ALREADY_EXISTS}; every other failure is thrown.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum WriteOutcome {

  /** Every row of the chunk was written. */
  COMMITTED,

  /** At least one row was already present; nothing was written. */
  ALREADY_EXISTS
}
