package org.waabox.filedex.db;

/**
 * Size figures of a key-value store.
 *
 * @param bytesLen  the storage size in bytes, 0 when the engine does not
 *                  report it
 * @param keysCount the number of keys
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record DbStats(long bytesLen, long keysCount) {
}
