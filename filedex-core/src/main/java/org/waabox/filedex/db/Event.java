package org.waabox.filedex.db;

import java.util.Objects;

/**
 * A change notification delivered to a watcher.
 *
 * @param type  the kind of change, never null
 * @param key   the changed key, empty for {@link Type#EMPTY}
 * @param value the new value for {@link Type#PUT}, null otherwise
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Event(Type type, String key, byte[] value) {

  /** The kind of change. */
  public enum Type {
    /** A key was created or updated. */
    PUT,
    /** A key was removed. */
    DELETE,
    /** No change, receivers ignore it. */
    EMPTY
  }

  /** Validates the components. */
  public Event {
    Objects.requireNonNull(type, "type cannot be null");
    Objects.requireNonNull(key, "key cannot be null");
  }

  /**
   * Creates a put event.
   *
   * @param key the key, never null
   * @param value the new value, may be null when not transported
   *
   * @return the event, never null
   */
  public static Event put(final String key, final byte[] value) {
    return new Event(Type.PUT, key, value);
  }

  /**
   * Creates a delete event.
   *
   * @param key the key, never null
   *
   * @return the event, never null
   */
  public static Event delete(final String key) {
    return new Event(Type.DELETE, key, null);
  }

  /**
   * Creates a no-op event.
   *
   * @return the event, never null
   */
  public static Event empty() {
    return new Event(Type.EMPTY, "", null);
  }
}
