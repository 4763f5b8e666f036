package org.waabox.filedex.model;

/**
 * An exclusive-inclusive primary key window, {@code (min, max]}, used for
 * incremental statistics.
 *
 * <p>The window {@code (0, 0)} means no bound.
 *
 * @param min the exclusive lower bound
 * @param max the inclusive upper bound
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record PkRange(long min, long max) {

  /** The unbounded window. */
  public static final PkRange ALL = new PkRange(0, 0);

  /**
   * Creates a window.
   *
   * @param min the exclusive lower bound
   * @param max the inclusive upper bound
   *
   * @return the window, never null
   */
  public static PkRange of(final long min, final long max) {
    return new PkRange(min, max);
  }

  /**
   * Tells whether this window restricts anything.
   *
   * @return false for {@code (0, 0)}
   */
  public boolean bounded() {
    return min != 0 || max != 0;
  }

  /**
   * Checks whether the given key falls inside the window.
   *
   * @param pk the key to check
   *
   * @return true if {@code min < pk <= max} or the window is unbounded
   */
  public boolean contains(final long pk) {
    return !bounded() || (pk > min && pk <= max);
  }
}
