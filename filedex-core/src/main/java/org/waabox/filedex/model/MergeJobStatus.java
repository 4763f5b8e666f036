package org.waabox.filedex.model;

/**
 * The lifecycle of a merge job: pending, claimed by a node, finished.
 *
 * <p>The code is the value stored in the {@code status} column.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum MergeJobStatus {

  PENDING(0),
  RUNNING(1),
  DONE(2);

  /** The stored code. */
  private final int code;

  /**
   * Creates a status.
   *
   * @param theCode the stored code
   */
  MergeJobStatus(final int theCode) {
    code = theCode;
  }

  /**
   * Returns the stored code.
   *
   * @return the code
   */
  public int code() {
    return code;
  }

  /**
   * Resolves a status from its stored code.
   *
   * @param code the code
   *
   * @return the status, never null
   *
   * @throws IllegalArgumentException if the code is unknown
   */
  public static MergeJobStatus fromCode(final int code) {
    for (final MergeJobStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown merge job status " + code);
  }
}
