package org.waabox.filedex.db;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards the watched mutations of a durable store to the cluster
 * coordinator, so watchers on other nodes see them.
 *
 * <p>A put is mirrored with its value; a delete removes the mirrored key
 * if the coordinator still has it.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CoordinatorNotifier implements ChangeNotifier {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(CoordinatorNotifier.class);

  /** The coordinator, never null. */
  private final Db coordinator;

  /**
   * Creates a notifier.
   *
   * @param theCoordinator the coordinator store, never null
   */
  public CoordinatorNotifier(final Db theCoordinator) {
    coordinator = Objects.requireNonNull(theCoordinator,
        "coordinator cannot be null");
  }

  /** {@inheritDoc} */
  @Override
  public void notifyPut(final String key, final byte[] value) {
    log.debug("Forwarding put of '{}' to coordinator", key);
    coordinator.put(key, value, false);
  }

  /** {@inheritDoc} */
  @Override
  public void notifyDelete(final String key, final boolean withPrefix) {
    log.debug("Forwarding delete of '{}' to coordinator", key);
    coordinator.deleteIfExists(key, withPrefix, false);
  }
}
