package org.waabox.filedex.db;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process fan-out of key changes to prefix watchers.
 *
 * <p>Embedded and SQL stores keep one hub each. Every watched mutation is
 * published to all subscriptions whose prefix matches the key.
 *
 * <p>Thread safety: this class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class WatchHub implements ChangeNotifier {

  /** Class logger. */
  private static final Logger log = LoggerFactory.getLogger(WatchHub.class);

  /** Active subscriptions. */
  private final List<WatchSubscription> subscriptions =
      new CopyOnWriteArrayList<>();

  /**
   * Opens a new subscription on a prefix.
   *
   * @param prefix the prefix, never null
   *
   * @return the subscription, never null
   */
  public WatchSubscription subscribe(final String prefix) {
    Objects.requireNonNull(prefix, "prefix cannot be null");
    final WatchSubscription[] holder = new WatchSubscription[1];
    holder[0] = new WatchSubscription(prefix,
        () -> subscriptions.remove(holder[0]));
    subscriptions.add(holder[0]);
    log.debug("Watching prefix '{}'", prefix);
    return holder[0];
  }

  /**
   * Publishes an event to every matching subscription.
   *
   * @param event the event, never null
   */
  public void publish(final Event event) {
    for (final WatchSubscription subscription : subscriptions) {
      subscription.publish(event);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void notifyPut(final String key, final byte[] value) {
    publish(Event.put(key, value));
  }

  /**
   * {@inheritDoc}
   *
   * <p>A prefix delete also reaches subscriptions watching a narrower
   * prefix inside the deleted range: they receive a delete of their own
   * prefix, since everything under it is gone.
   */
  @Override
  public void notifyDelete(final String key, final boolean withPrefix) {
    final Event event = Event.delete(key);
    for (final WatchSubscription subscription : subscriptions) {
      final String watched = subscription.prefix();
      if (withPrefix && watched.length() > key.length()
          && watched.startsWith(key)) {
        subscription.publish(Event.delete(watched));
      } else {
        subscription.publish(event);
      }
    }
  }

  /**
   * Returns the number of open subscriptions.
   *
   * @return the count
   */
  public int size() {
    return subscriptions.size();
  }

  /** Closes every subscription. */
  public void closeAll() {
    for (final WatchSubscription subscription : subscriptions) {
      subscription.close();
    }
  }
}
