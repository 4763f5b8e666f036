package org.waabox.filedex.db;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The receiving end of a watch on a key prefix.
 *
 * <p>A subscription has exactly one receiver. It never ends on its own:
 * it delivers events, in commit order, until {@link #close()} is called.
 * Events whose key is outside the prefix are dropped by
 * {@link #publish(Event)}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class WatchSubscription implements AutoCloseable {

  /** The watched prefix, never null. */
  private final String prefix;

  /** Pending events. */
  private final BlockingQueue<Event> events = new LinkedBlockingQueue<>();

  /** Invoked once on close, never null. */
  private final Runnable onClose;

  /** Whether this subscription was closed. */
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /**
   * Creates a new subscription.
   *
   * @param thePrefix the watched prefix, never null
   * @param theOnClose the action that detaches the subscription from its
   *     source, never null
   */
  public WatchSubscription(final String thePrefix,
      final Runnable theOnClose) {
    prefix = Objects.requireNonNull(thePrefix, "prefix cannot be null");
    onClose = Objects.requireNonNull(theOnClose, "onClose cannot be null");
  }

  /**
   * Returns the watched prefix.
   *
   * @return the prefix, never null
   */
  public String prefix() {
    return prefix;
  }

  /**
   * Hands an event to this subscription.
   *
   * @param event the event, never null
   *
   * @return true if the event was queued, false if it is outside the
   *     prefix or the subscription is closed
   */
  public boolean publish(final Event event) {
    Objects.requireNonNull(event, "event cannot be null");
    if (closed.get()) {
      return false;
    }
    if (event.type() != Event.Type.EMPTY && !event.key().startsWith(prefix)) {
      return false;
    }
    return events.offer(event);
  }

  /**
   * Waits for the next event.
   *
   * @return the event, never null
   *
   * @throws InterruptedException if interrupted while waiting
   */
  public Event take() throws InterruptedException {
    return events.take();
  }

  /**
   * Waits up to the given timeout for the next event.
   *
   * @param timeout the maximum wait, never null
   *
   * @return the event, or null on timeout
   *
   * @throws InterruptedException if interrupted while waiting
   */
  public Event poll(final Duration timeout) throws InterruptedException {
    return events.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  /**
   * Tells whether this subscription was closed.
   *
   * @return true after {@link #close()}
   */
  public boolean isClosed() {
    return closed.get();
  }

  /** Detaches this subscription from its source. */
  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      onClose.run();
    }
  }
}
