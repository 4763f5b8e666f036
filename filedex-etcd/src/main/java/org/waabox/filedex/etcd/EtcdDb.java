package org.waabox.filedex.etcd;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.Watch;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.options.DeleteOption;
import io.etcd.jetcd.options.GetOption;
import io.etcd.jetcd.options.WatchOption;
import io.etcd.jetcd.watch.WatchEvent;
import io.etcd.jetcd.watch.WatchResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.filedex.BackendException;
import org.waabox.filedex.KeyNotExistsException;
import org.waabox.filedex.db.Db;
import org.waabox.filedex.db.DbStats;
import org.waabox.filedex.db.Event;
import org.waabox.filedex.db.WatchSubscription;

/**
 * The cluster coordinator: a {@link Db} on etcd.
 *
 * <p>Keys are stored under the configured prefix and prefixes match the
 * raw key string. Watches are served by etcd itself, so a mutation made
 * on any node reaches the watchers of every node; this store never needs
 * a separate notifier.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class EtcdDb implements Db {

  /** Class logger. */
  private static final Logger log = LoggerFactory.getLogger(EtcdDb.class);

  /** The etcd client, never null. */
  private final Client client;

  /** The key prefix without trailing slash, never null. */
  private final String prefix;

  /** The timeout of one call in milliseconds. */
  private final long timeoutMillis;

  /** Open watches. */
  private final List<WatchSubscription> subscriptions =
      new CopyOnWriteArrayList<>();

  /**
   * Connects to etcd.
   *
   * @param config the configuration, never null
   */
  public EtcdDb(final EtcdConfig config) {
    this(Client.builder()
        .endpoints(config.endpoints().toArray(new String[0]))
        .build(), config);
  }

  /** Creates a store on an existing client.
   *
   * @param theClient the client, never null.
   * @param config the configuration, never null.
   */
  EtcdDb(final Client theClient, final EtcdConfig config) {
    client = Objects.requireNonNull(theClient, "client cannot be null");
    prefix = config.prefix();
    timeoutMillis = config.timeout().toMillis();
    log.info("[ETCD] coordinator on {} under '{}'", config.endpoints(),
        prefix);
  }

  /** {@inheritDoc} */
  @Override
  public void createTable() {
    log.debug("[ETCD] nothing to create");
  }

  /** {@inheritDoc} */
  @Override
  public DbStats stats() {
    final GetResponse response = await("stats", kv().get(bytes(""),
        GetOption.builder().isPrefix(true).build()));
    long size = 0;
    for (final KeyValue entry : response.getKvs()) {
      size += strip(entry.getKey()).length() + entry.getValue().size();
    }
    return new DbStats(size, response.getKvs().size());
  }

  /** {@inheritDoc} */
  @Override
  public byte[] get(final String key) {
    final GetResponse response = await("get", kv().get(bytes(key)));
    if (response.getKvs().isEmpty()) {
      throw new KeyNotExistsException(key);
    }
    return response.getKvs().get(0).getValue().getBytes();
  }

  /** {@inheritDoc} */
  @Override
  public void put(final String key, final byte[] value,
      final boolean needWatch) {
    Objects.requireNonNull(value, "value cannot be null");
    await("put", kv().put(bytes(key), ByteSequence.from(value)));
  }

  /** {@inheritDoc} */
  @Override
  public void delete(final String key, final boolean withPrefix,
      final boolean needWatch) {
    final long deleted = await("delete", kv().delete(bytes(key),
        DeleteOption.builder().isPrefix(withPrefix).build())).getDeleted();
    if (deleted == 0) {
      throw new KeyNotExistsException(key);
    }
  }

  /** {@inheritDoc} */
  @Override
  public SortedMap<String, byte[]> list(final String keyPrefix) {
    final GetResponse response = await("list", kv().get(bytes(keyPrefix),
        GetOption.builder()
            .isPrefix(true)
            .withSortField(GetOption.SortTarget.KEY)
            .withSortOrder(GetOption.SortOrder.ASCEND)
            .build()));
    final SortedMap<String, byte[]> result = new TreeMap<>();
    for (final KeyValue entry : response.getKvs()) {
      result.put(strip(entry.getKey()), entry.getValue().getBytes());
    }
    return result;
  }

  /** {@inheritDoc} */
  @Override
  public long count(final String keyPrefix) {
    return await("count", kv().get(bytes(keyPrefix),
        GetOption.builder().isPrefix(true).withCountOnly(true).build()))
        .getCount();
  }

  /** {@inheritDoc} */
  @Override
  public WatchSubscription watch(final String keyPrefix) {
    final AtomicReference<Watch.Watcher> watcher = new AtomicReference<>();
    final AtomicReference<WatchSubscription> holder = new AtomicReference<>();
    final WatchSubscription subscription =
        new WatchSubscription(keyPrefix, () -> {
          subscriptions.remove(holder.get());
          final Watch.Watcher active = watcher.get();
          if (active != null) {
            active.close();
          }
        });
    holder.set(subscription);
    subscriptions.add(subscription);
    watcher.set(client.getWatchClient().watch(bytes(keyPrefix),
        WatchOption.builder().isPrefix(true).build(),
        Watch.listener(
            response -> dispatch(subscription, response),
            error -> log.error("[ETCD] watch on '{}' failed", keyPrefix,
                error))));
    log.debug("[ETCD] watching '{}'", keyPrefix);
    return subscription;
  }

  /** {@inheritDoc} */
  @Override
  public boolean distributed() {
    return true;
  }

  /** {@inheritDoc} */
  @Override
  public void close() {
    for (final WatchSubscription subscription : subscriptions) {
      subscription.close();
    }
    client.close();
  }

  /** Forwards the events of a watch response.
   *
   * @param subscription the receiving subscription.
   * @param response the etcd response.
   */
  private void dispatch(final WatchSubscription subscription,
      final WatchResponse response) {
    for (final WatchEvent event : response.getEvents()) {
      final String key = strip(event.getKeyValue().getKey());
      switch (event.getEventType()) {
        case PUT:
          subscription.publish(Event.put(key,
              event.getKeyValue().getValue().getBytes()));
          break;
        case DELETE:
          subscription.publish(Event.delete(key));
          break;
        default:
          log.warn("[ETCD] unrecognized event on '{}'", key);
      }
    }
  }

  private KV kv() {
    return client.getKVClient();
  }

  /** Waits for an etcd call.
   *
   * @param op the operation name, for the error message.
   * @param future the pending call.
   * @return the call result.
   */
  private <T> T await(final String op, final CompletableFuture<T> future) {
    try {
      return future.get(timeoutMillis, TimeUnit.MILLISECONDS);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BackendException("[ETCD] " + op + " interrupted", e);
    } catch (final ExecutionException e) {
      throw new BackendException("[ETCD] " + op + " failed", e.getCause());
    } catch (final TimeoutException e) {
      future.cancel(true);
      throw new BackendException("[ETCD] " + op + " timed out", e);
    }
  }

  /** Renders the etcd key of a key.
   *
   * @param key the key.
   * @return the prefixed key, never null.
   */
  private ByteSequence bytes(final String key) {
    return ByteSequence.from(qualify(prefix, key), StandardCharsets.UTF_8);
  }

  private String strip(final ByteSequence key) {
    return unqualify(prefix, key.toString(StandardCharsets.UTF_8));
  }

  /**
   * Adds the store prefix to a key.
   *
   * @param prefix the store prefix, without trailing slash
   * @param key the key
   *
   * @return the etcd key, never null
   */
  static String qualify(final String prefix, final String key) {
    if (key.isEmpty() || key.startsWith("/")) {
      return prefix + key;
    }
    return prefix + "/" + key;
  }

  /**
   * Removes the store prefix from an etcd key.
   *
   * @param prefix the store prefix, without trailing slash
   * @param raw the etcd key
   *
   * @return the key, never null
   */
  static String unqualify(final String prefix, final String raw) {
    return raw.startsWith(prefix) ? raw.substring(prefix.length()) : raw;
  }
}
