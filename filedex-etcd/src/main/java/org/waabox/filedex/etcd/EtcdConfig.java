package org.waabox.filedex.etcd;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Immutable configuration of the etcd coordinator.
 *
 * <p>Every key is stored under {@link #prefix()}, so several clusters can
 * share one etcd. A trailing {@code /} of the prefix is dropped.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class EtcdConfig {

  /** Default timeout of one etcd call. */
  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

  /** The endpoints, never empty. */
  private final List<String> endpoints;

  /** The key prefix without trailing slash, never null. */
  private final String prefix;

  /** The timeout of one call, never null. */
  private final Duration timeout;

  private EtcdConfig(final List<String> theEndpoints, final String thePrefix,
      final Duration theTimeout) {
    endpoints = theEndpoints;
    prefix = thePrefix;
    timeout = theTimeout;
  }

  /**
   * Creates a configuration with a 5 seconds call timeout.
   *
   * @param endpoints the etcd endpoints, e.g. {@code http://localhost:2379},
   *     never empty
   * @param prefix the key prefix, e.g. {@code /filedex}, never null
   *
   * @return the configuration, never null
   */
  public static EtcdConfig create(final List<String> endpoints,
      final String prefix) {
    return create(endpoints, prefix, DEFAULT_TIMEOUT);
  }

  /**
   * Creates a configuration.
   *
   * @param endpoints the etcd endpoints, never empty
   * @param prefix the key prefix, never null
   * @param timeout the timeout of one call, must be positive
   *
   * @return the configuration, never null
   */
  public static EtcdConfig create(final List<String> endpoints,
      final String prefix, final Duration timeout) {
    Objects.requireNonNull(endpoints, "endpoints cannot be null");
    Objects.requireNonNull(prefix, "prefix cannot be null");
    Objects.requireNonNull(timeout, "timeout cannot be null");
    if (endpoints.isEmpty()) {
      throw new IllegalArgumentException("endpoints cannot be empty");
    }
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    final String trimmed = prefix.endsWith("/")
        ? prefix.substring(0, prefix.length() - 1) : prefix;
    return new EtcdConfig(List.copyOf(endpoints), trimmed, timeout);
  }

  /**
   * Returns the endpoints.
   *
   * @return the endpoints, never empty
   */
  public List<String> endpoints() {
    return endpoints;
  }

  /**
   * Returns the key prefix, without trailing slash.
   *
   * @return the prefix, never null
   */
  public String prefix() {
    return prefix;
  }

  /**
   * Returns the timeout of one call.
   *
   * @return the timeout, never null
   */
  public Duration timeout() {
    return timeout;
  }
}
