package org.waabox.filedex.spring;

import java.nio.file.Path;
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.waabox.filedex.Filedex;
import org.waabox.filedex.cache.DiskFileCache;

/**
 * Spring Boot auto-configuration for the filedex catalog.
 *
 * <p>Creates one {@link Filedex} context from {@link FiledexProperties}:
 * the meta store, the coordinator in cluster mode and the file list. A
 * {@link DiskFileCache} bean is created when {@code filedex.cache.enabled}
 * is set.
 *
 * <p>The context lifecycle (start/stop) is managed through Spring's
 * {@link SmartLifecycle}: tables are created on start and every backend
 * handle is closed on stop.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration
@EnableConfigurationProperties(FiledexProperties.class)
public class FiledexAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      FiledexAutoConfiguration.class);

  /**
   * Creates the backend factory.
   *
   * @param properties the configuration properties, never null
   *
   * @return the factory, never null
   */
  @Bean
  @ConditionalOnMissingBean
  public FiledexBackendFactory filedexBackendFactory(
      final FiledexProperties properties) {
    return new FiledexBackendFactory(properties);
  }

  /**
   * Creates the disk file cache.
   *
   * @param properties the configuration properties, never null
   *
   * @return the cache, never null
   */
  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "filedex.cache", name = "enabled",
      havingValue = "true")
  public DiskFileCache diskFileCache(final FiledexProperties properties) {
    final FiledexProperties.Cache cache = properties.getCache();
    final Path dir = cache.getDir() == null
        ? Paths.get(properties.getDataDir()).resolve("cache")
        : Paths.get(cache.getDir());
    log.info("Disk file cache at {} with {} bytes", dir,
        cache.getCapacityBytes());
    return new DiskFileCache(dir, cache.getCapacityBytes());
  }

  /**
   * Creates the singleton {@link Filedex} context.
   *
   * @param factory the backend factory, never null
   * @param fileCacheProvider provider for an optional DiskFileCache bean
   *
   * @return the context, not started yet, never null
   */
  @Bean
  @ConditionalOnMissingBean
  public Filedex filedex(final FiledexBackendFactory factory,
      final ObjectProvider<DiskFileCache> fileCacheProvider) {
    return factory.create(fileCacheProvider.getIfAvailable());
  }

  /**
   * Creates a {@link SmartLifecycle} bean that starts and stops the
   * context.
   *
   * <p>The lifecycle starts late (phase {@code Integer.MAX_VALUE - 1}) so
   * that every other bean is initialized first, and stops early for the
   * same reason.
   *
   * @param filedex the context to manage, never null
   *
   * @return the lifecycle bean, never null
   */
  @Bean
  public SmartLifecycle filedexLifecycle(final Filedex filedex) {
    return new SmartLifecycle() {

      /** Whether the lifecycle is currently running. */
      private volatile boolean running = false;

      @Override
      public void start() {
        filedex.start();
        running = true;
      }

      @Override
      public void stop() {
        filedex.stop();
        running = false;
      }

      @Override
      public boolean isRunning() {
        return running;
      }

      @Override
      public int getPhase() {
        return Integer.MAX_VALUE - 1;
      }
    };
  }
}
