package com.cloudauth.clientconfig;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-region cache of API clients built from the current client configuration.
 * <p>
 * Design intent:
 * <ul>
 *   <li>Hot path: a cached client is returned under the shared lock.</li>
 *   <li>Miss: the exclusive lock is taken and the map re-checked, so concurrent misses for the same
 *   region build one client.</li>
 *   <li>{@link #flush()} drops every client; the next {@link #get(String)} reads the configuration
 *   again.</li>
 * </ul>
 * Credentials are validated here, when a client is built, not when they are stored.
 *
 * @param <C> client type; clients implementing {@link AutoCloseable} are closed on flush
 */
public final class CachedClientPool<C> implements ClientCache {
  private static final Logger DEFAULT_LOGGER = LoggerFactory.getLogger(CachedClientPool.class);

  private final ClientConfigReader configReader;
  private final ClientFactory<C> clientFactory;
  private final Logger logger;

  private final ReadWriteLock clientLock = new ReentrantReadWriteLock();
  private final Map<String, C> clients = new HashMap<>();

  public CachedClientPool(ClientConfigReader configReader, ClientFactory<C> clientFactory) {
    this(configReader, clientFactory, DEFAULT_LOGGER);
  }

  public CachedClientPool(ClientConfigReader configReader, ClientFactory<C> clientFactory, Logger logger) {
    this.configReader = Objects.requireNonNull(configReader, "configReader");
    this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
    this.logger = Objects.requireNonNull(logger, "logger");
  }

  /**
   * Returns the client for {@code region}, building it from the current configuration on a miss.
   *
   * @throws IOException if the configuration cannot be read
   * @throws IllegalStateException if only one of access key and secret key is configured
   */
  public C get(String region) throws IOException {
    Objects.requireNonNull(region, "region");
    if (region.isBlank()) {
      throw new IllegalArgumentException("region must be non-blank");
    }

    clientLock.readLock().lock();
    try {
      C cached = clients.get(region);
      if (cached != null) {
        return cached;
      }
    } finally {
      clientLock.readLock().unlock();
    }

    clientLock.writeLock().lock();
    try {
      C cached = clients.get(region);
      if (cached != null) {
        return cached;
      }

      ClientConfig config = configReader.read().orElse(ClientConfig.empty());
      validateCredentials(config);

      C client = clientFactory.create(region, config);
      if (client == null) {
        throw new IllegalStateException("Client factory returned null for region " + region);
      }
      clients.put(region, client);
      logger.info(
          "Built client for region {} using {} credentials{}.",
          region,
          config.accessKey().isEmpty() ? "ambient" : "configured",
          config.hasCustomEndpoint() ? " and a custom endpoint" : "");
      return client;
    } finally {
      clientLock.writeLock().unlock();
    }
  }

  @Override
  public void flush() {
    List<C> evicted;
    clientLock.writeLock().lock();
    try {
      evicted = new ArrayList<>(clients.values());
      clients.clear();
    } finally {
      clientLock.writeLock().unlock();
    }

    for (C client : evicted) {
      if (client instanceof AutoCloseable) {
        try {
          ((AutoCloseable) client).close();
        } catch (Exception e) {
          logger.warn("Failed to close evicted client; continuing flush.", e);
        }
      }
    }

    if (!evicted.isEmpty()) {
      logger.info("Flushed {} cached client(s).", evicted.size());
    }
  }

  public int size() {
    clientLock.readLock().lock();
    try {
      return clients.size();
    } finally {
      clientLock.readLock().unlock();
    }
  }

  private static void validateCredentials(ClientConfig config) {
    boolean hasAccessKey = !config.accessKey().isEmpty();
    boolean hasSecretKey = !config.secretKey().isEmpty();
    if (hasAccessKey != hasSecretKey) {
      throw new IllegalStateException(
          "Client configuration is incomplete: access_key and secret_key must be set together.");
    }
  }
}
