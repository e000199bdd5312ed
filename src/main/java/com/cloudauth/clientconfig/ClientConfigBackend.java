package com.cloudauth.clientconfig;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * One backend instance: the stored client configuration, the clients built from it, and the
 * request endpoint. Pass the instance to request handlers rather than sharing global state.
 *
 * @param <C> client type
 */
public final class ClientConfigBackend<C> {
  private final ClientConfigManager configManager;
  private final CachedClientPool<C> clientPool;
  private final ClientConfigEndpoint endpoint;

  public ClientConfigBackend(ConfigStorage storage, ClientFactory<C> clientFactory) {
    this(storage, clientFactory, new ClientConfigOptions());
  }

  public ClientConfigBackend(ConfigStorage storage, ClientFactory<C> clientFactory, ClientConfigOptions options) {
    Objects.requireNonNull(storage, "storage");
    Objects.requireNonNull(clientFactory, "clientFactory");
    Objects.requireNonNull(options, "options");

    // The pool reads through the manager, which is assigned before any client can be requested.
    this.clientPool = new CachedClientPool<>(this::readConfig, clientFactory);
    this.configManager = new ClientConfigManager(storage, clientPool, options);
    this.endpoint = new ClientConfigEndpoint(configManager);
  }

  public ClientConfigManager configManager() {
    return configManager;
  }

  public ClientConfigEndpoint endpoint() {
    return endpoint;
  }

  public CachedClientPool<C> clientPool() {
    return clientPool;
  }

  public C client(String region) throws IOException {
    return clientPool.get(region);
  }

  private Optional<ClientConfig> readConfig() throws IOException {
    return configManager.read();
  }
}
