package com.cloudauth.clientconfig;

/**
 * Builds an API client for a region from the stored client configuration.
 *
 * @param <C> client type
 */
@FunctionalInterface
public interface ClientFactory<C> {
  /**
   * Creates a client.
   *
   * @param region region the client talks to
   * @param config current configuration; {@link ClientConfig#empty()} when the backend is not
   *     configured, in which case the factory should fall back to ambient credentials
   */
  C create(String region, ClientConfig config);
}
