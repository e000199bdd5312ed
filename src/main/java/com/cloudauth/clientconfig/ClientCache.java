package com.cloudauth.clientconfig;

/**
 * Holds API clients built from the stored client configuration.
 * <p>
 * {@link ClientConfigManager} calls {@link #flush()} after a write that changed credentials and
 * after every delete, once the change is durable and its lock has been released.
 */
@FunctionalInterface
public interface ClientCache {
  /**
   * Discards every cached client so the next use rebuilds it from the current configuration.
   * Must be safe to call when nothing is cached.
   */
  void flush();
}
