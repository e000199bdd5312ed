package com.cloudauth.clientconfig;

import java.io.IOException;
import java.util.Optional;

/**
 * Key-addressed durable storage for the client configuration record.
 * <p>
 * Implementations must be atomic per key. The caller ({@link ClientConfigManager}) provides all
 * read-modify-write coordination.
 */
public interface ConfigStorage {
  /**
   * Returns the bytes stored under {@code key}, or empty if nothing is stored.
   */
  Optional<byte[]> get(String key) throws IOException;

  void put(String key, byte[] value) throws IOException;

  /**
   * Removes {@code key}. Removing a key that does not exist is not an error.
   */
  void delete(String key) throws IOException;
}
