package com.cloudauth.clientconfig;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ConfigStorage} held in process memory. Values are copied on the way in and out.
 */
public final class InMemoryConfigStorage implements ConfigStorage {
  private final Map<String, byte[]> entries = new ConcurrentHashMap<>();

  @Override
  public Optional<byte[]> get(String key) {
    Objects.requireNonNull(key, "key");
    byte[] value = entries.get(key);
    return value == null ? Optional.empty() : Optional.of(value.clone());
  }

  @Override
  public void put(String key, byte[] value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    entries.put(key, value.clone());
  }

  @Override
  public void delete(String key) {
    Objects.requireNonNull(key, "key");
    entries.remove(key);
  }

  public boolean contains(String key) {
    return entries.containsKey(key);
  }
}
