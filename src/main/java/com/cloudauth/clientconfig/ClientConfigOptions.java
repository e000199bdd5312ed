package com.cloudauth.clientconfig;

import java.util.Objects;

public final class ClientConfigOptions {
  public static final String DEFAULT_STORAGE_KEY = "config/client";

  private final String storageKey;

  public ClientConfigOptions() {
    this(DEFAULT_STORAGE_KEY);
  }

  public ClientConfigOptions(String storageKey) {
    this.storageKey = Objects.requireNonNull(storageKey, "storageKey");
    if (storageKey.isBlank()) {
      throw new IllegalArgumentException("storageKey must be non-blank");
    }
  }

  public String storageKey() {
    return storageKey;
  }
}
