package com.cloudauth.clientconfig;

import java.io.IOException;

/**
 * Thrown when the stored bytes for the client configuration do not decode into a complete record.
 */
public final class CorruptClientConfigException extends IOException {
  private static final long serialVersionUID = 1L;

  private final String storageKey;

  public CorruptClientConfigException(String storageKey, String message) {
    super("Stored client configuration at '" + storageKey + "' is corrupt: " + message);
    this.storageKey = storageKey;
  }

  public CorruptClientConfigException(String storageKey, String message, Throwable cause) {
    super("Stored client configuration at '" + storageKey + "' is corrupt: " + message, cause);
    this.storageKey = storageKey;
  }

  public String storageKey() {
    return storageKey;
  }
}
