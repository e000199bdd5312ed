package com.cloudauth.clientconfig;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Client credential configuration used to build cloud API clients.
 * <p>
 * All three values are always present once a record exists. Empty strings are legal: an empty
 * endpoint means "use the default endpoint", and empty keys are left for the consumer to reject
 * (or to replace with ambient credentials) when a client is actually built.
 */
public final class ClientConfig {
  private static final ClientConfig EMPTY = new ClientConfig("", "", "");

  private final String accessKey;
  private final String secretKey;
  private final String endpoint;

  public ClientConfig(String accessKey, String secretKey, String endpoint) {
    this.accessKey = Objects.requireNonNull(accessKey, "accessKey");
    this.secretKey = Objects.requireNonNull(secretKey, "secretKey");
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
  }

  public static ClientConfig empty() {
    return EMPTY;
  }

  static ClientConfig fromValues(Map<ClientConfigField, String> values) {
    return new ClientConfig(
        values.get(ClientConfigField.ACCESS_KEY),
        values.get(ClientConfigField.SECRET_KEY),
        values.get(ClientConfigField.ENDPOINT));
  }

  public String accessKey() {
    return accessKey;
  }

  public String secretKey() {
    return secretKey;
  }

  public String endpoint() {
    return endpoint;
  }

  public boolean hasCustomEndpoint() {
    return !endpoint.isEmpty();
  }

  /**
   * Returns the values keyed by wire field name, in wire order.
   */
  public Map<String, String> toMap() {
    Map<String, String> map = new LinkedHashMap<>();
    for (ClientConfigField field : ClientConfigField.values()) {
      map.put(field.wireName(), field.valueOf(this));
    }
    return Collections.unmodifiableMap(map);
  }

  EnumMap<ClientConfigField, String> toValues() {
    EnumMap<ClientConfigField, String> values = new EnumMap<>(ClientConfigField.class);
    for (ClientConfigField field : ClientConfigField.values()) {
      values.put(field, field.valueOf(this));
    }
    return values;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ClientConfig)) {
      return false;
    }
    ClientConfig other = (ClientConfig) o;
    return accessKey.equals(other.accessKey)
        && secretKey.equals(other.secretKey)
        && endpoint.equals(other.endpoint);
  }

  @Override
  public int hashCode() {
    return Objects.hash(accessKey, secretKey, endpoint);
  }

  @Override
  public String toString() {
    // Keys stay out of logs and exception messages.
    return "ClientConfig{accessKeySet=" + !accessKey.isEmpty()
        + ", secretKeySet=" + !secretKey.isEmpty()
        + ", endpoint='" + endpoint + "'}";
  }
}
