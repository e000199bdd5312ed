package com.cloudauth.clientconfig;

import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * The fields of a {@link ClientConfig}, in wire order.
 * <p>
 * Every field is a string that defaults to the empty string when a record is first created.
 */
public enum ClientConfigField {
  ACCESS_KEY(
      "access_key",
      "Access key with permissions to query the instance description API.",
      ClientConfig::accessKey),
  SECRET_KEY(
      "secret_key",
      "Secret key with permissions to query the instance description API.",
      ClientConfig::secretKey),
  ENDPOINT(
      "endpoint",
      "URL to override the default generated endpoint for making API calls.",
      ClientConfig::endpoint);

  private final String wireName;
  private final String description;
  private final Function<ClientConfig, String> accessor;

  ClientConfigField(String wireName, String description, Function<ClientConfig, String> accessor) {
    this.wireName = wireName;
    this.description = description;
    this.accessor = accessor;
  }

  public String wireName() {
    return wireName;
  }

  public String description() {
    return description;
  }

  public String defaultValue() {
    return "";
  }

  public String valueOf(ClientConfig config) {
    return accessor.apply(config);
  }

  public static Optional<ClientConfigField> fromWireName(String wireName) {
    if (wireName == null) {
      return Optional.empty();
    }

    String normalized = wireName.toLowerCase(Locale.ROOT);
    for (ClientConfigField field : values()) {
      if (field.wireName.equals(normalized)) {
        return Optional.of(field);
      }
    }
    return Optional.empty();
  }
}
