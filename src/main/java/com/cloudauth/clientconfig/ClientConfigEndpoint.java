package com.cloudauth.clientconfig;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Request-facing surface of the client configuration: field schema, help text and dispatch of
 * raw key/value requests to {@link ClientConfigManager}.
 */
public final class ClientConfigEndpoint {
  public static final String PATH = "config/client";

  public static final String HELP_SYNOPSIS =
      "Configure the client credentials that are used to query instance details from the cloud API.";

  public static final String HELP_DESCRIPTION =
      "The backend calls the cloud API's instance description operation to look up the instance "
          + "performing a login. The access_key and secret_key registered here must be permitted "
          + "to make that call. Keys may be supplied across several writes; they are checked when "
          + "a client is built, not when they are stored.";

  private final ClientConfigManager configManager;

  public ClientConfigEndpoint(ClientConfigManager configManager) {
    this.configManager = Objects.requireNonNull(configManager, "configManager");
  }

  /**
   * Field names mapped to their descriptions, in wire order. Every field defaults to "".
   */
  public static Map<String, String> fieldSchema() {
    Map<String, String> schema = new LinkedHashMap<>();
    for (ClientConfigField field : ClientConfigField.values()) {
      schema.put(field.wireName(), field.description());
    }
    return schema;
  }

  /**
   * Returns true when a write should be routed as an update, false for a create.
   */
  public boolean existenceCheck() throws IOException {
    return configManager.existenceCheck();
  }

  /**
   * Classifies a write with {@link #existenceCheck()} and dispatches it.
   */
  public Optional<Map<String, String>> write(Map<String, String> data) throws IOException {
    ConfigOperation operation = existenceCheck() ? ConfigOperation.UPDATE : ConfigOperation.CREATE;
    return handle(operation, data);
  }

  /**
   * Handles one request.
   *
   * @return the field map for a READ of a configured backend; empty otherwise
   * @throws IllegalArgumentException if {@code data} names an unknown field
   */
  public Optional<Map<String, String>> handle(ConfigOperation operation, Map<String, String> data)
      throws IOException {
    Objects.requireNonNull(operation, "operation");
    Map<String, String> fields = data == null ? Map.of() : data;

    switch (operation) {
      case READ:
        return configManager.read().map(ClientConfig::toMap);
      case DELETE:
        configManager.delete();
        return Optional.empty();
      case CREATE:
      case UPDATE:
        configManager.upsert(toUpsertRequest(operation, fields));
        return Optional.empty();
      default:
        throw new IllegalArgumentException("Unsupported operation: " + operation);
    }
  }

  static UpsertRequest toUpsertRequest(ConfigOperation operation, Map<String, String> data) {
    UpsertRequest.Builder builder = UpsertRequest.builder()
        .intent(operation == ConfigOperation.CREATE ? UpsertRequest.Intent.CREATE : UpsertRequest.Intent.UPDATE);

    for (Map.Entry<String, String> entry : data.entrySet()) {
      ClientConfigField field = ClientConfigField.fromWireName(entry.getKey())
          .orElseThrow(() -> new IllegalArgumentException("Unknown field: " + entry.getKey()));
      if (entry.getValue() == null) {
        throw new IllegalArgumentException("Field " + field.wireName() + " must not be null");
      }
      builder.set(field, entry.getValue());
    }
    return builder.build();
  }
}
