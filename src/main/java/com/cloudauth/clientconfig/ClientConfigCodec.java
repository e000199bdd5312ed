package com.cloudauth.clientconfig;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.util.EnumMap;
import java.util.Objects;

/**
 * JSON codec for the stored {@link ClientConfig} record.
 * <p>
 * The record is written as a flat object with one string property per {@link ClientConfigField}.
 * Decoding is strict about the three known properties (all must be present and textual) and
 * ignores anything else.
 */
public final class ClientConfigCodec {
  private final ObjectMapper mapper;

  public ClientConfigCodec() {
    this(new ObjectMapper());
  }

  public ClientConfigCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public byte[] encode(ClientConfig config) throws IOException {
    Objects.requireNonNull(config, "config");

    ObjectNode node = mapper.createObjectNode();
    for (ClientConfigField field : ClientConfigField.values()) {
      node.put(field.wireName(), field.valueOf(config));
    }
    return mapper.writeValueAsBytes(node);
  }

  /**
   * Decodes a stored record.
   *
   * @param storageKey key the bytes were read from; only used for error reporting
   * @throws CorruptClientConfigException if the bytes are not a complete record
   */
  public ClientConfig decode(String storageKey, byte[] bytes) throws CorruptClientConfigException {
    Objects.requireNonNull(bytes, "bytes");

    JsonNode root;
    try {
      root = mapper.readTree(bytes);
    } catch (JsonProcessingException e) {
      throw new CorruptClientConfigException(storageKey, "not valid JSON", e);
    } catch (IOException e) {
      throw new CorruptClientConfigException(storageKey, "unreadable", e);
    }

    if (root == null || !root.isObject()) {
      throw new CorruptClientConfigException(storageKey, "expected a JSON object");
    }

    EnumMap<ClientConfigField, String> values = new EnumMap<>(ClientConfigField.class);
    for (ClientConfigField field : ClientConfigField.values()) {
      JsonNode value = root.get(field.wireName());
      if (value == null) {
        throw new CorruptClientConfigException(storageKey, "missing field '" + field.wireName() + "'");
      }
      if (!value.isTextual()) {
        throw new CorruptClientConfigException(storageKey, "field '" + field.wireName() + "' is not a string");
      }
      values.put(field, value.textValue());
    }
    return ClientConfig.fromValues(values);
  }
}
