package com.cloudauth.clientconfig;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ClientConfigCodecTests {
  private static final String KEY = "config/client";

  private final ClientConfigCodec codec = new ClientConfigCodec();

  @Test
  void encode_writesAllThreeFieldsByWireName() throws Exception {
    byte[] bytes = codec.encode(new ClientConfig("AKID", "secret", ""));

    JsonNode node = new ObjectMapper().readTree(bytes);
    assertEquals(3, node.size());
    assertEquals("AKID", node.get("access_key").textValue());
    assertEquals("secret", node.get("secret_key").textValue());
    assertEquals("", node.get("endpoint").textValue());
  }

  @Test
  void decode_returnsIdenticalRecord_forEncodedValues() throws Exception {
    List<ClientConfig> samples = List.of(
        ClientConfig.empty(),
        new ClientConfig("A1", "", ""),
        new ClientConfig("A1", "S1", "http://custom"),
        new ClientConfig("ключ", "with \"quotes\" and \\ slashes", "https://ec2.eu-west-1.example:8443/"));

    for (ClientConfig sample : samples) {
      assertEquals(sample, codec.decode(KEY, codec.encode(sample)));
    }
  }

  @Test
  void decode_ignoresUnknownProperties() throws Exception {
    byte[] bytes = "{\"access_key\":\"a\",\"secret_key\":\"s\",\"endpoint\":\"e\",\"extra\":1}"
        .getBytes(StandardCharsets.UTF_8);

    assertEquals(new ClientConfig("a", "s", "e"), codec.decode(KEY, bytes));
  }

  @Test
  void decode_rejectsInvalidJson() {
    CorruptClientConfigException e = assertThrows(
        CorruptClientConfigException.class,
        () -> codec.decode(KEY, "{not json".getBytes(StandardCharsets.UTF_8)));

    assertEquals(KEY, e.storageKey());
    assertNotNull(e.getCause());
  }

  @Test
  void decode_rejectsNonObjectRoot() {
    assertThrows(
        CorruptClientConfigException.class,
        () -> codec.decode(KEY, "[\"a\",\"s\",\"e\"]".getBytes(StandardCharsets.UTF_8)));
    assertThrows(CorruptClientConfigException.class, () -> codec.decode(KEY, new byte[0]));
  }

  @Test
  void decode_rejectsMissingField() {
    CorruptClientConfigException e = assertThrows(
        CorruptClientConfigException.class,
        () -> codec.decode(KEY, "{\"access_key\":\"a\",\"secret_key\":\"s\"}".getBytes(StandardCharsets.UTF_8)));

    assertTrue(e.getMessage().contains("endpoint"), e.getMessage());
  }

  @Test
  void decode_rejectsNonStringField() {
    assertThrows(
        CorruptClientConfigException.class,
        () -> codec.decode(
            KEY,
            "{\"access_key\":\"a\",\"secret_key\":null,\"endpoint\":\"\"}".getBytes(StandardCharsets.UTF_8)));
    assertThrows(
        CorruptClientConfigException.class,
        () -> codec.decode(
            KEY,
            "{\"access_key\":1,\"secret_key\":\"s\",\"endpoint\":\"\"}".getBytes(StandardCharsets.UTF_8)));
  }
}
