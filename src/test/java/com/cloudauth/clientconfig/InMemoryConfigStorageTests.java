package com.cloudauth.clientconfig;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryConfigStorageTests {
  private final InMemoryConfigStorage storage = new InMemoryConfigStorage();

  @Test
  void get_missingKey_returnsEmpty() {
    assertEquals(Optional.empty(), storage.get("config/client"));
  }

  @Test
  void putAndGet_copyValues() {
    byte[] value = "abc".getBytes(StandardCharsets.UTF_8);
    storage.put("config/client", value);
    value[0] = 'x';

    byte[] read = storage.get("config/client").orElseThrow();
    assertEquals("abc", new String(read, StandardCharsets.UTF_8));

    read[0] = 'y';
    assertEquals("abc", new String(storage.get("config/client").orElseThrow(), StandardCharsets.UTF_8));
  }

  @Test
  void delete_missingKey_isNotAnError() {
    storage.delete("config/client");
    storage.put("config/client", new byte[] {1});
    storage.delete("config/client");

    assertFalse(storage.contains("config/client"));
  }
}
