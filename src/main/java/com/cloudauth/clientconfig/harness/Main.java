package com.cloudauth.clientconfig.harness;

import com.cloudauth.clientconfig.ClientConfig;
import com.cloudauth.clientconfig.ClientConfigBackend;
import com.cloudauth.clientconfig.ClientConfigEndpoint;
import com.cloudauth.clientconfig.ConfigOperation;
import com.cloudauth.clientconfig.InMemoryConfigStorage;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Main {
  private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

  private static final Path DEFAULT_CONFIG_PATH =
      Path.of("samples", "client-config-harness", "config.json");

  private static final Path TEMPLATE_CONFIG_PATH =
      Path.of("samples", "client-config-harness", "config.example.json");

  private static final String DEFAULT_ENDPOINT_TEMPLATE = "https://ec2.%s.amazonaws.com";

  public static void main(String[] args) {
    try {
      Path configPath = parseConfigPath(args);
      HarnessConfig config = loadConfig(configPath);
      String region = config.client.region == null || config.client.region.isBlank()
          ? "us-east-1"
          : config.client.region;

      System.out.println("Config: " + configPath.toAbsolutePath());
      System.out.println("Region: " + region);

      AtomicInteger builds = new AtomicInteger();
      ClientConfigBackend<DemoClient> backend = new ClientConfigBackend<>(
          new InMemoryConfigStorage(),
          (clientRegion, clientConfig) -> {
            builds.incrementAndGet();
            return new DemoClient(clientRegion, clientConfig);
          });
      ClientConfigEndpoint endpoint = backend.endpoint();

      System.out.println("\n1) Write access key on an unconfigured backend...");
      endpoint.write(Map.of("access_key", config.client.accessKey));
      printState(endpoint);

      System.out.println("\n2) Write secret key and endpoint...");
      endpoint.write(Map.of(
          "secret_key", config.client.secretKey,
          "endpoint", nullToEmpty(config.client.endpoint)));
      printState(endpoint);

      DemoClient first = backend.client(region);
      System.out.println("Client: " + first);

      System.out.println("\n3) Rewrite the same access key (no flush expected)...");
      endpoint.write(Map.of("access_key", config.client.accessKey));
      DemoClient second = backend.client(region);
      System.out.println(first == second ? "OK: cached client reused" : "WARNING: client was rebuilt");

      System.out.println("\n4) Delete the configuration...");
      endpoint.handle(ConfigOperation.DELETE, Map.of());
      printState(endpoint);
      System.out.println("Cached clients after delete: " + backend.clientPool().size());
      System.out.println("Clients built: " + builds.get() + " (expected: 1)");

      System.out.println("\nSUCCESS: client configuration lifecycle completed.");
    } catch (Exception ex) {
      System.err.println("\nFAILED: harness encountered an error.");
      ex.printStackTrace(System.err);
      System.exit(1);
    }
  }

  private static void printState(ClientConfigEndpoint endpoint) throws IOException {
    Map<String, String> current = endpoint.handle(ConfigOperation.READ, Map.of()).orElse(null);
    if (current == null) {
      System.out.println("State: not configured");
      return;
    }
    System.out.println("State: configured, access_key set=" + !current.get("access_key").isEmpty()
        + ", secret_key set=" + !current.get("secret_key").isEmpty()
        + ", endpoint='" + current.get("endpoint") + "'");
  }

  private static Path parseConfigPath(String[] args) {
    if (args == null || args.length == 0) {
      return DEFAULT_CONFIG_PATH;
    }

    if (args.length == 2 && "--config".equals(args[0])) {
      return Path.of(args[1]);
    }

    throw new IllegalArgumentException("Usage: Main [--config <path-to-config.json>]");
  }

  private static HarnessConfig loadConfig(Path path) throws IOException {
    Objects.requireNonNull(path, "path");

    if (!Files.exists(path)) {
      String message = "Config file not found: " + path.toAbsolutePath()
          + System.lineSeparator()
          + "Create it by copying the template:"
          + System.lineSeparator()
          + "  cp " + TEMPLATE_CONFIG_PATH + " " + path
          + System.lineSeparator()
          + "Or run with: --config <path-to-config.json>";
      throw new IllegalStateException(message);
    }

    ObjectMapper mapper = new ObjectMapper();
    HarnessConfig config = mapper.readValue(Files.readString(path), HarnessConfig.class);
    if (config.client == null || config.client.accessKey == null || config.client.secretKey == null) {
      throw new IllegalStateException("Config must define client.accessKey and client.secretKey");
    }
    return config;
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }

  static final class DemoClient implements AutoCloseable {
    private final String region;
    private final String endpoint;
    private final boolean configuredCredentials;

    DemoClient(String region, ClientConfig config) {
      this.region = region;
      this.endpoint = config.hasCustomEndpoint()
          ? config.endpoint()
          : String.format(DEFAULT_ENDPOINT_TEMPLATE, region);
      this.configuredCredentials = !config.accessKey().isEmpty();
    }

    @Override
    public void close() {
      LOGGER.info("Closing demo client for {}", region);
    }

    @Override
    public String toString() {
      return "DemoClient{region=" + region + ", endpoint=" + endpoint
          + ", credentials=" + (configuredCredentials ? "configured" : "ambient") + "}";
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  private static final class HarnessConfig {
    public ClientSection client;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  private static final class ClientSection {
    public String accessKey;
    public String secretKey;
    public String endpoint;
    public String region;
  }
}
