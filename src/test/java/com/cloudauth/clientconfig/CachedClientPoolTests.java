package com.cloudauth.clientconfig;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CachedClientPoolTests {
  private final AtomicInteger builds = new AtomicInteger();
  private final ClientConfigBackend<FakeClient> backend = new ClientConfigBackend<>(
      new InMemoryConfigStorage(),
      (region, config) -> {
        builds.incrementAndGet();
        return new FakeClient(region, config);
      });

  private final ExecutorService executor = Executors.newCachedThreadPool();

  @AfterEach
  void shutdown() {
    executor.shutdownNow();
  }

  @Test
  void unconfigured_buildsClientWithEmptyConfig() throws Exception {
    FakeClient client = backend.client("us-east-1");

    assertEquals(ClientConfig.empty(), client.config);
    assertEquals(1, backend.clientPool().size());
  }

  @Test
  void get_cachesPerRegion() throws Exception {
    backend.configManager().upsert(UpsertRequest.builder().accessKey("A1").secretKey("S1").build());

    FakeClient east = backend.client("us-east-1");
    FakeClient eastAgain = backend.client("us-east-1");
    FakeClient west = backend.client("us-west-2");

    assertSame(east, eastAgain);
    assertNotSame(east, west);
    assertEquals("us-west-2", west.region);
    assertEquals(2, builds.get());
  }

  @Test
  void credentialChange_evictsClients_andRebuildUsesNewValues() throws Exception {
    backend.configManager().upsert(UpsertRequest.builder().accessKey("A1").secretKey("S1").build());
    FakeClient before = backend.client("us-east-1");

    backend.configManager().upsert(UpsertRequest.builder().accessKey("A2").secretKey("S2").build());

    assertTrue(before.closed);
    assertEquals(0, backend.clientPool().size());
    FakeClient after = backend.client("us-east-1");
    assertNotSame(before, after);
    assertEquals(new ClientConfig("A2", "S2", ""), after.config);
  }

  @Test
  void unchangedRewrite_keepsCachedClient() throws Exception {
    UpsertRequest request = UpsertRequest.builder().accessKey("A1").secretKey("S1").build();
    backend.configManager().upsert(request);
    FakeClient before = backend.client("us-east-1");

    backend.configManager().upsert(request);

    assertSame(before, backend.client("us-east-1"));
    assertFalse(before.closed);
  }

  @Test
  void delete_evictsClients() throws Exception {
    backend.configManager().upsert(UpsertRequest.builder().accessKey("A1").secretKey("S1").build());
    FakeClient before = backend.client("us-east-1");

    backend.configManager().delete();

    assertTrue(before.closed);
    assertEquals(ClientConfig.empty(), backend.client("us-east-1").config);
  }

  @Test
  void partialCredentials_areRejectedWhenClientIsBuilt() throws Exception {
    backend.configManager().upsert(UpsertRequest.builder().accessKey("A1").build());

    assertThrows(IllegalStateException.class, () -> backend.client("us-east-1"));
    assertEquals(0, builds.get());

    backend.configManager().upsert(UpsertRequest.builder().secretKey("S1").build());
    assertEquals("A1", backend.client("us-east-1").config.accessKey());
  }

  @Test
  void get_rejectsBlankRegion() {
    assertThrows(IllegalArgumentException.class, () -> backend.client(" "));
  }

  @Test
  void flush_continuesWhenCloseFails() throws Exception {
    CachedClientPool<AutoCloseable> pool = new CachedClientPool<>(
        () -> Optional.empty(),
        (region, config) -> () -> {
          throw new IOException("close failed for " + region);
        });
    pool.get("us-east-1");
    pool.get("us-west-2");

    pool.flush();

    assertEquals(0, pool.size());
  }

  @Test
  void flush_onEmptyPool_isNoop() {
    backend.clientPool().flush();
    backend.clientPool().flush();

    assertEquals(0, backend.clientPool().size());
  }

  @Test
  void concurrentMisses_buildOneClientPerRegion() throws Exception {
    CountDownLatch start = new CountDownLatch(1);
    List<CompletableFuture<FakeClient>> futures = new ArrayList<>();
    for (int i = 0; i < 20; i++) {
      futures.add(CompletableFuture.supplyAsync(() -> {
        try {
          start.await();
          return backend.client("us-east-1");
        } catch (IOException e) {
          throw new IllegalStateException(e);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException(e);
        }
      }, executor));
    }

    start.countDown();
    FakeClient first = futures.get(0).get(10, TimeUnit.SECONDS);
    for (CompletableFuture<FakeClient> future : futures) {
      assertSame(first, future.get(10, TimeUnit.SECONDS));
    }
    assertEquals(1, builds.get());
  }

  private static final class FakeClient implements AutoCloseable {
    private final String region;
    private final ClientConfig config;
    private volatile boolean closed;

    FakeClient(String region, ClientConfig config) {
      this.region = region;
      this.config = config;
    }

    @Override
    public void close() {
      closed = true;
    }
  }
}
