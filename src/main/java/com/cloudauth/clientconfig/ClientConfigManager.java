package com.cloudauth.clientconfig;

import java.io.IOException;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the single stored client configuration record for one backend instance.
 * <p>
 * Concurrency model:
 * <ul>
 *   <li>Reads take the shared lock and may run in parallel.</li>
 *   <li>Upsert and delete take the exclusive lock for the whole load-modify-persist sequence.</li>
 *   <li>The client cache is flushed only after the write is durable and the exclusive lock has been
 *   released, so a rebuilt client always sees the new record.</li>
 * </ul>
 * <p>
 * Credential values are not validated here. A caller may supply the access key and secret key in
 * separate calls; consumers validate the record when they build a client.
 */
public final class ClientConfigManager implements ClientConfigReader {
  private static final Logger DEFAULT_LOGGER = LoggerFactory.getLogger(ClientConfigManager.class);

  private final ConfigStorage storage;
  private final ClientCache clientCache;
  private final ClientConfigCodec codec;
  private final String storageKey;
  private final Logger logger;

  private final ReadWriteLock configLock = new ReentrantReadWriteLock();

  public ClientConfigManager(ConfigStorage storage, ClientCache clientCache) {
    this(storage, clientCache, new ClientConfigOptions(), new ClientConfigCodec(), DEFAULT_LOGGER);
  }

  public ClientConfigManager(ConfigStorage storage, ClientCache clientCache, ClientConfigOptions options) {
    this(storage, clientCache, options, new ClientConfigCodec(), DEFAULT_LOGGER);
  }

  public ClientConfigManager(
      ConfigStorage storage,
      ClientCache clientCache,
      ClientConfigOptions options,
      ClientConfigCodec codec,
      Logger logger) {
    this.storage = Objects.requireNonNull(storage, "storage");
    this.clientCache = Objects.requireNonNull(clientCache, "clientCache");
    this.storageKey = Objects.requireNonNull(options, "options").storageKey();
    this.codec = Objects.requireNonNull(codec, "codec");
    this.logger = Objects.requireNonNull(logger, "logger");
  }

  /**
   * Returns the stored configuration, or empty if the backend is not configured.
   */
  @Override
  public Optional<ClientConfig> read() throws IOException {
    configLock.readLock().lock();
    try {
      return loadLocked();
    } finally {
      configLock.readLock().unlock();
    }
  }

  public ConfigState state() throws IOException {
    return read().isPresent() ? ConfigState.CONFIGURED : ConfigState.UNCONFIGURED;
  }

  /**
   * Reports whether a record currently exists. Routing uses this to pick create or update
   * semantics for an incoming write; {@link #upsert(UpsertRequest)} re-derives it under its lock.
   */
  public boolean existenceCheck() throws IOException {
    return state() == ConfigState.CONFIGURED;
  }

  /**
   * Creates the record or merges the provided fields into it.
   * <p>
   * On creation, fields that are not provided take their default (the empty string). On update,
   * they keep their stored value. The record is rewritten even when nothing changed. The client
   * cache is flushed after the lock is released if the record was created or any provided value
   * differed from the stored one.
   */
  public UpsertResult upsert(UpsertRequest request) throws IOException {
    Objects.requireNonNull(request, "request");

    ConfigState previousState;
    ClientConfig updated;
    Set<ClientConfigField> changedFields = EnumSet.noneOf(ClientConfigField.class);

    configLock.writeLock().lock();
    try {
      Optional<ClientConfig> existing = loadLocked();
      previousState = existing.isPresent() ? ConfigState.CONFIGURED : ConfigState.UNCONFIGURED;
      if (request.intent() == UpsertRequest.Intent.CREATE && existing.isPresent()) {
        logger.debug("Create requested for {} but a record exists; applying update semantics.", storageKey);
      }

      EnumMap<ClientConfigField, String> values = existing.orElse(ClientConfig.empty()).toValues();
      for (ClientConfigField field : ClientConfigField.values()) {
        Optional<String> provided = request.value(field);
        if (provided.isPresent()) {
          if (!values.get(field).equals(provided.get())) {
            changedFields.add(field);
            values.put(field, provided.get());
          }
        } else if (previousState == ConfigState.UNCONFIGURED) {
          values.put(field, field.defaultValue());
        }
      }

      updated = ClientConfig.fromValues(values);
      storage.put(storageKey, codec.encode(updated));
    } finally {
      configLock.writeLock().unlock();
    }

    boolean flush = previousState == ConfigState.UNCONFIGURED || !changedFields.isEmpty();
    if (flush) {
      logger.info(
          "Client configuration {} at {}; changed fields {}. Flushing cached clients.",
          previousState == ConfigState.UNCONFIGURED ? "created" : "updated",
          storageKey,
          wireNames(changedFields));
      clientCache.flush();
    } else {
      logger.debug("Client configuration at {} rewritten without changes.", storageKey);
    }

    return new UpsertResult(previousState, updated, changedFields, flush);
  }

  /**
   * Removes the record and flushes the client cache, whether or not a record existed.
   */
  public void delete() throws IOException {
    configLock.writeLock().lock();
    try {
      storage.delete(storageKey);
    } finally {
      configLock.writeLock().unlock();
    }

    logger.info("Client configuration at {} deleted. Flushing cached clients.", storageKey);
    clientCache.flush();
  }

  // Caller must hold configLock in either mode.
  private Optional<ClientConfig> loadLocked() throws IOException {
    Optional<byte[]> bytes = storage.get(storageKey);
    if (bytes.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(codec.decode(storageKey, bytes.get()));
  }

  private static Set<String> wireNames(Set<ClientConfigField> fields) {
    Set<String> names = new LinkedHashSet<>();
    for (ClientConfigField field : fields) {
      names.add(field.wireName());
    }
    return names;
  }
}
