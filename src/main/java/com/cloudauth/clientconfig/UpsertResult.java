package com.cloudauth.clientconfig;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Outcome of {@link ClientConfigManager#upsert(UpsertRequest)}.
 */
public final class UpsertResult {
  private final ConfigState previousState;
  private final ClientConfig config;
  private final Set<ClientConfigField> changedFields;
  private final boolean flushed;

  UpsertResult(
      ConfigState previousState,
      ClientConfig config,
      Set<ClientConfigField> changedFields,
      boolean flushed) {
    this.previousState = Objects.requireNonNull(previousState, "previousState");
    this.config = Objects.requireNonNull(config, "config");
    this.changedFields = changedFields.isEmpty()
        ? Collections.emptySet()
        : Collections.unmodifiableSet(EnumSet.copyOf(changedFields));
    this.flushed = flushed;
  }

  public ConfigState previousState() {
    return previousState;
  }

  public boolean created() {
    return previousState == ConfigState.UNCONFIGURED;
  }

  /**
   * The record as persisted by this call.
   */
  public ClientConfig config() {
    return config;
  }

  /**
   * Fields whose explicitly provided value differed from the value stored before this call.
   */
  public Set<ClientConfigField> changedFields() {
    return changedFields;
  }

  /**
   * Whether the client cache was flushed: always on creation, otherwise only when a field changed.
   */
  public boolean flushed() {
    return flushed;
  }
}
