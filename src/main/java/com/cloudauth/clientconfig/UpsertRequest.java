package com.cloudauth.clientconfig;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A create-or-update request for the client configuration.
 * <p>
 * Each field is either explicitly provided (possibly as the empty string) or not provided at all.
 * The {@link Intent} is the caller's guess at whether a record exists; {@link ClientConfigManager}
 * does not rely on it.
 */
public final class UpsertRequest {
  public enum Intent {
    CREATE,
    UPDATE
  }

  private final Intent intent;
  private final Map<ClientConfigField, String> provided;

  private UpsertRequest(Intent intent, Map<ClientConfigField, String> provided) {
    this.intent = intent;
    this.provided = provided;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Intent intent() {
    return intent;
  }

  public Optional<String> value(ClientConfigField field) {
    Objects.requireNonNull(field, "field");
    return Optional.ofNullable(provided.get(field));
  }

  public boolean isProvided(ClientConfigField field) {
    return provided.containsKey(field);
  }

  @Override
  public String toString() {
    return "UpsertRequest{intent=" + intent + ", provided=" + provided.keySet() + "}";
  }

  public static final class Builder {
    private Intent intent = Intent.UPDATE;
    private final EnumMap<ClientConfigField, String> provided = new EnumMap<>(ClientConfigField.class);

    private Builder() {
    }

    public Builder intent(Intent intent) {
      this.intent = Objects.requireNonNull(intent, "intent");
      return this;
    }

    public Builder set(ClientConfigField field, String value) {
      provided.put(Objects.requireNonNull(field, "field"), Objects.requireNonNull(value, field.wireName()));
      return this;
    }

    public Builder accessKey(String accessKey) {
      return set(ClientConfigField.ACCESS_KEY, accessKey);
    }

    public Builder secretKey(String secretKey) {
      return set(ClientConfigField.SECRET_KEY, secretKey);
    }

    public Builder endpoint(String endpoint) {
      return set(ClientConfigField.ENDPOINT, endpoint);
    }

    public UpsertRequest build() {
      return new UpsertRequest(intent, Collections.unmodifiableMap(new EnumMap<>(provided)));
    }
  }
}
