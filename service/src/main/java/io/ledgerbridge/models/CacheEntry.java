package io.ledgerbridge.models;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import org.immutables.value.Value;

@Value.Immutable
public interface CacheEntry {
  String getKey();

  @Value.Auxiliary
  JsonNode getValue();

  Instant getExpiresAt();

  default boolean isExpired(Instant now) {
    return !now.isBefore(getExpiresAt());
  }

  class Builder extends ImmutableCacheEntry.Builder {}
}
