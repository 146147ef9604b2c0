package io.ledgerbridge.models;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import org.immutables.value.Value;

/** An authorization flow waiting for its redirect. At most one exists at a time. */
@Value.Immutable
public interface PendingAuthorization {
  @Value.Redacted
  String getState();

  Instant getIssuedAt();

  /** Completed with the resulting status once the redirect is handled, or exceptionally. */
  @Value.Auxiliary
  @Value.Default
  default CompletableFuture<TokenStatus> getCompletion() {
    return new CompletableFuture<>();
  }

  default boolean isExpired(Instant now, Duration timeout) {
    return !now.isBefore(getIssuedAt().plus(timeout));
  }

  class Builder extends ImmutablePendingAuthorization.Builder {}
}
