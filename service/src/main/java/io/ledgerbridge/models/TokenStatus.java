package io.ledgerbridge.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.time.Instant;
import java.util.Optional;
import org.immutables.value.Value;

/** What callers may know about the credential. Token values are deliberately absent. */
@Value.Immutable
@JsonSerialize(as = ImmutableTokenStatus.class)
public interface TokenStatus {
  boolean isAuthenticated();

  @JsonInclude(Include.NON_EMPTY)
  Optional<Instant> getExpiresAt();

  @JsonInclude(Include.NON_EMPTY)
  Optional<Long> getExpiresInSeconds();

  boolean isHasRefreshToken();

  @JsonInclude(Include.NON_EMPTY)
  Optional<String> getBusinessId();

  @JsonInclude(Include.NON_EMPTY)
  Optional<String> getMessage();

  class Builder extends ImmutableTokenStatus.Builder {}
}
