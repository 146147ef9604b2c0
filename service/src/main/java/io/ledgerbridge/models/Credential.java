package io.ledgerbridge.models;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import org.immutables.value.Value;

/** The single active OAuth credential. Always replaced as a whole, never edited in place. */
@Value.Immutable
@JsonSerialize(as = ImmutableCredential.class)
@JsonDeserialize(as = ImmutableCredential.class)
public interface Credential extends WithCredential {
  @Value.Redacted
  @JsonProperty("access_token")
  String getAccessToken();

  @Value.Redacted
  @JsonProperty("refresh_token")
  String getRefreshToken();

  @JsonProperty("expires_at")
  @JsonFormat(shape = JsonFormat.Shape.NUMBER)
  Instant getExpiresAt();

  /** Company file GUID captured from the authorization redirect. */
  @JsonProperty("business_id")
  Optional<String> getBusinessId();

  @JsonProperty("scopes")
  Set<String> getScopes();

  /** True when the access token expires within {@code buffer} of {@code now}. */
  default boolean expiresWithin(Instant now, Duration buffer) {
    return !now.plus(buffer).isBefore(getExpiresAt());
  }

  class Builder extends ImmutableCredential.Builder {}
}
