package io.ledgerbridge.models;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.time.Instant;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableAuthorizationStart.class)
public interface AuthorizationStart {
  String getAuthorizationUrl();

  /** Already embedded in the url, exposed so a caller can correlate the redirect. */
  String getState();

  Instant getExpiresAt();

  class Builder extends ImmutableAuthorizationStart.Builder {}
}
