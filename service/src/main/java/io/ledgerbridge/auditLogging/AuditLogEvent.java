package io.ledgerbridge.auditLogging;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.time.Instant;
import java.util.Optional;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableAuditLogEvent.class)
public interface AuditLogEvent extends WithAuditLogEvent {
  AuditLogEventType getAuditLogEventType();

  @JsonInclude(Include.NON_EMPTY)
  Optional<String> getBusinessId();

  @JsonInclude(Include.NON_EMPTY)
  Optional<Instant> getExpiresAt();

  @JsonInclude(Include.NON_EMPTY)
  Optional<String> getReason();

  class Builder extends ImmutableAuditLogEvent.Builder {}
}
