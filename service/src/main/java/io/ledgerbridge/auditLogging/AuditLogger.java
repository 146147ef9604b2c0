package io.ledgerbridge.auditLogging;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Credential lifecycle events all go through this one logger so they can be routed separately from
 * request logs. Events never carry token values.
 */
@Component
@Slf4j
public record AuditLogger(ObjectMapper mapper) {

  public void logEvent(AuditLogEvent event) {
    log.info("{} {}", event.getAuditLogEventType(), mapper.valueToTree(event));
  }
}
