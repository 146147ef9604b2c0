package io.ledgerbridge.auditLogging;

public enum AuditLogEventType {
  AuthorizationStarted,
  AuthorizationCompleted,
  AuthorizationFailed,
  AuthorizationAbandoned,
  TokenRefreshed,
  TokenRefreshFailed,
}
