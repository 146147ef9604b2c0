package io.ledgerbridge;

import jakarta.annotation.Nullable;
import org.springframework.http.HttpStatus;

public class LedgerBridgeException extends RuntimeException {
  private final HttpStatus statusCode;

  public LedgerBridgeException(String message) {
    this(message, null, HttpStatus.INTERNAL_SERVER_ERROR);
  }

  public LedgerBridgeException(String message, Throwable cause) {
    this(message, cause, HttpStatus.INTERNAL_SERVER_ERROR);
  }

  public LedgerBridgeException(Throwable cause) {
    this(cause.getMessage(), cause, HttpStatus.INTERNAL_SERVER_ERROR);
  }

  public LedgerBridgeException(String message, @Nullable HttpStatus statusCode) {
    this(message, null, statusCode);
  }

  public LedgerBridgeException(
      String message, @Nullable Throwable cause, @Nullable HttpStatus statusCode) {
    super(message, cause);
    this.statusCode = statusCode == null ? HttpStatus.INTERNAL_SERVER_ERROR : statusCode;
  }

  public HttpStatus getStatusCode() {
    return statusCode;
  }
}
