package io.ledgerbridge.exception;

import io.ledgerbridge.LedgerBridgeException;
import org.springframework.http.HttpStatus;

/** No usable credential, a rejected authorization callback, or a token endpoint failure. */
public class AuthException extends LedgerBridgeException {

  public AuthException(String message) {
    super(message, HttpStatus.UNAUTHORIZED);
  }

  public AuthException(String message, Throwable cause) {
    super(message, cause, HttpStatus.UNAUTHORIZED);
  }
}
