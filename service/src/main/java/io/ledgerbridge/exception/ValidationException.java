package io.ledgerbridge.exception;

import io.ledgerbridge.LedgerBridgeException;
import org.springframework.http.HttpStatus;

/** Raised before any network call when local input fails validation. */
public class ValidationException extends LedgerBridgeException {

  public ValidationException(String message) {
    super(message, HttpStatus.BAD_REQUEST);
  }
}
