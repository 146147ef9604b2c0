package io.ledgerbridge.controllers;

import io.ledgerbridge.LedgerBridgeException;
import io.ledgerbridge.models.ErrorReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;

// Top-level exception handler for the REST controllers. Every exception that rises through a
// controller is converted into an ErrorReport response here.

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {
  // -- one of our exceptions, the message is safe to return --
  @ExceptionHandler(LedgerBridgeException.class)
  public ResponseEntity<ErrorReport> ledgerBridgeExceptionHandler(LedgerBridgeException ex) {
    if (ex.getStatusCode().is5xxServerError()) {
      log.error("Request failed", ex);
    } else {
      log.info("Request rejected: {}", ex.getMessage());
    }
    return buildErrorReport(ex.getMessage(), ex.getStatusCode());
  }

  // -- validation exceptions - we don't control the exception raised
  @ExceptionHandler({
    MethodArgumentNotValidException.class,
    MethodArgumentTypeMismatchException.class,
    MissingServletRequestParameterException.class,
    HttpMessageNotReadableException.class,
    IllegalArgumentException.class,
    NoHandlerFoundException.class
  })
  public ResponseEntity<ErrorReport> validationExceptionHandler(Exception ex) {
    log.info("Request could not be parsed", ex);
    // the invalid input itself is not echoed back
    var message =
        "Request could not be parsed or was invalid: "
            + ex.getClass().getSimpleName()
            + ". Ensure that all types are correct and that enums have valid values.";
    return buildErrorReport(message, HttpStatus.BAD_REQUEST);
  }

  // -- catchall - log so we can understand what we have missed in the handlers above
  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorReport> catchallHandler(Exception ex) {
    log.error("Exception caught by catchall handler", ex);
    return buildErrorReport(ex.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR);
  }

  private static ResponseEntity<ErrorReport> buildErrorReport(String message, HttpStatus status) {
    var errorReport =
        new ErrorReport.Builder()
            .message(message == null ? status.getReasonPhrase() : message)
            .statusCode(status.value())
            .build();
    return ResponseEntity.status(status).body(errorReport);
  }
}
