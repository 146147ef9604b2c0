package io.ledgerbridge.controllers;

import io.ledgerbridge.LedgerBridgeException;
import io.ledgerbridge.services.TokenManagerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.HtmlUtils;

/**
 * Receives the browser redirect at the end of an authorization. Answers with a small page the user
 * sees in the browser; the outcome itself reaches callers through the token manager.
 */
@RestController
@Slf4j
public record OAuthCallbackController(TokenManagerService tokenManagerService) {

  @GetMapping(value = "/callback", produces = MediaType.TEXT_HTML_VALUE)
  public ResponseEntity<String> callback(
      @RequestParam(required = false) String code,
      @RequestParam(required = false) String state,
      @RequestParam(required = false) String businessId,
      @RequestParam(required = false) String error,
      @RequestParam(name = "error_description", required = false) String errorDescription) {
    try {
      if (error != null) {
        var failure =
            tokenManagerService.abandonAuthorization(
                state, errorDescription == null ? error : error + ": " + errorDescription);
        return page(HttpStatus.BAD_REQUEST, "Authorization failed", failure.getMessage());
      }
      if (code == null) {
        return page(
            HttpStatus.BAD_REQUEST,
            "Authorization failed",
            "The redirect carried neither an authorization code nor an error.");
      }
      tokenManagerService.authorizeComplete(code, state, businessId);
      return page(
          HttpStatus.OK,
          "Authorization successful",
          "You can close this window and return to the application.");
    } catch (LedgerBridgeException e) {
      log.warn("Authorization callback rejected: {}", e.getMessage());
      return page(e.getStatusCode(), "Authorization failed", e.getMessage());
    }
  }

  private static ResponseEntity<String> page(HttpStatus status, String title, String message) {
    var html =
        "<!DOCTYPE html><html><head><title>%s</title></head><body><h1>%s</h1><p>%s</p></body></html>"
            .formatted(title, title, HtmlUtils.htmlEscape(message));
    return ResponseEntity.status(status).contentType(MediaType.TEXT_HTML).body(html);
  }
}
