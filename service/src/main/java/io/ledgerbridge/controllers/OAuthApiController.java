package io.ledgerbridge.controllers;

import io.ledgerbridge.models.AuthorizationStart;
import io.ledgerbridge.models.TokenStatus;
import io.ledgerbridge.services.TokenManagerService;
import java.time.Duration;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/oauth")
public record OAuthApiController(TokenManagerService tokenManagerService) {

  @PostMapping("/authorize")
  public ResponseEntity<AuthorizationStart> authorize(
      @RequestParam(defaultValue = "true") boolean openBrowser) {
    return ResponseEntity.ok(tokenManagerService.authorizeBegin(openBrowser));
  }

  /** Waits for the redirect of the most recent authorization, at most {@code timeoutSeconds}. */
  @PostMapping("/authorize/wait")
  public ResponseEntity<TokenStatus> awaitAuthorization(
      @RequestParam(defaultValue = "120") long timeoutSeconds) {
    return ResponseEntity.ok(
        tokenManagerService.awaitAuthorization(Duration.ofSeconds(timeoutSeconds)));
  }

  @PostMapping("/refresh")
  public ResponseEntity<TokenStatus> refresh() {
    return ResponseEntity.ok(tokenManagerService.refreshNow());
  }

  @GetMapping("/status")
  public ResponseEntity<TokenStatus> getStatus() {
    return ResponseEntity.ok(tokenManagerService.getStatus());
  }
}
