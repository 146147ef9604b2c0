package io.ledgerbridge.services;

import io.ledgerbridge.LedgerBridgeException;
import io.ledgerbridge.auditLogging.AuditLogEvent;
import io.ledgerbridge.auditLogging.AuditLogEventType;
import io.ledgerbridge.auditLogging.AuditLogger;
import io.ledgerbridge.config.LedgerBridgeConfig;
import io.ledgerbridge.dataAccess.CredentialFileDAO;
import io.ledgerbridge.exception.AuthException;
import io.ledgerbridge.models.AuthorizationStart;
import io.ledgerbridge.models.Credential;
import io.ledgerbridge.models.PendingAuthorization;
import io.ledgerbridge.models.TokenStatus;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.core.OAuth2AuthorizationException;
import org.springframework.security.oauth2.core.OAuth2RefreshToken;
import org.springframework.security.oauth2.core.endpoint.OAuth2AccessTokenResponse;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

/**
 * Owns the one active {@link Credential}. Nothing else reads or writes it; callers get an access
 * token through {@link #getValidAccessToken()} and everything else through {@link #getStatus()}.
 *
 * <p>Refreshes are serialized by a single lock. A caller that waited on the lock re-checks the
 * credential once it holds it, so N callers inside the expiry buffer cause one refresh.
 */
@Service
@Slf4j
public class TokenManagerService {
  private static final int STATE_BYTES = 32;

  private final LedgerBridgeConfig config;
  private final CredentialFileDAO credentialFileDAO;
  private final OAuth2Service oAuth2Service;
  private final ProviderClientService providerClientService;
  private final BrowserLauncher browserLauncher;
  private final AuditLogger auditLogger;
  private final Clock clock;
  private final SecureRandom secureRandom;

  private final ReentrantLock refreshLock = new ReentrantLock();
  private final Object pendingLock = new Object();

  private volatile Credential credential;

  // guarded by pendingLock
  private PendingAuthorization pendingAuthorization;
  private PendingAuthorization latestAuthorization;

  public TokenManagerService(
      LedgerBridgeConfig config,
      CredentialFileDAO credentialFileDAO,
      OAuth2Service oAuth2Service,
      ProviderClientService providerClientService,
      BrowserLauncher browserLauncher,
      AuditLogger auditLogger,
      Clock clock,
      SecureRandom secureRandom) {
    this.config = config;
    this.credentialFileDAO = credentialFileDAO;
    this.oAuth2Service = oAuth2Service;
    this.providerClientService = providerClientService;
    this.browserLauncher = browserLauncher;
    this.auditLogger = auditLogger;
    this.clock = clock;
    this.secureRandom = secureRandom;
    this.credential = credentialFileDAO.load().orElse(null);
    if (credential != null) {
      log.info("Loaded credential expiring at {}", credential.getExpiresAt());
    }
  }

  /**
   * Starts an authorization flow. Fails if another flow is pending and has not timed out; a timed
   * out flow is abandoned and replaced.
   */
  public AuthorizationStart authorizeBegin(boolean openBrowser) {
    AuthorizationStart start;
    synchronized (pendingLock) {
      var now = clock.instant();
      if (pendingAuthorization != null) {
        if (!pendingAuthorization.isExpired(now, config.getPendingAuthorizationTimeout())) {
          throw new AuthException(
              "An authorization is already pending until "
                  + pendingAuthorization
                      .getIssuedAt()
                      .plus(config.getPendingAuthorizationTimeout()));
        }
        pendingAuthorization
            .getCompletion()
            .completeExceptionally(new AuthException("Authorization timed out"));
      }

      var state = newState();
      var authorizationUrl =
          oAuth2Service.getAuthorizationRequestUri(
              providerClientService.getProviderClient(),
              config.getRedirectUri(),
              config.getRequestedScopes(),
              state,
              Map.of("prompt", "consent"));

      pendingAuthorization = new PendingAuthorization.Builder().state(state).issuedAt(now).build();
      latestAuthorization = pendingAuthorization;
      start =
          new AuthorizationStart.Builder()
              .authorizationUrl(authorizationUrl)
              .state(state)
              .expiresAt(now.plus(config.getPendingAuthorizationTimeout()))
              .build();
    }

    auditLogger.logEvent(
        new AuditLogEvent.Builder()
            .auditLogEventType(AuditLogEventType.AuthorizationStarted)
            .expiresAt(start.getExpiresAt())
            .build());
    if (openBrowser) {
      browserLauncher.open(start.getAuthorizationUrl());
    }
    return start;
  }

  /**
   * Handles a successful redirect. The pending authorization is consumed whether or not the state
   * matches; a mismatch never touches the current credential.
   */
  public TokenStatus authorizeComplete(String code, String state, String businessId) {
    var pending = takePendingAuthorization();
    try {
      requireMatchingState(pending, state);
      OAuth2AccessTokenResponse tokenResponse;
      try {
        tokenResponse =
            oAuth2Service.authorizationCodeExchange(
                providerClientService.getProviderClient(),
                code,
                config.getRedirectUri(),
                config.getRequestedScopes(),
                pending.getState());
      } catch (OAuth2AuthorizationException | RestClientException e) {
        throw new AuthException("Authorization code exchange failed: " + describe(e), e);
      }

      refreshLock.lock();
      try {
        storeCredential(
            toCredential(tokenResponse, Optional.ofNullable(businessId).filter(s -> !s.isBlank())));
      } finally {
        refreshLock.unlock();
      }
    } catch (LedgerBridgeException e) {
      pending.getCompletion().completeExceptionally(e);
      auditFailure(AuditLogEventType.AuthorizationFailed, e);
      throw e;
    }

    var status = getStatus();
    pending.getCompletion().complete(status);
    auditLogger.logEvent(
        new AuditLogEvent.Builder()
            .auditLogEventType(AuditLogEventType.AuthorizationCompleted)
            .businessId(status.getBusinessId())
            .expiresAt(status.getExpiresAt())
            .build());
    return status;
  }

  /**
   * Handles an error redirect: the user denied access or the backend refused the request. Whoever
   * waits on the flow sees the failure.
   *
   * @return the failure the flow was completed with
   */
  public AuthException abandonAuthorization(String state, String reason) {
    var pending = takePendingAuthorization();
    AuthException failure;
    try {
      requireMatchingState(pending, state);
      failure = new AuthException("Authorization was not granted: " + reason);
    } catch (AuthException e) {
      failure = e;
    }
    pending.getCompletion().completeExceptionally(failure);
    auditLogger.logEvent(
        new AuditLogEvent.Builder()
            .auditLogEventType(AuditLogEventType.AuthorizationAbandoned)
            .reason(failure.getMessage())
            .build());
    return failure;
  }

  /** Blocks until the most recently started flow completes, fails or times out. */
  public TokenStatus awaitAuthorization(Duration timeout) {
    PendingAuthorization awaited;
    synchronized (pendingLock) {
      awaited = latestAuthorization;
    }
    if (awaited == null) {
      throw new AuthException("No authorization has been started");
    }

    try {
      return awaited.getCompletion().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      synchronized (pendingLock) {
        if (pendingAuthorization == awaited) {
          pendingAuthorization = null;
        }
      }
      var failure = new AuthException("Timed out waiting for authorization after " + timeout, e);
      awaited.getCompletion().completeExceptionally(failure);
      throw failure;
    } catch (ExecutionException e) {
      throw new AuthException(e.getCause().getMessage(), e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AuthException("Interrupted while waiting for authorization", e);
    }
  }

  /**
   * @return an access token that does not expire within the configured buffer, refreshing it first
   *     if needed
   * @throws AuthException if not authorized or the refresh fails
   */
  public String getValidAccessToken() {
    var current = requireCredential();
    if (!isExpiring(current)) {
      return current.getAccessToken();
    }
    return refreshUnderLock(fresh -> !isExpiring(fresh)).getAccessToken();
  }

  /** Refreshes regardless of expiry. */
  public TokenStatus refreshNow() {
    refreshUnderLock(fresh -> false);
    return getStatus();
  }

  /**
   * Refreshes after the backend rejected {@code rejectedAccessToken}, unless another caller has
   * already replaced it.
   *
   * @return the access token to retry with
   */
  public String refreshIfCurrent(String rejectedAccessToken) {
    return refreshUnderLock(
            fresh -> !fresh.getAccessToken().equals(rejectedAccessToken) && !isExpiring(fresh))
        .getAccessToken();
  }

  public TokenStatus getStatus() {
    var current = credential;
    if (current == null) {
      return new TokenStatus.Builder()
          .isAuthenticated(false)
          .isHasRefreshToken(false)
          .message("Not authorized, start an authorization first")
          .build();
    }

    var now = clock.instant();
    var expiresIn = Math.max(0, Duration.between(now, current.getExpiresAt()).getSeconds());
    var builder =
        new TokenStatus.Builder()
            .isAuthenticated(true)
            .expiresAt(current.getExpiresAt())
            .expiresInSeconds(expiresIn)
            .isHasRefreshToken(!current.getRefreshToken().isEmpty())
            .businessId(current.getBusinessId());
    if (!now.isBefore(current.getExpiresAt())) {
      builder.message("Access token expired, it is refreshed on next use");
    }
    return builder.build();
  }

  public Optional<String> getBusinessId() {
    return Optional.ofNullable(credential).flatMap(Credential::getBusinessId);
  }

  private Credential refreshUnderLock(Predicate<Credential> alreadyFresh) {
    try {
      refreshLock.lockInterruptibly();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AuthException("Interrupted while waiting for token refresh", e);
    }
    try {
      var current = requireCredential();
      if (alreadyFresh.test(current)) {
        log.debug("Credential was refreshed while waiting for the refresh lock");
        return current;
      }
      return refresh(current);
    } finally {
      refreshLock.unlock();
    }
  }

  private Credential refresh(Credential current) {
    log.info("Refreshing access token expiring at {}", current.getExpiresAt());
    OAuth2AccessTokenResponse tokenResponse;
    try {
      tokenResponse =
          oAuth2Service.authorizeWithRefreshToken(
              providerClientService.getProviderClient(),
              new OAuth2RefreshToken(current.getRefreshToken(), null));
    } catch (OAuth2AuthorizationException | RestClientException e) {
      var failure = new AuthException("Token refresh failed: " + describe(e), e);
      auditFailure(AuditLogEventType.TokenRefreshFailed, failure);
      throw failure;
    }

    var refreshed = toCredential(tokenResponse, current);
    storeCredential(refreshed);
    auditLogger.logEvent(
        new AuditLogEvent.Builder()
            .auditLogEventType(AuditLogEventType.TokenRefreshed)
            .businessId(refreshed.getBusinessId())
            .expiresAt(refreshed.getExpiresAt())
            .build());
    return refreshed;
  }

  private Credential toCredential(
      OAuth2AccessTokenResponse tokenResponse, Optional<String> businessId) {
    var refreshToken = tokenResponse.getRefreshToken();
    if (refreshToken == null) {
      throw new AuthException("Token response did not include a refresh token");
    }
    return new Credential.Builder()
        .accessToken(tokenResponse.getAccessToken().getTokenValue())
        .refreshToken(refreshToken.getTokenValue())
        .expiresAt(expiresAt(tokenResponse))
        .businessId(businessId)
        .scopes(
            tokenResponse.getAccessToken().getScopes().isEmpty()
                ? config.getRequestedScopes()
                : tokenResponse.getAccessToken().getScopes())
        .build();
  }

  private Credential toCredential(OAuth2AccessTokenResponse tokenResponse, Credential previous) {
    var builder =
        new Credential.Builder()
            .from(previous)
            .accessToken(tokenResponse.getAccessToken().getTokenValue())
            .expiresAt(expiresAt(tokenResponse));
    // a refresh response may omit the refresh token, the old one stays valid then
    if (tokenResponse.getRefreshToken() != null) {
      builder.refreshToken(tokenResponse.getRefreshToken().getTokenValue());
    }
    if (!tokenResponse.getAccessToken().getScopes().isEmpty()) {
      builder.scopes(tokenResponse.getAccessToken().getScopes());
    }
    return builder.build();
  }

  // the token client stamps issue time with the system clock, only the lifetime is taken from it
  private Instant expiresAt(OAuth2AccessTokenResponse tokenResponse) {
    var accessToken = tokenResponse.getAccessToken();
    if (accessToken.getIssuedAt() == null || accessToken.getExpiresAt() == null) {
      return clock.instant().plus(config.getDefaultTokenLifetime());
    }
    var lifetime = Duration.between(accessToken.getIssuedAt(), accessToken.getExpiresAt());
    // a missing expires_in comes back as a one second lifetime
    if (lifetime.compareTo(Duration.ofSeconds(1)) <= 0) {
      return clock.instant().plus(config.getDefaultTokenLifetime());
    }
    return clock.instant().plus(lifetime);
  }

  private void storeCredential(Credential newCredential) {
    credential = newCredential;
    credentialFileDAO.save(newCredential);
  }

  private Credential requireCredential() {
    var current = credential;
    if (current == null) {
      throw new AuthException("not authorized");
    }
    return current;
  }

  private boolean isExpiring(Credential current) {
    return current.expiresWithin(clock.instant(), config.getAccessTokenExpirationBuffer());
  }

  private PendingAuthorization takePendingAuthorization() {
    synchronized (pendingLock) {
      var pending = pendingAuthorization;
      pendingAuthorization = null;
      if (pending == null) {
        throw new AuthException("No authorization is pending");
      }
      if (pending.isExpired(clock.instant(), config.getPendingAuthorizationTimeout())) {
        var failure = new AuthException("Authorization timed out");
        pending.getCompletion().completeExceptionally(failure);
        throw failure;
      }
      return pending;
    }
  }

  private static void requireMatchingState(PendingAuthorization pending, String receivedState) {
    if (receivedState == null
        || !MessageDigest.isEqual(
            pending.getState().getBytes(StandardCharsets.UTF_8),
            receivedState.getBytes(StandardCharsets.UTF_8))) {
      throw new AuthException("state mismatch");
    }
  }

  private String newState() {
    var bytes = new byte[STATE_BYTES];
    secureRandom.nextBytes(bytes);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
  }

  private void auditFailure(AuditLogEventType type, Exception e) {
    auditLogger.logEvent(
        new AuditLogEvent.Builder().auditLogEventType(type).reason(e.getMessage()).build());
  }

  private static String describe(Exception e) {
    if (e instanceof OAuth2AuthorizationException oauthException) {
      var error = oauthException.getError();
      return error.getDescription() == null
          ? error.getErrorCode()
          : error.getErrorCode() + " - " + error.getDescription();
    }
    return e.getMessage();
  }
}
