package io.ledgerbridge.config;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.immutables.value.Value;

@Value.Modifiable
@PropertiesInterfaceStyle
public interface LedgerBridgeConfigInterface {
  String DEFAULT_AUTHORIZATION_ENDPOINT = "https://secure.myob.com/oauth2/account/authorize";
  String DEFAULT_TOKEN_ENDPOINT = "https://secure.myob.com/oauth2/v1/authorize";
  String DEFAULT_API_BASE_URL = "https://api.myob.com/accountright";
  String DEFAULT_REDIRECT_URI = "http://localhost:33333/callback";
  Duration DEFAULT_TOKEN_LIFETIME = Duration.ofSeconds(1200);

  List<String> DEFAULT_SCOPES =
      List.of(
          "sme-company-file",
          "sme-general-ledger",
          "sme-sales",
          "sme-purchases",
          "sme-banking",
          "sme-contacts-customer",
          "sme-contacts-supplier");

  String getClientId();

  String getClientSecret();

  /** Where the credential record is persisted. */
  String getTokenPath();

  /** Scopes requested at authorization time; empty means {@link #DEFAULT_SCOPES}. */
  List<String> getScopes();

  default Set<String> getRequestedScopes() {
    return new LinkedHashSet<>(getScopes().isEmpty() ? DEFAULT_SCOPES : getScopes());
  }

  @Value.Default
  default String getRedirectUri() {
    return DEFAULT_REDIRECT_URI;
  }

  /** Company file used when neither the caller nor the credential supplies one. */
  @Value.Default
  default String getDefaultCompanyFileId() {
    return "";
  }

  @Value.Default
  default String getAuthorizationEndpoint() {
    return DEFAULT_AUTHORIZATION_ENDPOINT;
  }

  @Value.Default
  default String getTokenEndpoint() {
    return DEFAULT_TOKEN_ENDPOINT;
  }

  @Value.Default
  default String getApiBaseUrl() {
    return DEFAULT_API_BASE_URL;
  }

  @Value.Default
  default String getApiVersion() {
    return "v2";
  }

  /** Access tokens this close to expiry are refreshed before use. */
  @Value.Default
  default Duration getAccessTokenExpirationBuffer() {
    return Duration.ofSeconds(60);
  }

  /** Lifetime assumed for access tokens whose response carries no usable expires_in. */
  @Value.Default
  default Duration getDefaultTokenLifetime() {
    return DEFAULT_TOKEN_LIFETIME;
  }

  @Value.Default
  default Duration getPendingAuthorizationTimeout() {
    return Duration.ofSeconds(120);
  }

  @Value.Default
  default Duration getConnectTimeout() {
    return Duration.ofSeconds(10);
  }

  @Value.Default
  default Duration getRequestTimeout() {
    return Duration.ofSeconds(30);
  }

  /** Total attempts per request, the first one included. */
  @Value.Default
  default int getRetryMaxAttempts() {
    return 4;
  }

  @Value.Default
  default Duration getRetryInitialBackoff() {
    return Duration.ofMillis(500);
  }

  @Value.Default
  default Duration getRetryMaxBackoff() {
    return Duration.ofSeconds(30);
  }

  /** Upper bound on a server supplied Retry-After. */
  @Value.Default
  default Duration getRetryAfterCap() {
    return Duration.ofSeconds(60);
  }

  @Value.Default
  default Duration getCachePurgeInterval() {
    return Duration.ofMinutes(1);
  }

  @Value.Default
  default int getPageSize() {
    return 400;
  }

  @Value.Default
  default int getMaxPagedItems() {
    return 1000;
  }
}
