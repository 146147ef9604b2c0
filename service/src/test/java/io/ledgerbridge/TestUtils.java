package io.ledgerbridge;

import io.ledgerbridge.config.LedgerBridgeConfig;
import io.ledgerbridge.models.Credential;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Set;
import java.util.UUID;

public class TestUtils {
  public static final String COMPANY_FILE_ID = "a1b2c3d4-e5f6-4789-abcd-0123456789ab";

  public static LedgerBridgeConfig createTestConfig() {
    return LedgerBridgeConfig.create()
        .setClientId("test-client-id")
        .setClientSecret("test-client-secret")
        .setTokenPath("unused")
        .setDefaultCompanyFileId(COMPANY_FILE_ID)
        .setRetryInitialBackoff(Duration.ofMillis(500))
        .setRetryMaxBackoff(Duration.ofSeconds(30));
  }

  public static LedgerBridgeConfig createTestConfig(String mockServerUrl) {
    return createTestConfig()
        .setApiBaseUrl(mockServerUrl + "/accountright")
        .setTokenEndpoint(mockServerUrl + "/oauth2/v1/authorize")
        .setAuthorizationEndpoint(mockServerUrl + "/oauth2/account/authorize");
  }

  public static Credential createCredential(Instant expiresAt) {
    return new Credential.Builder()
        .accessToken(UUID.randomUUID().toString())
        .refreshToken(UUID.randomUUID().toString())
        .expiresAt(expiresAt)
        .businessId(COMPANY_FILE_ID)
        .scopes(Set.of("sme-company-file"))
        .build();
  }

  public static String tokenResponseJson(String accessToken, String refreshToken, long expiresIn) {
    var refresh = refreshToken == null ? "" : ",\"refresh_token\":\"" + refreshToken + "\"";
    return "{\"access_token\":\"%s\",\"token_type\":\"bearer\",\"expires_in\":%d%s}"
        .formatted(accessToken, expiresIn, refresh);
  }

  /** A clock tests can move forward. */
  public static class MutableClock extends Clock {
    private volatile Instant now;

    public MutableClock(Instant now) {
      this.now = now;
    }

    public void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
