package io.ledgerbridge.services;

import io.ledgerbridge.config.LedgerBridgeConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.client.registration.ClientRegistration;
import org.springframework.security.oauth2.core.AuthorizationGrantType;
import org.springframework.security.oauth2.core.ClientAuthenticationMethod;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * The OAuth client registration for the accounting backend. Its endpoints are fixed by
 * configuration, so the registration is built once and reused.
 */
@Component
@Slf4j
public class ProviderClientService {
  public static final String REGISTRATION_ID = "myob";

  private final LedgerBridgeConfig config;
  private volatile ClientRegistration providerClient;

  public ProviderClientService(LedgerBridgeConfig config) {
    if (!StringUtils.hasText(config.getClientId())
        || !StringUtils.hasText(config.getClientSecret())) {
      throw new IllegalStateException(
          "ledgerbridge.client-id and ledgerbridge.client-secret must be set"
              + " (MYOB_CLIENT_ID and MYOB_CLIENT_SECRET)");
    }
    this.config = config;
  }

  public ClientRegistration getProviderClient() {
    var client = providerClient;
    if (client == null) {
      log.info("Building OAuth client registration for {}", config.getTokenEndpoint());
      client =
          ClientRegistration.withRegistrationId(REGISTRATION_ID)
              .clientId(config.getClientId())
              .clientSecret(config.getClientSecret())
              .clientAuthenticationMethod(ClientAuthenticationMethod.CLIENT_SECRET_POST)
              .authorizationGrantType(AuthorizationGrantType.AUTHORIZATION_CODE)
              .redirectUri(config.getRedirectUri())
              .authorizationUri(config.getAuthorizationEndpoint())
              .tokenUri(config.getTokenEndpoint())
              .scope(config.getRequestedScopes())
              .build();
      providerClient = client;
    }
    return client;
  }
}
