package io.ledgerbridge.services;

import java.time.Instant;
import java.util.Map;
import java.util.Set;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.security.oauth2.client.endpoint.DefaultAuthorizationCodeTokenResponseClient;
import org.springframework.security.oauth2.client.endpoint.DefaultRefreshTokenTokenResponseClient;
import org.springframework.security.oauth2.client.endpoint.OAuth2AuthorizationCodeGrantRequest;
import org.springframework.security.oauth2.client.endpoint.OAuth2RefreshTokenGrantRequest;
import org.springframework.security.oauth2.client.registration.ClientRegistration;
import org.springframework.security.oauth2.core.OAuth2AccessToken;
import org.springframework.security.oauth2.core.OAuth2RefreshToken;
import org.springframework.security.oauth2.core.endpoint.OAuth2AccessTokenResponse;
import org.springframework.security.oauth2.core.endpoint.OAuth2AuthorizationExchange;
import org.springframework.security.oauth2.core.endpoint.OAuth2AuthorizationRequest;
import org.springframework.security.oauth2.core.endpoint.OAuth2AuthorizationResponse;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestOperations;

/**
 * Service that encapsulates the OAuth2 exchanges with the accounting backend. General flow:
 *
 * <ol>
 *   <li>getAuthorizationRequestUri - visit to authenticate and pick a company file
 *   <li>authorizationCodeExchange - using code resulting from authentication, get access and
 *       refresh tokens
 *   <li>authorizeWithRefreshToken - get a new access token using a refresh token when required
 * </ol>
 *
 * Token endpoint failures surface as {@link
 * org.springframework.security.oauth2.core.OAuth2AuthorizationException}.
 */
@Service
public class OAuth2Service {
  private final DefaultAuthorizationCodeTokenResponseClient authorizationCodeClient;
  private final DefaultRefreshTokenTokenResponseClient refreshTokenClient;

  public OAuth2Service(@Qualifier("tokenRestOperations") RestOperations tokenRestOperations) {
    this.authorizationCodeClient = new DefaultAuthorizationCodeTokenResponseClient();
    this.authorizationCodeClient.setRestOperations(tokenRestOperations);
    this.refreshTokenClient = new DefaultRefreshTokenTokenResponseClient();
    this.refreshTokenClient.setRestOperations(tokenRestOperations);
  }

  /**
   * Construct authorization uri user should visit to authenticate
   *
   * @param providerClient client registration, see {@link ProviderClientService}
   * @param redirectUri uri the user will be directed to after authentication
   * @param scopes scopes requested for authentication
   * @param state random value the redirect has to echo back
   * @param additionalAuthorizationParameters any other parameters
   * @return uri to direct user to
   */
  public String getAuthorizationRequestUri(
      ClientRegistration providerClient,
      String redirectUri,
      Set<String> scopes,
      String state,
      Map<String, Object> additionalAuthorizationParameters) {

    return createOAuth2AuthorizationRequest(
            redirectUri, scopes, state, providerClient, additionalAuthorizationParameters)
        .getAuthorizationRequestUri();
  }

  private OAuth2AuthorizationRequest createOAuth2AuthorizationRequest(
      String redirectUri,
      Set<String> scopes,
      String state,
      ClientRegistration providerClient,
      Map<String, Object> additionalAuthorizationParameters) {

    return OAuth2AuthorizationRequest.authorizationCode()
        .authorizationUri(providerClient.getProviderDetails().getAuthorizationUri())
        .redirectUri(redirectUri)
        .clientId(providerClient.getClientId())
        .scopes(scopes)
        .state(state)
        .additionalParameters(additionalAuthorizationParameters)
        .build();
  }

  /**
   * After authentication, the resulting code should be used here
   *
   * @param providerClient client registration, see {@link ProviderClientService}
   * @param authorizationCode code resulting from authentication
   * @param redirectUri uri the user was directed to after authentication
   * @param scopes scopes requested for authentication
   * @param state state the redirect echoed back
   * @return token response containing access and refresh tokens
   */
  public OAuth2AccessTokenResponse authorizationCodeExchange(
      ClientRegistration providerClient,
      String authorizationCode,
      String redirectUri,
      Set<String> scopes,
      String state) {

    var authRequest =
        createOAuth2AuthorizationRequest(redirectUri, scopes, state, providerClient, Map.of());

    var authResponse =
        OAuth2AuthorizationResponse.success(authorizationCode)
            .redirectUri(redirectUri)
            .state(state)
            .build();

    var codeGrantRequest =
        new OAuth2AuthorizationCodeGrantRequest(
            providerClient, new OAuth2AuthorizationExchange(authRequest, authResponse));

    return authorizationCodeClient.getTokenResponse(codeGrantRequest);
  }

  /**
   * Given a refresh token, get an access token
   *
   * @param providerClient client registration, see {@link ProviderClientService}
   * @param refreshToken
   * @return token response containing access and refresh tokens, note that if there is a refresh
   *     token in this response it should replace the original refresh token which is likely invalid
   */
  public OAuth2AccessTokenResponse authorizeWithRefreshToken(
      ClientRegistration providerClient, OAuth2RefreshToken refreshToken) {
    // the OAuth2RefreshTokenGrantRequest requires an access token to be specified but
    // it does not have to be a valid one so create a dummy
    var dummyAccessToken =
        new OAuth2AccessToken(
            OAuth2AccessToken.TokenType.BEARER, "dummy", Instant.EPOCH, Instant.now());

    var refreshTokenGrantRequest =
        new OAuth2RefreshTokenGrantRequest(providerClient, dummyAccessToken, refreshToken);

    return refreshTokenClient.getTokenResponse(refreshTokenGrantRequest);
  }
}
