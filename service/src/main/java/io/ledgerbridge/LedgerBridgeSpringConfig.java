package io.ledgerbridge;

import io.ledgerbridge.config.LedgerBridgeConfig;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.List;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.http.converter.FormHttpMessageConverter;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.security.oauth2.client.http.OAuth2ErrorResponseErrorHandler;
import org.springframework.security.oauth2.core.http.converter.OAuth2AccessTokenResponseHttpMessageConverter;
import org.springframework.web.client.ResponseErrorHandler;
import org.springframework.web.client.RestOperations;
import org.springframework.web.client.RestTemplate;

/** Spring configuration class for loading application config and code defined beans. */
@Configuration
@EnableConfigurationProperties
@EnableScheduling
public class LedgerBridgeSpringConfig {

  @Bean
  @ConfigurationProperties(value = "ledgerbridge", ignoreUnknownFields = false)
  public LedgerBridgeConfig getLedgerBridgeConfig() {
    return LedgerBridgeConfig.create();
  }

  /**
   * Template for resource calls. Non-2xx responses are returned rather than thrown, the executor
   * decides what is retryable.
   */
  @Bean("apiRestTemplate")
  public RestTemplate apiRestTemplate(RestTemplateBuilder builder, LedgerBridgeConfig config) {
    return builder
        .requestFactory(() -> createRequestFactory(config))
        .errorHandler(new PassThroughErrorHandler())
        .build();
  }

  /** Template for the token endpoint, set up the way the spring security token clients expect. */
  @Bean("tokenRestOperations")
  public RestOperations tokenRestOperations(
      RestTemplateBuilder builder, LedgerBridgeConfig config) {
    return builder
        .requestFactory(() -> createRequestFactory(config))
        .messageConverters(
            List.of(
                new FormHttpMessageConverter(),
                new OAuth2AccessTokenResponseHttpMessageConverter()))
        .errorHandler(new OAuth2ErrorResponseErrorHandler())
        .build();
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /** Every backoff wait goes through this so it can be observed in tests. */
  @Bean
  public Sleeper retrySleeper() {
    return new ThreadWaitSleeper();
  }

  @Bean
  public SecureRandom secureRandom() {
    return new SecureRandom();
  }

  /**
   * Every call is bounded by the configured timeouts. The client's own retries are off, retrying
   * is left to the request executor.
   */
  static ClientHttpRequestFactory createRequestFactory(LedgerBridgeConfig config) {
    var connectionManager =
        PoolingHttpClientConnectionManagerBuilder.create()
            .setDefaultConnectionConfig(
                ConnectionConfig.custom()
                    .setConnectTimeout(Timeout.of(config.getConnectTimeout()))
                    .setSocketTimeout(Timeout.of(config.getRequestTimeout()))
                    .build())
            .build();
    var httpClient =
        HttpClientBuilder.create()
            .setConnectionManager(connectionManager)
            .disableAutomaticRetries()
            .build();
    return new HttpComponentsClientHttpRequestFactory(httpClient);
  }

  private static class PassThroughErrorHandler implements ResponseErrorHandler {
    @Override
    public boolean hasError(ClientHttpResponse response) {
      return false;
    }

    @Override
    public void handleError(ClientHttpResponse response) {}
  }
}
