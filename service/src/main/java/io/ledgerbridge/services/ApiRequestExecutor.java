package io.ledgerbridge.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.ledgerbridge.LedgerBridgeException;
import io.ledgerbridge.config.LedgerBridgeConfig;
import io.ledgerbridge.exception.ApiException;
import io.ledgerbridge.exception.AuthException;
import io.ledgerbridge.exception.RateLimitException;
import io.ledgerbridge.exception.ValidationException;
import io.ledgerbridge.models.ApiRequest;
import io.ledgerbridge.util.CompositeBackOffPolicy;
import io.ledgerbridge.util.ODataFilters;
import io.ledgerbridge.util.RetryAfterBackOffPolicy;
import io.ledgerbridge.util.RetryAfterHint;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Sends requests to the accounting API with credential injection, bounded retries and response
 * caching.
 *
 * <ul>
 *   <li>401: the credential is refreshed and the request retried once; a second 401 fails with
 *       {@link AuthException}
 *   <li>429: waits for Retry-After (capped) or an exponential backoff, then retries
 *   <li>5xx and network failures (timeouts included): exponential backoff, then retries
 *   <li>any other non-2xx: fails immediately with {@link ApiException}
 * </ul>
 *
 * Headers are built once per request and only rebuilt after a 401.
 */
@Service
@Slf4j
public class ApiRequestExecutor {
  static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(5);
  private static final String CREDENTIAL_REFRESHED = "credentialRefreshed";
  private static final String API_KEY_HEADER = "x-myobapi-key";
  private static final String API_VERSION_HEADER = "x-myobapi-version";

  private final LedgerBridgeConfig config;
  private final TokenManagerService tokenManagerService;
  private final ResponseCacheService responseCacheService;
  private final RestTemplate apiRestTemplate;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final RetryTemplate retryTemplate;

  public ApiRequestExecutor(
      LedgerBridgeConfig config,
      TokenManagerService tokenManagerService,
      ResponseCacheService responseCacheService,
      @Qualifier("apiRestTemplate") RestTemplate apiRestTemplate,
      ObjectMapper objectMapper,
      Clock clock,
      Sleeper sleeper) {
    this.config = config;
    this.tokenManagerService = tokenManagerService;
    this.responseCacheService = responseCacheService;
    this.apiRestTemplate = apiRestTemplate;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.retryTemplate = buildRetryTemplate(config, sleeper);
  }

  /**
   * Executes one request. A cached value is returned without any network call when a read
   * carries a cache key with a live entry. Non-read requests never touch the cache.
   *
   * @return the parsed response body, a {@link NullNode} for empty responses
   */
  public JsonNode execute(ApiRequest request) {
    var companyFileId = resolveCompanyFileId(request);
    var cacheKey = cacheKeyFor(request, companyFileId);
    var cached = cacheKey.flatMap(responseCacheService::get);
    if (cached.isPresent()) {
      return cached.get();
    }
    var generation = cacheKey.map(responseCacheService::generation);

    var result =
        send(
            request.getMethod(),
            buildUri(request.getPath(), companyFileId, request.getQueryParams()),
            request.getPath(),
            request.getBody());
    onSuccess(request, cacheKey, generation, result);
    return result;
  }

  /**
   * Drains a paged listing with {@code $top}/{@code $skip} until the backend returns a short page,
   * an object page without a {@code NextPageLink}, or {@code maxItems} items were collected.
   *
   * @param maxItems upper bound on returned items, non-positive means the configured maximum
   * @return all collected items as one array
   */
  public ArrayNode executePaged(ApiRequest request, int maxItems) {
    var companyFileId = resolveCompanyFileId(request);
    var cacheKey = cacheKeyFor(request, companyFileId);
    var cached = cacheKey.flatMap(responseCacheService::get).filter(JsonNode::isArray);
    if (cached.isPresent()) {
      return (ArrayNode) cached.get();
    }
    var generation = cacheKey.map(responseCacheService::generation);

    var limit = maxItems > 0 ? maxItems : config.getMaxPagedItems();
    var items = objectMapper.createArrayNode();
    var skip = 0;
    while (items.size() < limit) {
      var top = Math.min(config.getPageSize(), limit - items.size());
      var params = new LinkedHashMap<>(request.getQueryParams());
      params.put("$top", Integer.toString(top));
      params.put("$skip", Integer.toString(skip));

      var page =
          send(
              request.getMethod(),
              buildUri(request.getPath(), companyFileId, params),
              request.getPath(),
              request.getBody());
      var pageItems = page.isArray() ? page : page.path("Items");
      if (!pageItems.isArray()) {
        throw new ApiException(
            HttpStatus.OK.value(), request.getPath(), "Paged response has no Items array");
      }
      pageItems.forEach(items::add);
      skip += pageItems.size();

      if (pageItems.size() < top) {
        break;
      }
      // bare arrays carry no link, a full page is the only sign of more
      var nextPageLink = page.path("NextPageLink");
      if (page.isObject() && (nextPageLink.isMissingNode() || nextPageLink.isNull())) {
        break;
      }
    }
    log.debug("Collected {} items from {}", items.size(), request.getPath());

    onSuccess(request, cacheKey, generation, items);
    return items;
  }

  private void onSuccess(
      ApiRequest request, Optional<String> cacheKey, Optional<Long> generation, JsonNode result) {
    cacheKey.ifPresent(
        key ->
            responseCacheService.putIfUnchanged(
                key,
                result,
                request.getCacheTtl().orElse(DEFAULT_CACHE_TTL),
                generation.orElseThrow()));
    request.getInvalidates().forEach(responseCacheService::invalidate);
  }

  // only reads are served from or stored in the cache
  private static Optional<String> cacheKeyFor(ApiRequest request, Optional<String> companyFileId) {
    if (!request.isRead()) {
      return Optional.empty();
    }
    return request.getCacheKey().map(key -> scopedCacheKey(key, companyFileId));
  }

  private JsonNode send(HttpMethod method, URI uri, String path, Optional<Object> body) {
    var requestBody = body.map(b -> toJson(b, path)).orElse(null);
    var headers = new AtomicReference<>(buildHeaders(tokenManagerService.getValidAccessToken()));

    try {
      return retryTemplate.execute(
          context -> attempt(context, method, uri, path, requestBody, headers));
    } catch (RetryableFailure e) {
      throw e.toFinalException();
    } catch (BackOffInterruptedException e) {
      throw new LedgerBridgeException("Request to " + path + " was interrupted", e);
    }
  }

  private JsonNode attempt(
      RetryContext context,
      HttpMethod method,
      URI uri,
      String path,
      String requestBody,
      AtomicReference<RequestHeaders> headers) {
    log.debug("{} {} (attempt {})", method, uri, context.getRetryCount() + 1);
    int status;
    String responseBody;
    HttpHeaders responseHeaders;
    try {
      var response =
          apiRestTemplate.exchange(
              uri, method, new HttpEntity<>(requestBody, headers.get().headers()), String.class);
      status = response.getStatusCode().value();
      responseBody = response.getBody();
      responseHeaders = response.getHeaders();
    } catch (ResourceAccessException e) {
      log.warn("{} {} failed: {}", method, path, e.getMessage());
      throw new TransientFailure(0, path, e.getMessage(), e);
    }

    if (status >= 200 && status < 300) {
      return parse(status, path, responseBody);
    }
    log.warn("{} {} returned {}", method, path, status);

    if (status == HttpStatus.UNAUTHORIZED.value()) {
      if (context.hasAttribute(CREDENTIAL_REFRESHED)) {
        var rejected = new ApiException(status, path, responseBody);
        throw new AuthException(
            "Credential rejected after refresh: " + rejected.getMessage(), rejected);
      }
      context.setAttribute(CREDENTIAL_REFRESHED, true);
      headers.set(
          buildHeaders(tokenManagerService.refreshIfCurrent(headers.get().accessToken())));
      throw new CredentialRejected(status, path, responseBody);
    }
    if (status == HttpStatus.TOO_MANY_REQUESTS.value()) {
      throw new RateLimited(path, responseBody, parseRetryAfter(responseHeaders));
    }
    if (status >= 500) {
      throw new TransientFailure(status, path, responseBody, null);
    }
    throw new ApiException(status, path, responseBody);
  }

  private JsonNode parse(int status, String path, String responseBody) {
    if (!StringUtils.hasText(responseBody)) {
      return NullNode.getInstance();
    }
    try {
      return objectMapper.readTree(responseBody);
    } catch (JsonProcessingException e) {
      throw new ApiException(status, path, responseBody, e);
    }
  }

  private String toJson(Object body, String path) {
    try {
      return objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new ValidationException("Request body for " + path + " is not serializable");
    }
  }

  private RequestHeaders buildHeaders(String accessToken) {
    var headers = new HttpHeaders();
    headers.setBearerAuth(accessToken);
    headers.set(API_KEY_HEADER, config.getClientId());
    headers.set(API_VERSION_HEADER, config.getApiVersion());
    headers.setAccept(List.of(MediaType.APPLICATION_JSON));
    headers.setContentType(MediaType.APPLICATION_JSON);
    return new RequestHeaders(accessToken, headers);
  }

  /**
   * Explicit id, then the configured default, then the business captured at authorization. The
   * result is always a GUID since it becomes a path segment.
   */
  private Optional<String> resolveCompanyFileId(ApiRequest request) {
    if (!request.getPath().isEmpty() && !request.getPath().startsWith("/")) {
      throw new ValidationException("Resource path must start with '/': " + request.getPath());
    }
    if (!request.isCompanyFileRequired()) {
      return Optional.empty();
    }
    var companyFileId =
        request
            .getCompanyFileId()
            .filter(StringUtils::hasText)
            .or(() -> Optional.of(config.getDefaultCompanyFileId()).filter(StringUtils::hasText))
            .or(tokenManagerService::getBusinessId)
            .orElseThrow(
                () ->
                    new ValidationException(
                        "No company file selected: pass a company file id, set"
                            + " ledgerbridge.default-company-file-id or authorize with a"
                            + " business"));
    return Optional.of(ODataFilters.requireGuid("company file id", companyFileId));
  }

  private URI buildUri(String path, Optional<String> companyFileId, Map<String, String> params) {
    var builder = UriComponentsBuilder.fromHttpUrl(config.getApiBaseUrl());
    if (companyFileId.isPresent()) {
      builder.pathSegment(companyFileId.get()).path(path);
    } else {
      builder.path(path.isEmpty() ? "/" : path);
    }

    // values go through template expansion so reserved characters in filters get encoded
    var uriVariables = new HashMap<String, String>();
    params.forEach(
        (name, value) -> {
          var variable = "p" + uriVariables.size();
          builder.queryParam(name, "{" + variable + "}");
          uriVariables.put(variable, value);
        });
    return builder.encode().buildAndExpand(uriVariables).toUri();
  }

  // entries for different company files must never be confused, the family prefix stays first
  private static String scopedCacheKey(String key, Optional<String> companyFileId) {
    return companyFileId.map(id -> key + "@" + id).orElse(key);
  }

  /** Seconds or an HTTP date, per RFC 9110. */
  private Optional<Duration> parseRetryAfter(HttpHeaders headers) {
    var value = headers.getFirst(HttpHeaders.RETRY_AFTER);
    if (!StringUtils.hasText(value)) {
      return Optional.empty();
    }
    try {
      return Optional.of(Duration.ofSeconds(Math.max(0, Long.parseLong(value.trim()))));
    } catch (NumberFormatException e) {
      try {
        var retryAt = ZonedDateTime.parse(value.trim(), DateTimeFormatter.RFC_1123_DATE_TIME);
        var wait = Duration.between(clock.instant(), retryAt.toInstant());
        return Optional.of(wait.isNegative() ? Duration.ZERO : wait);
      } catch (DateTimeParseException dateException) {
        log.debug("Ignoring unparseable Retry-After '{}'", value);
        return Optional.empty();
      }
    }
  }

  private static RetryTemplate buildRetryTemplate(LedgerBridgeConfig config, Sleeper sleeper) {
    var retryPolicy =
        new SimpleRetryPolicy(
            config.getRetryMaxAttempts(),
            Map.<Class<? extends Throwable>, Boolean>of(
                CredentialRejected.class, true,
                RateLimited.class, true,
                TransientFailure.class, true));

    var exponentialBackOff = new ExponentialBackOffPolicy();
    exponentialBackOff.setInitialInterval(config.getRetryInitialBackoff().toMillis());
    exponentialBackOff.setMaxInterval(config.getRetryMaxBackoff().toMillis());
    exponentialBackOff.setMultiplier(2.0);
    exponentialBackOff.setSleeper(sleeper);

    // no entry for CredentialRejected: the retry after a refresh goes out immediately
    var backOffPolicies = new LinkedHashMap<Class<? extends Throwable>, BackOffPolicy>();
    backOffPolicies.put(
        RateLimited.class,
        new RetryAfterBackOffPolicy(
                config.getRetryAfterCap(),
                config.getRetryInitialBackoff(),
                config.getRetryMaxBackoff())
            .withSleeper(sleeper));
    backOffPolicies.put(TransientFailure.class, exponentialBackOff);
    // CredentialRejected has no entry and is retried without waiting

    var retryTemplate = new RetryTemplate();
    retryTemplate.setRetryPolicy(retryPolicy);
    retryTemplate.setBackOffPolicy(new CompositeBackOffPolicy(backOffPolicies));
    retryTemplate.setThrowLastExceptionOnExhausted(true);
    return retryTemplate;
  }

  private record RequestHeaders(String accessToken, HttpHeaders headers) {}

  /** A failed attempt that may be retried. Converted to a public exception once retries run out. */
  private abstract static class RetryableFailure extends RuntimeException {
    final int status;
    final String path;
    final String responseBody;

    RetryableFailure(int status, String path, String responseBody, Throwable cause) {
      super("Attempt failed with status " + status + " for " + path, cause);
      this.status = status;
      this.path = path;
      this.responseBody = responseBody;
    }

    abstract LedgerBridgeException toFinalException();
  }

  private static class CredentialRejected extends RetryableFailure {
    CredentialRejected(int status, String path, String responseBody) {
      super(status, path, responseBody, null);
    }

    @Override
    LedgerBridgeException toFinalException() {
      var rejected = new ApiException(status, path, responseBody);
      return new AuthException("Credential rejected: " + rejected.getMessage(), rejected);
    }
  }

  private static class RateLimited extends RetryableFailure implements RetryAfterHint {
    private final Optional<Duration> retryAfter;

    RateLimited(String path, String responseBody, Optional<Duration> retryAfter) {
      super(HttpStatus.TOO_MANY_REQUESTS.value(), path, responseBody, null);
      this.retryAfter = retryAfter;
    }

    @Override
    public Optional<Duration> getRetryAfter() {
      return retryAfter;
    }

    @Override
    LedgerBridgeException toFinalException() {
      return new RateLimitException(path, responseBody);
    }
  }

  private static class TransientFailure extends RetryableFailure {
    TransientFailure(int status, String path, String responseBody, Throwable cause) {
      super(status, path, responseBody, cause);
    }

    @Override
    LedgerBridgeException toFinalException() {
      return new ApiException(status, path, responseBody, getCause());
    }
  }
}
