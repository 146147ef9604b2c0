package io.ledgerbridge.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.mockserver.model.HttpRequest.request;
import static org.mockserver.model.HttpResponse.response;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.ledgerbridge.LedgerBridgeSpringConfig;
import io.ledgerbridge.TestUtils;
import io.ledgerbridge.config.LedgerBridgeConfig;
import io.ledgerbridge.exception.ApiException;
import io.ledgerbridge.exception.AuthException;
import io.ledgerbridge.exception.RateLimitException;
import io.ledgerbridge.exception.ValidationException;
import io.ledgerbridge.models.ApiRequest;
import io.ledgerbridge.models.ResourceFamily;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockserver.integration.ClientAndServer;
import org.mockserver.matchers.Times;
import org.mockserver.model.HttpError;
import org.mockserver.model.HttpRequest;
import org.mockserver.verify.VerificationTimes;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.retry.backoff.Sleeper;

class ApiRequestExecutorTest {
  private static final String CONTACTS_PATH = "/Contact/Customer";
  private static final String SERVER_PATH =
      "/accountright/" + TestUtils.COMPANY_FILE_ID + CONTACTS_PATH;

  private ClientAndServer mockServer;
  private LedgerBridgeConfig config;
  private TokenManagerService tokenManagerService;
  private ResponseCacheService responseCacheService;
  private Sleeper sleeper;

  @BeforeEach
  void setup() {
    mockServer = ClientAndServer.startClientAndServer();
    config = TestUtils.createTestConfig("http://localhost:" + mockServer.getPort());
    tokenManagerService = mock(TokenManagerService.class);
    when(tokenManagerService.getValidAccessToken()).thenReturn("access-1");
    responseCacheService = new ResponseCacheService(Clock.systemUTC());
    sleeper = mock(Sleeper.class);
  }

  @AfterEach
  void tearDown() {
    mockServer.stop();
  }

  private ApiRequestExecutor createExecutor() {
    var restTemplate =
        new LedgerBridgeSpringConfig().apiRestTemplate(new RestTemplateBuilder(), config);
    return new ApiRequestExecutor(
        config,
        tokenManagerService,
        responseCacheService,
        restTemplate,
        new ObjectMapper(),
        Clock.systemUTC(),
        sleeper);
  }

  private static ApiRequest getContacts() {
    return new ApiRequest.Builder().method(HttpMethod.GET).path(CONTACTS_PATH).build();
  }

  private static HttpRequest contactsRequest() {
    return request().withMethod("GET").withPath(SERVER_PATH);
  }

  @Test
  void testSendsCredentialAndApiHeaders() {
    mockServer
        .when(
            contactsRequest()
                .withHeader("Authorization", "Bearer access-1")
                .withHeader("x-myobapi-key", "test-client-id")
                .withHeader("x-myobapi-version", "v2")
                .withHeader("Accept", "application/json"))
        .respond(response().withStatusCode(200).withBody("{\"Name\":\"Acme\"}"));

    var result = createExecutor().execute(getContacts());

    assertEquals("Acme", result.get("Name").asText());
  }

  @Test
  void testEmptyResponseIsNullNode() {
    mockServer
        .when(request().withMethod("DELETE").withPath(SERVER_PATH))
        .respond(response().withStatusCode(204));

    var result =
        createExecutor()
            .execute(
                new ApiRequest.Builder().method(HttpMethod.DELETE).path(CONTACTS_PATH).build());

    assertTrue(result.isNull());
  }

  @Test
  void testQueryValuesAreEncoded() {
    var filter = "substringof('a+b & c', tolower(CompanyName)) eq true";
    mockServer
        .when(contactsRequest().withQueryStringParameter("$filter", filter))
        .respond(response().withStatusCode(200).withBody("[]"));

    createExecutor()
        .execute(
            new ApiRequest.Builder()
                .from(getContacts())
                .queryParams(Map.of("$filter", filter))
                .build());

    mockServer.verify(
        contactsRequest().withQueryStringParameter("$filter", filter), VerificationTimes.once());
  }

  @Nested
  class Retries {
    @Test
    void testRateLimitWaitsForRetryAfter() throws Exception {
      mockServer
          .when(contactsRequest(), Times.once())
          .respond(response().withStatusCode(429).withHeader("Retry-After", "5"));
      mockServer
          .when(contactsRequest())
          .respond(response().withStatusCode(200).withBody("{\"ok\":true}"));

      var result = createExecutor().execute(getContacts());

      assertTrue(result.get("ok").asBoolean());
      verify(sleeper).sleep(5000L);
      mockServer.verify(contactsRequest(), VerificationTimes.exactly(2));
    }

    @Test
    void testRetryAfterIsCapped() throws Exception {
      mockServer
          .when(contactsRequest(), Times.once())
          .respond(response().withStatusCode(429).withHeader("Retry-After", "3600"));
      mockServer.when(contactsRequest()).respond(response().withStatusCode(200).withBody("{}"));

      createExecutor().execute(getContacts());

      verify(sleeper).sleep(60000L);
    }

    @Test
    void testRateLimitExhausted() throws Exception {
      mockServer
          .when(contactsRequest())
          .respond(
              response()
                  .withStatusCode(429)
                  .withHeader("Retry-After", "1")
                  .withBody("{\"Errors\":[{\"Name\":\"RateLimitError\"}]}"));

      var executor = createExecutor();
      var exception =
          assertThrows(RateLimitException.class, () -> executor.execute(getContacts()));

      assertEquals(429, exception.getStatus());
      assertEquals(CONTACTS_PATH, exception.getPath());
      assertTrue(exception.getResponseExcerpt().contains("RateLimitError"));
      mockServer.verify(contactsRequest(), VerificationTimes.exactly(4));
      verify(sleeper, times(3)).sleep(1000L);
    }

    @Test
    void testServerErrorsBackOffExponentially() throws Exception {
      mockServer
          .when(contactsRequest(), Times.exactly(2))
          .respond(response().withStatusCode(503));
      mockServer.when(contactsRequest()).respond(response().withStatusCode(200).withBody("{}"));

      createExecutor().execute(getContacts());

      var order = inOrder(sleeper);
      order.verify(sleeper).sleep(500L);
      order.verify(sleeper).sleep(1000L);
      mockServer.verify(contactsRequest(), VerificationTimes.exactly(3));
    }

    @Test
    void testNetworkFailureExhausted() {
      mockServer
          .when(contactsRequest())
          .error(HttpError.error().withDropConnection(true));

      var executor = createExecutor();
      var exception = assertThrows(ApiException.class, () -> executor.execute(getContacts()));

      assertEquals(0, exception.getStatus());
      assertEquals(CONTACTS_PATH, exception.getPath());
    }

    @Test
    void testClientErrorIsNotRetried() throws Exception {
      mockServer
          .when(contactsRequest())
          .respond(response().withStatusCode(404).withBody("x".repeat(2000)));

      var executor = createExecutor();
      var exception = assertThrows(ApiException.class, () -> executor.execute(getContacts()));

      assertEquals(404, exception.getStatus());
      assertEquals(ApiException.MAX_EXCERPT_LENGTH + 3, exception.getResponseExcerpt().length());
      mockServer.verify(contactsRequest(), VerificationTimes.once());
      verify(sleeper, never()).sleep(anyLong());
    }

    @Test
    void testUnauthorizedRefreshesOnceAndRetries() throws Exception {
      when(tokenManagerService.refreshIfCurrent("access-1")).thenReturn("access-2");
      mockServer
          .when(contactsRequest().withHeader("Authorization", "Bearer access-1"))
          .respond(response().withStatusCode(401));
      mockServer
          .when(contactsRequest().withHeader("Authorization", "Bearer access-2"))
          .respond(response().withStatusCode(200).withBody("{}"));

      createExecutor().execute(getContacts());

      verify(tokenManagerService, times(1)).refreshIfCurrent("access-1");
      verify(tokenManagerService, times(1)).getValidAccessToken();
      verify(sleeper, never()).sleep(anyLong());
    }

    @Test
    void testSecondUnauthorizedIsFatal() {
      when(tokenManagerService.refreshIfCurrent(anyString())).thenReturn("access-2");
      mockServer
          .when(contactsRequest())
          .respond(response().withStatusCode(401).withBody("{\"Message\":\"denied\"}"));

      var executor = createExecutor();
      var exception = assertThrows(AuthException.class, () -> executor.execute(getContacts()));

      assertTrue(exception.getMessage().contains("401"));
      assertTrue(exception.getMessage().contains(CONTACTS_PATH));
      verify(tokenManagerService, times(1)).refreshIfCurrent("access-1");
      mockServer.verify(contactsRequest(), VerificationTimes.exactly(2));
    }
  }

  @Nested
  class Caching {
    @Test
    void testCacheHitMakesNoNetworkCall() {
      mockServer
          .when(contactsRequest())
          .respond(response().withStatusCode(200).withBody("{\"Name\":\"Acme\"}"));
      var request =
          new ApiRequest.Builder()
              .from(getContacts())
              .cacheKey("contacts:test")
              .cacheTtl(Duration.ofMinutes(15))
              .build();
      var executor = createExecutor();

      var first = executor.execute(request);
      var second = executor.execute(request);

      assertEquals(first, second);
      mockServer.verify(contactsRequest(), VerificationTimes.once());
    }

    @Test
    void testCacheIsScopedToCompanyFile() {
      var otherCompanyFile = "0f0e0d0c-0b0a-4908-8706-050403020100";
      mockServer
          .when(contactsRequest())
          .respond(response().withStatusCode(200).withBody("{\"Name\":\"Acme\"}"));
      mockServer
          .when(request().withPath("/accountright/" + otherCompanyFile + CONTACTS_PATH))
          .respond(response().withStatusCode(200).withBody("{\"Name\":\"Other\"}"));
      var request =
          new ApiRequest.Builder().from(getContacts()).cacheKey("contacts:test").build();
      var executor = createExecutor();

      executor.execute(request);
      var other = executor.execute(request.withCompanyFileId(otherCompanyFile));

      assertEquals("Other", other.get("Name").asText());
    }

    @Test
    void testMutationIsNeitherServedNorStoredFromCache() {
      var postContacts = request().withMethod("POST").withPath(SERVER_PATH);
      mockServer
          .when(postContacts)
          .respond(response().withStatusCode(200).withBody("{\"UID\":\"c-1\"}"));
      var request =
          new ApiRequest.Builder()
              .method(HttpMethod.POST)
              .path(CONTACTS_PATH)
              .body(Map.of("Name", "Acme"))
              .cacheKey("contacts:create")
              .build();
      var executor = createExecutor();

      executor.execute(request);
      executor.execute(request);

      mockServer.verify(postContacts, VerificationTimes.exactly(2));
      assertEquals(0, responseCacheService.size());
    }

    @Test
    void testReadOverlappingMutationIsNotCached() throws Exception {
      mockServer
          .when(contactsRequest(), Times.once())
          .respond(
              response()
                  .withStatusCode(200)
                  .withBody("{\"v\":\"old\"}")
                  .withDelay(TimeUnit.MILLISECONDS, 1500));
      mockServer
          .when(contactsRequest())
          .respond(response().withStatusCode(200).withBody("{\"v\":\"new\"}"));
      mockServer
          .when(request().withMethod("POST").withPath(SERVER_PATH))
          .respond(response().withStatusCode(200).withBody("{}"));
      var read = new ApiRequest.Builder().from(getContacts()).cacheKey("contacts:list").build();
      var write =
          new ApiRequest.Builder()
              .method(HttpMethod.POST)
              .path(CONTACTS_PATH)
              .body(Map.of("Name", "Acme"))
              .addInvalidates(ResourceFamily.CONTACTS)
              .build();
      var executor = createExecutor();
      var background = Executors.newSingleThreadExecutor();
      try {
        var slowRead = background.submit(() -> executor.execute(read));
        Thread.sleep(500);
        executor.execute(write);

        assertEquals("old", slowRead.get(10, TimeUnit.SECONDS).get("v").asText());
      } finally {
        background.shutdownNow();
      }

      assertEquals("new", executor.execute(read).get("v").asText());
    }
  }

  @Nested
  class CompanyFiles {
    @Test
    void testInvalidCompanyFileNeverReachesNetwork() {
      var request = new ApiRequest.Builder().from(getContacts()).companyFileId("bogus").build();

      assertThrows(ValidationException.class, () -> createExecutor().execute(request));

      mockServer.verifyZeroInteractions();
      verifyNoInteractions(tokenManagerService);
    }

    @Test
    void testMissingCompanyFile() {
      config.setDefaultCompanyFileId("");

      var executor = createExecutor();
      assertThrows(ValidationException.class, () -> executor.execute(getContacts()));
    }

    @Test
    void testFallsBackToCredentialBusinessId() {
      var businessId = "0f0e0d0c-0b0a-4908-8706-050403020100";
      config.setDefaultCompanyFileId("");
      when(tokenManagerService.getBusinessId()).thenReturn(Optional.of(businessId));
      mockServer
          .when(request().withPath("/accountright/" + businessId + CONTACTS_PATH))
          .respond(response().withStatusCode(200).withBody("{}"));

      createExecutor().execute(getContacts());

      mockServer.verify(
          request().withPath("/accountright/" + businessId + CONTACTS_PATH),
          VerificationTimes.once());
    }

    @Test
    void testCompanyFileListingNeedsNoCompanyFile() {
      config.setDefaultCompanyFileId("");
      mockServer
          .when(request().withPath("/accountright/"))
          .respond(response().withStatusCode(200).withBody("[{\"Id\":\"x\"}]"));

      var result =
          createExecutor()
              .execute(
                  new ApiRequest.Builder()
                      .method(HttpMethod.GET)
                      .path("/")
                      .isCompanyFileRequired(false)
                      .build());

      assertEquals(1, result.size());
    }
  }

  @Nested
  class Paging {
    @Test
    void testFollowsNextPageLink() {
      config.setPageSize(2);
      mockServer
          .when(contactsRequest().withQueryStringParameter("$skip", "0"))
          .respond(
              response()
                  .withStatusCode(200)
                  .withBody("{\"Items\":[{\"n\":1},{\"n\":2}],\"NextPageLink\":\"next\"}"));
      mockServer
          .when(contactsRequest().withQueryStringParameter("$skip", "2"))
          .respond(
              response()
                  .withStatusCode(200)
                  .withBody("{\"Items\":[{\"n\":3}],\"NextPageLink\":null}"));

      var items = createExecutor().executePaged(getContacts(), 0);

      assertEquals(3, items.size());
      assertEquals(3, items.get(2).get("n").asInt());
    }

    @Test
    void testBareArrayPagesContinueWhileFull() {
      config.setPageSize(2);
      mockServer
          .when(contactsRequest().withQueryStringParameter("$skip", "0"))
          .respond(response().withStatusCode(200).withBody("[{\"n\":1},{\"n\":2}]"));
      mockServer
          .when(contactsRequest().withQueryStringParameter("$skip", "2"))
          .respond(response().withStatusCode(200).withBody("[{\"n\":3}]"));

      var items = createExecutor().executePaged(getContacts(), 0);

      assertEquals(3, items.size());
      assertEquals(3, items.get(2).get("n").asInt());
      mockServer.verify(contactsRequest(), VerificationTimes.exactly(2));
    }

    @Test
    void testObjectPageWithoutNextPageLinkStops() {
      config.setPageSize(2);
      mockServer
          .when(contactsRequest().withQueryStringParameter("$skip", "0"))
          .respond(
              response().withStatusCode(200).withBody("{\"Items\":[{\"n\":1},{\"n\":2}]}"));

      var items = createExecutor().executePaged(getContacts(), 0);

      assertEquals(2, items.size());
      mockServer.verify(contactsRequest(), VerificationTimes.once());
    }

    @Test
    void testStopsAtMaxItems() {
      config.setPageSize(2);
      mockServer
          .when(contactsRequest().withQueryStringParameter("$skip", "0"))
          .respond(
              response()
                  .withStatusCode(200)
                  .withBody("{\"Items\":[{\"n\":1},{\"n\":2}],\"NextPageLink\":\"next\"}"));
      mockServer
          .when(
              contactsRequest()
                  .withQueryStringParameter("$skip", "2")
                  .withQueryStringParameter("$top", "1"))
          .respond(
              response()
                  .withStatusCode(200)
                  .withBody("{\"Items\":[{\"n\":3}],\"NextPageLink\":\"next\"}"));

      var items = createExecutor().executePaged(getContacts(), 3);

      assertEquals(3, items.size());
      mockServer.verify(contactsRequest(), VerificationTimes.exactly(2));
    }
  }
}
