package io.ledgerbridge.models;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.immutables.value.Value;
import org.springframework.http.HttpMethod;

/** One logical call against the accounting API, before company file resolution. */
@Value.Immutable
public interface ApiRequest extends WithApiRequest {
  HttpMethod getMethod();

  /** Resource path below the company file, e.g. {@code /Sale/Invoice}. */
  String getPath();

  Map<String, String> getQueryParams();

  Optional<Object> getBody();

  Optional<String> getCacheKey();

  Optional<Duration> getCacheTtl();

  /** Overrides the configured and credential supplied company file. */
  Optional<String> getCompanyFileId();

  @Value.Default
  default boolean isCompanyFileRequired() {
    return true;
  }

  /** Families whose cached reads are dropped once this request succeeds. */
  Set<ResourceFamily> getInvalidates();

  default boolean isRead() {
    return HttpMethod.GET.equals(getMethod());
  }

  class Builder extends ImmutableApiRequest.Builder {}
}
