package io.ledgerbridge.util;

import io.ledgerbridge.models.ResourceFamily;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.springframework.http.HttpMethod;

public final class CacheKeys {
  private CacheKeys() {}

  /**
   * Deterministic key for a read: identical family, method, path and parameters give identical
   * keys regardless of parameter order.
   */
  public static String fingerprint(
      ResourceFamily family, HttpMethod method, String path, Map<String, String> queryParams) {
    var params =
        new TreeMap<>(queryParams)
            .entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("&"));
    return family.getCachePrefix() + method.name() + ":" + path + ":" + params;
  }
}
