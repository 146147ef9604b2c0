package io.ledgerbridge.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.ledgerbridge.models.ApiRequest;
import io.ledgerbridge.models.ResourceFamily;
import io.ledgerbridge.util.CacheKeys;
import java.util.Map;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;

@Service
public class CompanyFileService {
  private final ApiRequestExecutor apiRequestExecutor;
  private final ObjectMapper objectMapper;

  public CompanyFileService(ApiRequestExecutor apiRequestExecutor, ObjectMapper objectMapper) {
    this.apiRequestExecutor = apiRequestExecutor;
    this.objectMapper = objectMapper;
  }

  /** Company files the authorized user can open. Needs no company file itself. */
  public ArrayNode listCompanyFiles() {
    var request =
        new ApiRequest.Builder()
            .method(HttpMethod.GET)
            .path("/")
            .isCompanyFileRequired(false)
            .cacheKey(
                CacheKeys.fingerprint(ResourceFamily.COMPANY_FILES, HttpMethod.GET, "/", Map.of()))
            .cacheTtl(ResourceFamily.COMPANY_FILES.getCacheTtl())
            .build();
    return asArray(apiRequestExecutor.execute(request));
  }

  private ArrayNode asArray(JsonNode result) {
    if (result.isArray()) {
      return (ArrayNode) result;
    }
    var array = objectMapper.createArrayNode();
    if (!result.isNull()) {
      array.add(result);
    }
    return array;
  }
}
