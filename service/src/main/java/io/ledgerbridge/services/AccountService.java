package io.ledgerbridge.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.ledgerbridge.models.ApiRequest;
import io.ledgerbridge.models.FilterClause;
import io.ledgerbridge.models.ResourceFamily;
import io.ledgerbridge.util.CacheKeys;
import io.ledgerbridge.util.ODataFilters;
import jakarta.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;

/** Chart of accounts and tax codes. Both change rarely and are cached the longest. */
@Service
public class AccountService {
  private static final String ACCOUNT_PATH = "/GeneralLedger/Account";
  private static final String TAX_CODE_PATH = "/GeneralLedger/TaxCode";

  private final ApiRequestExecutor apiRequestExecutor;

  public AccountService(ApiRequestExecutor apiRequestExecutor) {
    this.apiRequestExecutor = apiRequestExecutor;
  }

  /**
   * @param accountType backend account type such as {@code Asset} or {@code Income}, null for all
   * @param active null for active and inactive accounts
   */
  public ArrayNode listAccounts(
      @Nullable String accountType, @Nullable Boolean active, int maxItems) {
    var filters = new ArrayList<FilterClause>();
    if (accountType != null) {
      filters.add(ODataFilters.stringEquals("Type", accountType));
    }
    if (active != null) {
      filters.add(ODataFilters.booleanEquals("IsActive", active));
    }
    var params = new HashMap<String, String>();
    ODataFilters.combine(filters).ifPresent(filter -> params.put("$filter", filter));

    return apiRequestExecutor.executePaged(
        cachedListing(ResourceFamily.ACCOUNTS, ACCOUNT_PATH, params), maxItems);
  }

  public JsonNode getAccount(String accountId) {
    ODataFilters.requireGuid("account id", accountId);
    return apiRequestExecutor.execute(
        new ApiRequest.Builder()
            .method(HttpMethod.GET)
            .path(ACCOUNT_PATH + "/" + accountId)
            .build());
  }

  public ArrayNode listTaxCodes() {
    return apiRequestExecutor.executePaged(
        cachedListing(ResourceFamily.TAX_CODES, TAX_CODE_PATH, Map.of()), 0);
  }

  private static ApiRequest cachedListing(
      ResourceFamily family, String path, Map<String, String> params) {
    return new ApiRequest.Builder()
        .method(HttpMethod.GET)
        .path(path)
        .queryParams(params)
        .cacheKey(CacheKeys.fingerprint(family, HttpMethod.GET, path, params))
        .cacheTtl(family.getCacheTtl())
        .build();
  }
}
