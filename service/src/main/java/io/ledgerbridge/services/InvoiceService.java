package io.ledgerbridge.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.ledgerbridge.exception.ValidationException;
import io.ledgerbridge.models.ApiRequest;
import io.ledgerbridge.models.FilterClause;
import io.ledgerbridge.models.FilterOperator;
import io.ledgerbridge.models.InvoiceQuery;
import io.ledgerbridge.models.NewInvoice;
import io.ledgerbridge.models.ResourceFamily;
import io.ledgerbridge.util.CacheKeys;
import io.ledgerbridge.util.ODataFilters;
import java.util.ArrayList;
import java.util.HashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class InvoiceService {
  private static final String INVOICE_PATH = "/Sale/Invoice";
  private static final String ITEM_INVOICE_PATH = INVOICE_PATH + "/Item";

  private final ApiRequestExecutor apiRequestExecutor;
  private final ObjectMapper objectMapper;

  public InvoiceService(ApiRequestExecutor apiRequestExecutor, ObjectMapper objectMapper) {
    this.apiRequestExecutor = apiRequestExecutor;
    this.objectMapper = objectMapper;
  }

  public ArrayNode listInvoices(InvoiceQuery query, int maxItems) {
    var filters = new ArrayList<FilterClause>();
    query
        .getDateFrom()
        .ifPresent(from -> filters.add(ODataFilters.date("Date", FilterOperator.GE, from)));
    query
        .getDateTo()
        .ifPresent(to -> filters.add(ODataFilters.date("Date", FilterOperator.LE, to)));
    query.getStatus().ifPresent(s -> filters.add(ODataFilters.stringEquals("Status", s)));
    query
        .getCustomerId()
        .ifPresent(id -> filters.add(ODataFilters.identifierEquals("Customer/UID", id)));
    var params = new HashMap<String, String>();
    ODataFilters.combine(filters).ifPresent(filter -> params.put("$filter", filter));

    var request =
        new ApiRequest.Builder()
            .method(HttpMethod.GET)
            .path(INVOICE_PATH)
            .queryParams(params)
            .cacheKey(
                CacheKeys.fingerprint(
                    ResourceFamily.INVOICES, HttpMethod.GET, INVOICE_PATH, params))
            .cacheTtl(ResourceFamily.INVOICES.getCacheTtl())
            .build();
    return apiRequestExecutor.executePaged(request, maxItems);
  }

  public JsonNode getInvoice(String invoiceId) {
    ODataFilters.requireGuid("invoice id", invoiceId);
    return apiRequestExecutor.execute(
        new ApiRequest.Builder()
            .method(HttpMethod.GET)
            .path(INVOICE_PATH + "/" + invoiceId)
            .build());
  }

  /** Creates an item invoice and drops every cached invoice listing. */
  public JsonNode createInvoice(NewInvoice invoice) {
    ODataFilters.requireGuid("customer id", invoice.getCustomerId());
    ODataFilters.requireDate("date", invoice.getDate());
    ODataFilters.requireDate("due date", invoice.getDueDate());
    if (invoice.getLines().isEmpty()) {
      throw new ValidationException("An invoice needs at least one line");
    }

    var body = objectMapper.createObjectNode();
    body.putObject("Customer").put("UID", invoice.getCustomerId());
    body.put("Date", invoice.getDate());
    body.put("BalanceDueDate", invoice.getDueDate());
    var lines = body.putArray("Lines");
    for (var line : invoice.getLines()) {
      var lineNode = lines.addObject();
      lineNode.put("Description", line.getDescription());
      lineNode.put("Quantity", line.getQuantity());
      lineNode.put("UnitPrice", line.getUnitPrice());
      lineNode
          .putObject("Account")
          .put("UID", ODataFilters.requireGuid("account id", line.getAccountId()));
      line.getTaxCodeId()
          .ifPresent(
              taxCodeId ->
                  lineNode
                      .putObject("TaxCode")
                      .put("UID", ODataFilters.requireGuid("tax code id", taxCodeId)));
    }
    invoice.getReference().ifPresent(reference -> body.put("Number", reference));
    invoice.getNotes().ifPresent(notes -> body.put("Comment", notes));

    log.info("Creating invoice with {} lines", invoice.getLines().size());
    return apiRequestExecutor.execute(
        new ApiRequest.Builder()
            .method(HttpMethod.POST)
            .path(ITEM_INVOICE_PATH)
            .body(body)
            .addInvalidates(ResourceFamily.INVOICES)
            .build());
  }
}
