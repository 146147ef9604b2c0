package io.ledgerbridge.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.ledgerbridge.exception.ValidationException;
import io.ledgerbridge.models.ApiRequest;
import io.ledgerbridge.models.ContactQuery;
import io.ledgerbridge.models.ContactType;
import io.ledgerbridge.models.FilterClause;
import io.ledgerbridge.models.NewContact;
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
public class ContactService {
  private static final String ALL_CONTACTS_PATH = "/Contact";

  private final ApiRequestExecutor apiRequestExecutor;
  private final ObjectMapper objectMapper;

  public ContactService(ApiRequestExecutor apiRequestExecutor, ObjectMapper objectMapper) {
    this.apiRequestExecutor = apiRequestExecutor;
    this.objectMapper = objectMapper;
  }

  public ArrayNode listContacts(ContactQuery query, int maxItems) {
    var path = query.getContactType().map(ContactType::getPath).orElse(ALL_CONTACTS_PATH);

    var filters = new ArrayList<FilterClause>();
    query
        .getActive()
        .ifPresent(active -> filters.add(ODataFilters.booleanEquals("IsActive", active)));
    query.getSearch().ifPresent(term -> filters.add(ODataFilters.search("CompanyName", term)));
    var params = new HashMap<String, String>();
    ODataFilters.combine(filters).ifPresent(filter -> params.put("$filter", filter));

    var request =
        new ApiRequest.Builder()
            .method(HttpMethod.GET)
            .path(path)
            .queryParams(params)
            .cacheKey(CacheKeys.fingerprint(ResourceFamily.CONTACTS, HttpMethod.GET, path, params))
            .cacheTtl(ResourceFamily.CONTACTS.getCacheTtl())
            .build();
    return apiRequestExecutor.executePaged(request, maxItems);
  }

  public JsonNode getContact(String contactId) {
    ODataFilters.requireGuid("contact id", contactId);
    return apiRequestExecutor.execute(
        new ApiRequest.Builder()
            .method(HttpMethod.GET)
            .path(ALL_CONTACTS_PATH + "/" + contactId)
            .build());
  }

  /** Creates a customer or supplier and drops every cached contact listing. */
  public JsonNode createContact(NewContact contact) {
    if (contact.getDisplayName().isBlank()) {
      throw new ValidationException("Contact display name must not be blank");
    }

    var body = objectMapper.createObjectNode();
    body.put("CompanyName", contact.getDisplayName());
    body.put("IsIndividual", false);

    var address = objectMapper.createObjectNode();
    contact.getEmail().ifPresent(email -> address.put("Email", email));
    contact.getPhone().ifPresent(phone -> address.put("Phone1", phone));
    contact
        .getAddress()
        .ifPresent(
            postal -> {
              postal.getStreet().ifPresent(v -> address.put("Street", v));
              postal.getCity().ifPresent(v -> address.put("City", v));
              postal.getState().ifPresent(v -> address.put("State", v));
              postal.getPostcode().ifPresent(v -> address.put("PostCode", v));
              postal.getCountry().ifPresent(v -> address.put("Country", v));
            });
    if (!address.isEmpty()) {
      address.put("Location", 1);
      body.putArray("Addresses").add(address);
    }

    log.info("Creating {} contact", contact.getContactType());
    return apiRequestExecutor.execute(
        new ApiRequest.Builder()
            .method(HttpMethod.POST)
            .path(contact.getContactType().getPath())
            .body(body)
            .addInvalidates(ResourceFamily.CONTACTS)
            .build());
  }
}
