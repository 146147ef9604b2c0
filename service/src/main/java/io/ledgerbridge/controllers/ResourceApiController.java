package io.ledgerbridge.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import io.ledgerbridge.models.ContactQuery;
import io.ledgerbridge.models.ContactType;
import io.ledgerbridge.models.InvoiceQuery;
import io.ledgerbridge.models.NewContact;
import io.ledgerbridge.models.NewInvoice;
import io.ledgerbridge.services.AccountService;
import io.ledgerbridge.services.CompanyFileService;
import io.ledgerbridge.services.ContactService;
import io.ledgerbridge.services.InvoiceService;
import java.util.Optional;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public record ResourceApiController(
    CompanyFileService companyFileService,
    ContactService contactService,
    InvoiceService invoiceService,
    AccountService accountService) {

  @GetMapping("/company-files")
  public ResponseEntity<JsonNode> listCompanyFiles() {
    return ResponseEntity.ok(companyFileService.listCompanyFiles());
  }

  @GetMapping("/contacts")
  public ResponseEntity<JsonNode> listContacts(
      @RequestParam Optional<ContactType> contactType,
      @RequestParam Optional<Boolean> active,
      @RequestParam Optional<String> search,
      @RequestParam(defaultValue = "0") int maxItems) {
    var query =
        new ContactQuery.Builder().contactType(contactType).active(active).search(search).build();
    return ResponseEntity.ok(contactService.listContacts(query, maxItems));
  }

  @GetMapping("/contacts/{contactId}")
  public ResponseEntity<JsonNode> getContact(@PathVariable String contactId) {
    return ResponseEntity.ok(contactService.getContact(contactId));
  }

  @PostMapping("/contacts")
  public ResponseEntity<JsonNode> createContact(@RequestBody NewContact contact) {
    return ResponseEntity.status(HttpStatus.CREATED).body(contactService.createContact(contact));
  }

  @GetMapping("/invoices")
  public ResponseEntity<JsonNode> listInvoices(
      @RequestParam Optional<String> dateFrom,
      @RequestParam Optional<String> dateTo,
      @RequestParam Optional<String> status,
      @RequestParam Optional<String> customerId,
      @RequestParam(defaultValue = "0") int maxItems) {
    var query =
        new InvoiceQuery.Builder()
            .dateFrom(dateFrom)
            .dateTo(dateTo)
            .status(status)
            .customerId(customerId)
            .build();
    return ResponseEntity.ok(invoiceService.listInvoices(query, maxItems));
  }

  @GetMapping("/invoices/{invoiceId}")
  public ResponseEntity<JsonNode> getInvoice(@PathVariable String invoiceId) {
    return ResponseEntity.ok(invoiceService.getInvoice(invoiceId));
  }

  @PostMapping("/invoices")
  public ResponseEntity<JsonNode> createInvoice(@RequestBody NewInvoice invoice) {
    return ResponseEntity.status(HttpStatus.CREATED).body(invoiceService.createInvoice(invoice));
  }

  @GetMapping("/accounts")
  public ResponseEntity<JsonNode> listAccounts(
      @RequestParam(required = false) String type,
      @RequestParam(required = false) Boolean active,
      @RequestParam(defaultValue = "0") int maxItems) {
    return ResponseEntity.ok(accountService.listAccounts(type, active, maxItems));
  }

  @GetMapping("/accounts/{accountId}")
  public ResponseEntity<JsonNode> getAccount(@PathVariable String accountId) {
    return ResponseEntity.ok(accountService.getAccount(accountId));
  }

  @GetMapping("/tax-codes")
  public ResponseEntity<JsonNode> listTaxCodes() {
    return ResponseEntity.ok(accountService.listTaxCodes());
  }
}
