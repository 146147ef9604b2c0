package io.ledgerbridge.controllers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.ledgerbridge.BaseTest;
import io.ledgerbridge.models.ContactQuery;
import io.ledgerbridge.models.ContactType;
import io.ledgerbridge.models.InvoiceQuery;
import io.ledgerbridge.models.NewContact;
import io.ledgerbridge.models.NewInvoice;
import io.ledgerbridge.services.AccountService;
import io.ledgerbridge.services.CompanyFileService;
import io.ledgerbridge.services.ContactService;
import io.ledgerbridge.services.InvoiceService;
import java.math.BigDecimal;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@AutoConfigureMockMvc
class ResourceApiControllerTest extends BaseTest {
  @Autowired private MockMvc mvc;
  @Autowired private ObjectMapper mapper;

  @MockBean private CompanyFileService companyFileServiceMock;
  @MockBean private ContactService contactServiceMock;
  @MockBean private InvoiceService invoiceServiceMock;
  @MockBean private AccountService accountServiceMock;

  @Test
  void testListCompanyFiles() throws Exception {
    when(companyFileServiceMock.listCompanyFiles())
        .thenReturn(mapper.createArrayNode().add(mapper.createObjectNode().put("Name", "Demo")));

    mvc.perform(get("/api/company-files"))
        .andExpect(status().isOk())
        .andExpect(content().json("[{\"Name\":\"Demo\"}]"));
  }

  @Nested
  class Contacts {
    @Test
    void testListContactsQuery() throws Exception {
      when(contactServiceMock.listContacts(any(), eq(25))).thenReturn(mapper.createArrayNode());

      mvc.perform(
              get("/api/contacts")
                  .param("contactType", "SUPPLIER")
                  .param("active", "true")
                  .param("search", "acme")
                  .param("maxItems", "25"))
          .andExpect(status().isOk());

      var expected =
          new ContactQuery.Builder()
              .contactType(ContactType.SUPPLIER)
              .active(true)
              .search("acme")
              .build();
      verify(contactServiceMock).listContacts(expected, 25);
    }

    @Test
    void testUnknownContactType() throws Exception {
      mvc.perform(get("/api/contacts").param("contactType", "PARTNER"))
          .andExpect(status().isBadRequest());
    }

    @Test
    void testCreateContact() throws Exception {
      when(contactServiceMock.createContact(any())).thenReturn(mapper.createObjectNode());

      mvc.perform(
              post("/api/contacts")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(
                      """
                      {"displayName":"Acme Pty Ltd","contactType":"Customer",
                       "email":"accounts@acme.example"}"""))
          .andExpect(status().isCreated());

      var captor = ArgumentCaptor.forClass(NewContact.class);
      verify(contactServiceMock).createContact(captor.capture());
      var contact = captor.getValue();
      assertEquals(ContactType.CUSTOMER, contact.getContactType());
      assertEquals(
          "accounts@acme.example", contact.getEmail().orElseThrow());
    }
  }

  @Nested
  class Invoices {
    @Test
    void testListInvoicesQuery() throws Exception {
      when(invoiceServiceMock.listInvoices(any(), eq(0))).thenReturn(mapper.createArrayNode());

      mvc.perform(get("/api/invoices").param("dateFrom", "2024-01-01").param("status", "Open"))
          .andExpect(status().isOk());

      verify(invoiceServiceMock)
          .listInvoices(
              new InvoiceQuery.Builder().dateFrom("2024-01-01").status("Open").build(), 0);
    }

    @Test
    void testCreateInvoice() throws Exception {
      when(invoiceServiceMock.createInvoice(any())).thenReturn(mapper.createObjectNode());

      mvc.perform(
              post("/api/invoices")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(
                      """
                      {"customerId":"11111111-2222-4333-8444-555555555555",
                       "date":"2024-03-01","dueDate":"2024-03-31",
                       "lines":[{"description":"Consulting","quantity":2,"unitPrice":150.00,
                                 "accountId":"66666666-7777-4888-9999-aaaaaaaaaaaa"}]}"""))
          .andExpect(status().isCreated());

      var captor = ArgumentCaptor.forClass(NewInvoice.class);
      verify(invoiceServiceMock).createInvoice(captor.capture());
      assertEquals(
          0, new BigDecimal("150").compareTo(captor.getValue().getLines().get(0).getUnitPrice()));
    }

    @Test
    void testCreateInvoiceMissingField() throws Exception {
      mvc.perform(
              post("/api/invoices")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"customerId\":\"11111111-2222-4333-8444-555555555555\"}"))
          .andExpect(status().isBadRequest());
    }
  }

  @Test
  void testListAccounts() throws Exception {
    when(accountServiceMock.listAccounts("Income", null, 0)).thenReturn(mapper.createArrayNode());

    mvc.perform(get("/api/accounts").param("type", "Income")).andExpect(status().isOk());

    verify(accountServiceMock).listAccounts("Income", null, 0);
  }
}
