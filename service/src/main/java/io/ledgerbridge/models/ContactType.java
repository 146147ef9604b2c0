package io.ledgerbridge.models;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ContactType {
  @JsonProperty("Customer")
  CUSTOMER("/Contact/Customer"),
  @JsonProperty("Supplier")
  SUPPLIER("/Contact/Supplier");

  private final String path;

  ContactType(String path) {
    this.path = path;
  }

  public String getPath() {
    return path;
  }
}
