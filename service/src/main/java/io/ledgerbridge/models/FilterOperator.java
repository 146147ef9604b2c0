package io.ledgerbridge.models;

public enum FilterOperator {
  EQ("eq"),
  NE("ne"),
  GT("gt"),
  GE("ge"),
  LT("lt"),
  LE("le"),
  CONTAINS("substringof");

  private final String token;

  FilterOperator(String token) {
    this.token = token;
  }

  public String getToken() {
    return token;
  }
}
