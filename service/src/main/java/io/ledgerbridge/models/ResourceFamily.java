package io.ledgerbridge.models;

import java.time.Duration;

/**
 * Remote entities that share cache keys. A mutation on a family drops every cached read of that
 * family.
 */
public enum ResourceFamily {
  CONTACTS("contacts", Duration.ofMinutes(15)),
  INVOICES("invoices", Duration.ofMinutes(5)),
  ACCOUNTS("accounts", Duration.ofMinutes(30)),
  TAX_CODES("tax_codes", Duration.ofMinutes(30)),
  COMPANY_FILES("company_files", Duration.ofHours(1));

  private final String cachePrefix;
  private final Duration cacheTtl;

  ResourceFamily(String cachePrefix, Duration cacheTtl) {
    this.cachePrefix = cachePrefix;
    this.cacheTtl = cacheTtl;
  }

  /** Every cache key of this family starts with this prefix. */
  public String getCachePrefix() {
    return cachePrefix + ":";
  }

  public Duration getCacheTtl() {
    return cacheTtl;
  }
}
