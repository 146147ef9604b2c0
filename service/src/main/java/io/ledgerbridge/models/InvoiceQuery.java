package io.ledgerbridge.models;

import java.util.Optional;
import org.immutables.value.Value;

@Value.Immutable
public interface InvoiceQuery {
  /** Inclusive, {@code YYYY-MM-DD}. */
  Optional<String> getDateFrom();

  /** Inclusive, {@code YYYY-MM-DD}. */
  Optional<String> getDateTo();

  /** Backend status name, e.g. {@code Open} or {@code Closed}. */
  Optional<String> getStatus();

  Optional<String> getCustomerId();

  class Builder extends ImmutableInvoiceQuery.Builder {}
}
