package io.ledgerbridge.models;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.math.BigDecimal;
import java.util.Optional;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableInvoiceLine.class)
@JsonDeserialize(as = ImmutableInvoiceLine.class)
public interface InvoiceLine {
  String getDescription();

  BigDecimal getQuantity();

  BigDecimal getUnitPrice();

  /** Income account the line posts to. */
  String getAccountId();

  Optional<String> getTaxCodeId();

  class Builder extends ImmutableInvoiceLine.Builder {}
}
