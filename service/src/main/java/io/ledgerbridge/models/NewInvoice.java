package io.ledgerbridge.models;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/** An item sale invoice as accepted by the create operation. */
@Value.Immutable
@JsonSerialize(as = ImmutableNewInvoice.class)
@JsonDeserialize(as = ImmutableNewInvoice.class)
public interface NewInvoice {
  String getCustomerId();

  String getDate();

  String getDueDate();

  List<InvoiceLine> getLines();

  Optional<String> getReference();

  Optional<String> getNotes();

  class Builder extends ImmutableNewInvoice.Builder {}
}
