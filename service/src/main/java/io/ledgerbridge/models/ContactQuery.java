package io.ledgerbridge.models;

import java.util.Optional;
import org.immutables.value.Value;

@Value.Immutable
public interface ContactQuery {
  /** Empty lists customers and suppliers together. */
  Optional<ContactType> getContactType();

  Optional<Boolean> getActive();

  /** Case insensitive substring of the company name. */
  Optional<String> getSearch();

  class Builder extends ImmutableContactQuery.Builder {}
}
