package io.ledgerbridge.models;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableNewContact.class)
@JsonDeserialize(as = ImmutableNewContact.class)
public interface NewContact {
  String getDisplayName();

  ContactType getContactType();

  Optional<String> getEmail();

  Optional<String> getPhone();

  Optional<ContactAddress> getAddress();

  class Builder extends ImmutableNewContact.Builder {}
}
