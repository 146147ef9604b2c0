package io.ledgerbridge.models;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableContactAddress.class)
@JsonDeserialize(as = ImmutableContactAddress.class)
public interface ContactAddress {
  Optional<String> getStreet();

  Optional<String> getCity();

  Optional<String> getState();

  Optional<String> getPostcode();

  Optional<String> getCountry();

  class Builder extends ImmutableContactAddress.Builder {}
}
