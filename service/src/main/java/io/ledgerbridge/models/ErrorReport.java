package io.ledgerbridge.models;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableErrorReport.class)
public interface ErrorReport {
  String getMessage();

  int getStatusCode();

  class Builder extends ImmutableErrorReport.Builder {}
}
