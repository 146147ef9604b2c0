package io.ledgerbridge.models;

import org.immutables.value.Value;

/**
 * One validated fragment of a {@code $filter} expression. Only built by {@link
 * io.ledgerbridge.util.ODataFilters}, so the literal inside {@link #getExpression()} is always
 * escaped or format checked.
 */
@Value.Immutable
public interface FilterClause {
  String getField();

  FilterOperator getOperator();

  /** The logical value before quoting or escaping. */
  String getValue();

  String getExpression();

  class Builder extends ImmutableFilterClause.Builder {}
}
