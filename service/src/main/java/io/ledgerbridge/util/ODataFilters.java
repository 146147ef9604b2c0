package io.ledgerbridge.util;

import io.ledgerbridge.exception.ValidationException;
import io.ledgerbridge.models.FilterClause;
import io.ledgerbridge.models.FilterOperator;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Builders for {@code $filter} clauses in the AccountRight OData dialect. Any value that ends up
 * inside a filter expression has to come through here.
 */
public final class ODataFilters {
  private static final Pattern FIELD_PATTERN =
      Pattern.compile("^[A-Za-z][A-Za-z0-9_]*(/[A-Za-z][A-Za-z0-9_]*)*$");
  private static final Pattern DATE_PATTERN = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
  private static final Pattern GUID_PATTERN =
      Pattern.compile(
          "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");
  private static final DateTimeFormatter DATE_FORMAT =
      DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);
  private static final Set<FilterOperator> COMPARATORS =
      EnumSet.of(
          FilterOperator.EQ,
          FilterOperator.NE,
          FilterOperator.GT,
          FilterOperator.GE,
          FilterOperator.LT,
          FilterOperator.LE);

  private ODataFilters() {}

  /**
   * Doubles every single quote. Not idempotent: apply exactly once to a raw value.
   *
   * @param value raw value to place between single quotes
   * @return value safe to wrap in a quoted literal
   */
  public static String escapeLiteral(String value) {
    return value.replace("'", "''");
  }

  /** Case insensitive substring match of {@code term} within {@code field}. */
  public static FilterClause search(String field, String term) {
    requireField(field);
    if (term == null || term.isBlank()) {
      throw new ValidationException("Search term for %s must not be blank".formatted(field));
    }
    var literal = escapeLiteral(term.toLowerCase(Locale.ROOT));
    return new FilterClause.Builder()
        .field(field)
        .operator(FilterOperator.CONTAINS)
        .value(term)
        .expression("substringof('%s', tolower(%s)) eq true".formatted(literal, field))
        .build();
  }

  /** Compares a date field against a strict {@code YYYY-MM-DD} calendar date. */
  public static FilterClause date(String field, FilterOperator comparator, String date) {
    requireField(field);
    requireComparator(comparator);
    requireDate(field, date);
    return new FilterClause.Builder()
        .field(field)
        .operator(comparator)
        .value(date)
        .expression("%s %s datetime'%s'".formatted(field, comparator.getToken(), date))
        .build();
  }

  /** Equality against a GUID literal. The id is embedded as given once its syntax is checked. */
  public static FilterClause identifierEquals(String field, String id) {
    requireField(field);
    requireGuid(field, id);
    return new FilterClause.Builder()
        .field(field)
        .operator(FilterOperator.EQ)
        .value(id)
        .expression("%s eq guid'%s'".formatted(field, id))
        .build();
  }

  public static FilterClause stringEquals(String field, String value) {
    requireField(field);
    if (value == null) {
      throw new ValidationException("Value for %s must not be null".formatted(field));
    }
    return new FilterClause.Builder()
        .field(field)
        .operator(FilterOperator.EQ)
        .value(value)
        .expression("%s eq '%s'".formatted(field, escapeLiteral(value)))
        .build();
  }

  public static FilterClause booleanEquals(String field, boolean value) {
    requireField(field);
    return new FilterClause.Builder()
        .field(field)
        .operator(FilterOperator.EQ)
        .value(Boolean.toString(value))
        .expression("%s eq %s".formatted(field, value))
        .build();
  }

  /**
   * Joins clauses with {@code and}.
   *
   * @return the complete filter expression, or empty when there is nothing to filter on
   */
  public static Optional<String> combine(Collection<FilterClause> clauses) {
    if (clauses.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(
        clauses.stream().map(FilterClause::getExpression).collect(Collectors.joining(" and ")));
  }

  public static Optional<String> combine(FilterClause... clauses) {
    return combine(Arrays.asList(clauses));
  }

  public static boolean isGuid(String value) {
    return value != null && GUID_PATTERN.matcher(value).matches();
  }

  public static String requireGuid(String name, String value) {
    if (!isGuid(value)) {
      throw new ValidationException(
          "Invalid identifier for %s: '%s'. Expected a GUID.".formatted(name, value));
    }
    return value;
  }

  public static String requireDate(String name, String value) {
    var message = "Invalid date format for %s: '%s'. Expected YYYY-MM-DD.".formatted(name, value);
    if (value == null || !DATE_PATTERN.matcher(value).matches()) {
      throw new ValidationException(message);
    }
    try {
      LocalDate.parse(value, DATE_FORMAT);
    } catch (DateTimeParseException e) {
      throw new ValidationException(message);
    }
    return value;
  }

  private static void requireField(String field) {
    if (field == null || !FIELD_PATTERN.matcher(field).matches()) {
      throw new ValidationException("Invalid filter field: '%s'".formatted(field));
    }
  }

  private static void requireComparator(FilterOperator operator) {
    if (!COMPARATORS.contains(operator)) {
      throw new ValidationException("%s is not a comparison operator".formatted(operator));
    }
  }
}
