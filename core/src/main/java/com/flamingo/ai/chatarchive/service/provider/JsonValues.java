package com.flamingo.ai.chatarchive.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;

/** Typed accessors over raw export records. */
final class JsonValues {

  private static final BigDecimal NANOS_PER_SECOND = BigDecimal.valueOf(1_000_000_000L);

  private JsonValues() {}

  /** Text value of {@code field}, or {@code null} when absent, null or not a string. */
  static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value != null && value.isTextual() ? value.asText() : null;
  }

  static String requiredText(JsonNode node, String field) {
    String value = text(node, field);
    if (value == null || value.isBlank()) {
      throw new RecordRejectedException("missing required field '" + field + "'");
    }
    return value;
  }

  static boolean isPresent(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value != null && !value.isNull();
  }

  /**
   * Parses a Unix timestamp in (possibly fractional) seconds.
   *
   * @throws DateTimeException if the value is not a number or out of range
   */
  static Instant epochSeconds(JsonNode value) {
    BigDecimal seconds;
    if (value.isNumber()) {
      seconds = value.decimalValue();
    } else if (value.isTextual()) {
      try {
        seconds = new BigDecimal(value.asText().strip());
      } catch (NumberFormatException e) {
        throw new DateTimeException("not an epoch timestamp: '" + value.asText() + "'", e);
      }
    } else {
      throw new DateTimeException("not an epoch timestamp: " + value.getNodeType());
    }
    try {
      BigDecimal whole = seconds.setScale(0, RoundingMode.FLOOR);
      long nanos =
          seconds.subtract(whole).multiply(NANOS_PER_SECOND).setScale(0, RoundingMode.HALF_UP)
              .longValueExact();
      return Instant.ofEpochSecond(whole.longValueExact(), nanos);
    } catch (ArithmeticException e) {
      throw new DateTimeException("epoch timestamp out of range: " + seconds, e);
    }
  }

  /**
   * Parses an ISO-8601 timestamp that carries an offset ({@code Z} or {@code +hh:mm}).
   *
   * @throws DateTimeException if the text is not an offset date-time
   */
  static Instant isoInstant(String text) {
    return OffsetDateTime.parse(text.strip()).toInstant();
  }
}
