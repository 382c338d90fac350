package com.flamingo.ai.chunkgate.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.flamingo.ai.chunkgate.domain.enums.MetadataKind;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Tagged chunk metadata value. Raw values are classified once, when the value is created, so read
 * sites use the typed accessors instead of probing runtime types.
 *
 * <p>Local date-times are interpreted as UTC.
 */
public record MetadataValue(MetadataKind kind, @JsonValue Object value) {

  public MetadataValue {
    if (kind == null) {
      throw new IllegalArgumentException("Metadata kind is required");
    }
  }

  public static MetadataValue ofInteger(int value) {
    return new MetadataValue(MetadataKind.INTEGER, value);
  }

  public static MetadataValue ofString(String value) {
    return new MetadataValue(MetadataKind.STRING, value);
  }

  public static MetadataValue ofTimestamp(Instant value) {
    return new MetadataValue(MetadataKind.TIMESTAMP, value);
  }

  /**
   * Classifies a raw value.
   *
   * @param raw any value, possibly null
   * @return the tagged value; unknown types become {@link MetadataKind#OTHER}
   */
  public static MetadataValue of(Object raw) {
    if (raw instanceof MetadataValue value) {
      return value;
    }
    if (raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
      return ofInteger(((Number) raw).intValue());
    }
    if (raw instanceof Long longValue
        && longValue >= Integer.MIN_VALUE
        && longValue <= Integer.MAX_VALUE) {
      return ofInteger(longValue.intValue());
    }
    if (raw instanceof CharSequence text) {
      return ofString(text.toString());
    }
    if (raw instanceof Instant instant) {
      return ofTimestamp(instant);
    }
    if (raw instanceof OffsetDateTime offsetDateTime) {
      return ofTimestamp(offsetDateTime.toInstant());
    }
    if (raw instanceof ZonedDateTime zonedDateTime) {
      return ofTimestamp(zonedDateTime.toInstant());
    }
    if (raw instanceof LocalDateTime localDateTime) {
      return ofTimestamp(localDateTime.toInstant(ZoneOffset.UTC));
    }
    if (raw instanceof Date date) {
      return ofTimestamp(date.toInstant());
    }
    return new MetadataValue(MetadataKind.OTHER, raw);
  }

  /**
   * Classifies a value decoded from JSON. Strings holding an ISO-8601 instant become timestamps;
   * everything else follows {@link #of(Object)}.
   */
  public static MetadataValue fromJson(Object raw) {
    if (raw instanceof String text && looksLikeTimestamp(text)) {
      try {
        return ofTimestamp(OffsetDateTime.parse(text).toInstant());
      } catch (DateTimeParseException e) {
        return ofString(text);
      }
    }
    return of(raw);
  }

  public OptionalInt asInteger() {
    return kind == MetadataKind.INTEGER ? OptionalInt.of((Integer) value) : OptionalInt.empty();
  }

  public Optional<Instant> asTimestamp() {
    return kind == MetadataKind.TIMESTAMP ? Optional.of((Instant) value) : Optional.empty();
  }

  /** Text form of the value; empty for null. */
  public String asText() {
    return value == null ? "" : value.toString();
  }

  private static boolean looksLikeTimestamp(String text) {
    return text.length() >= 20 && Character.isDigit(text.charAt(0)) && text.indexOf('T') == 10;
  }
}
