package com.ledgersync.normalize;

import com.ledgersync.exception.InvalidAmountException;
import com.ledgersync.exception.InvalidDateException;
import com.ledgersync.exception.MissingFieldException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

public final class FieldValidator {
  public static final int AMOUNT_SCALE = 2;
  private static final int AMOUNT_INTEGER_DIGITS = 10;
  private static final int POSIX_INTEGER_DIGITS = 12;
  private static final int MAX_FRACTION_DIGITS = 18;
  private static final Pattern POSIX_TEXT = Pattern.compile("\\d+(\\.\\d+)?");

  private FieldValidator() {
  }

  /**
   * Returns the value of {@code field}, failing when it is absent or empty. Null, blank strings,
   * {@code false} and empty collections count as empty; numbers, zero included, do not.
   */
  public static Object requireField(Map<String, ?> record, String field, String context) {
    if (record == null || !record.containsKey(field)) {
      throw new MissingFieldException(field, context);
    }
    Object value = record.get(field);
    if (isEmpty(value)) {
      throw new MissingFieldException(field, context);
    }
    return value;
  }

  public static String requireText(Map<String, ?> record, String field, String context) {
    return String.valueOf(requireField(record, field, context)).trim();
  }

  public static Map<String, Object> requireObject(Map<String, ?> record, String field, String context) {
    Object value = requireField(record, field, context);
    if (!(value instanceof Map<?, ?> nested)) {
      throw new MissingFieldException(field, context);
    }
    return fieldsOf(nested);
  }

  public static Map<String, Object> fieldsOf(Map<?, ?> nested) {
    Map<String, Object> fields = new LinkedHashMap<>();
    nested.forEach((key, item) -> fields.put(String.valueOf(key), item));
    return fields;
  }

  public static String optionalText(Map<String, ?> record, String field) {
    if (record == null) {
      return null;
    }
    Object value = record.get(field);
    if (isEmpty(value)) {
      return null;
    }
    return String.valueOf(value).trim();
  }

  public static BigDecimal validateAmount(Object value, String field) {
    return validateAmount(value, field, true);
  }

  public static BigDecimal validateAmount(Object value, String field, boolean allowNegative) {
    if (value == null || value instanceof Boolean) {
      throw new InvalidAmountException(field, value, "not a number");
    }
    BigDecimal amount;
    try {
      if (value instanceof BigDecimal decimal) {
        amount = decimal;
      } else if (value instanceof Number number) {
        amount = new BigDecimal(number.toString());
      } else {
        amount = new BigDecimal(value.toString().trim());
      }
    } catch (NumberFormatException ex) {
      throw new InvalidAmountException(field, value, ex);
    }
    if (!allowNegative && amount.signum() < 0) {
      throw new InvalidAmountException(field, value, "negative amount not allowed");
    }
    if (integerDigits(amount) > AMOUNT_INTEGER_DIGITS) {
      throw new InvalidAmountException(field, value, "exceeds " + AMOUNT_INTEGER_DIGITS + " integer digits");
    }
    if (amount.scale() > MAX_FRACTION_DIGITS) {
      throw new InvalidAmountException(field, value, "more than " + MAX_FRACTION_DIGITS + " decimal places");
    }
    BigDecimal scaled = amount.setScale(AMOUNT_SCALE, RoundingMode.HALF_UP);
    if (integerDigits(scaled) > AMOUNT_INTEGER_DIGITS) {
      throw new InvalidAmountException(field, value, "exceeds " + AMOUNT_INTEGER_DIGITS + " integer digits");
    }
    return scaled;
  }

  public static Instant validatePosixTimestamp(Object value, String field) {
    if (value == null || value instanceof Boolean) {
      throw new InvalidDateException(field, value);
    }
    BigDecimal seconds;
    try {
      seconds = value instanceof Number number
          ? new BigDecimal(number.toString())
          : new BigDecimal(value.toString().trim());
    } catch (NumberFormatException ex) {
      throw new InvalidDateException(field, value, ex);
    }
    if (seconds.signum() < 0 || integerDigits(seconds) > POSIX_INTEGER_DIGITS || seconds.scale() > MAX_FRACTION_DIGITS) {
      throw new InvalidDateException(field, value);
    }
    try {
      long millis = seconds.movePointRight(3).setScale(0, RoundingMode.HALF_UP).longValueExact();
      return Instant.ofEpochMilli(millis);
    } catch (ArithmeticException ex) {
      throw new InvalidDateException(field, value, ex);
    }
  }

  public static Instant validateDate(Object value, String field, ZoneId zone) {
    if (value instanceof Number) {
      return validatePosixTimestamp(value, field);
    }
    if (value instanceof Instant instant) {
      return instant;
    }
    if (value instanceof Date date) {
      return date.toInstant();
    }
    if (!(value instanceof CharSequence)) {
      throw new InvalidDateException(field, value);
    }
    String text = value.toString().trim();
    if (text.isEmpty()) {
      throw new InvalidDateException(field, value);
    }
    if (POSIX_TEXT.matcher(text).matches()) {
      return validatePosixTimestamp(text, field);
    }
    try {
      if (text.length() == 10) {
        return LocalDate.parse(text).atStartOfDay(zone).toInstant();
      }
      if (text.endsWith("Z") || text.endsWith("z")) {
        return Instant.parse(text.toUpperCase());
      }
      try {
        return OffsetDateTime.parse(text).toInstant();
      } catch (DateTimeParseException ignored) {
        return LocalDateTime.parse(text).atZone(zone).toInstant();
      }
    } catch (DateTimeParseException ex) {
      throw new InvalidDateException(field, value, ex);
    }
  }

  // long arithmetic: precision and scale are ints and the difference can overflow
  private static long integerDigits(BigDecimal value) {
    return (long) value.precision() - value.scale();
  }

  private static boolean isEmpty(Object value) {
    if (value == null) {
      return true;
    }
    if (value instanceof CharSequence text) {
      return text.toString().isBlank();
    }
    if (value instanceof Boolean flag) {
      return !flag;
    }
    if (value instanceof Collection<?> collection) {
      return collection.isEmpty();
    }
    if (value instanceof Map<?, ?> map) {
      return map.isEmpty();
    }
    return false;
  }
}
