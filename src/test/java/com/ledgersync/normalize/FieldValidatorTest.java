package com.ledgersync.normalize;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ledgersync.exception.InvalidAmountException;
import com.ledgersync.exception.InvalidDateException;
import com.ledgersync.exception.MissingFieldException;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class FieldValidatorTest {

  @Nested
  @DisplayName("requireField")
  class RequireField {
    @Test
    void returnsPresentValue() {
      assertThat(FieldValidator.requireField(Map.of("note", "pizza"), "note", "venmo")).isEqualTo("pizza");
    }

    @Test
    void zeroCountsAsPresent() {
      assertThat(FieldValidator.requireField(Map.of("amount", 0), "amount", "cash")).isEqualTo(0);
    }

    @Test
    void rejectsAbsentField() {
      assertThatThrownBy(() -> FieldValidator.requireField(Map.of(), "amount", "cash transaction"))
          .isInstanceOf(MissingFieldException.class)
          .hasMessageContaining("amount")
          .hasMessageContaining("cash transaction");
    }

    @Test
    void rejectsEmptyValues() {
      Map<String, Object> record = new HashMap<>();
      record.put("nothing", null);
      record.put("blank", "   ");
      record.put("flag", false);
      record.put("list", List.of());

      for (String field : List.of("nothing", "blank", "flag", "list")) {
        assertThatThrownBy(() -> FieldValidator.requireField(record, field, "doc"))
            .isInstanceOf(MissingFieldException.class);
      }
    }
  }

  @Nested
  @DisplayName("validateAmount")
  class ValidateAmount {
    @Test
    void scalesToTwoDecimals() {
      assertThat(FieldValidator.validateAmount("42.5", "amount")).isEqualTo(new BigDecimal("42.50"));
      assertThat(FieldValidator.validateAmount(10.005, "amount")).isEqualTo(new BigDecimal("10.01"));
    }

    @Test
    void acceptsNegativeByDefault() {
      assertThat(FieldValidator.validateAmount(-12, "net_balance")).isEqualTo(new BigDecimal("-12.00"));
    }

    @Test
    void rejectsNegativeWhenDisallowed() {
      assertThatThrownBy(() -> FieldValidator.validateAmount("-1", "amount", false))
          .isInstanceOf(InvalidAmountException.class);
    }

    @Test
    void rejectsNonNumericText() {
      assertThatThrownBy(() -> FieldValidator.validateAmount("twelve", "amount"))
          .isInstanceOf(InvalidAmountException.class);
    }

    @Test
    void rejectsBooleans() {
      assertThatThrownBy(() -> FieldValidator.validateAmount(true, "amount"))
          .isInstanceOf(InvalidAmountException.class);
    }

    @Test
    void rejectsMoreThanTenIntegerDigits() {
      assertThat(FieldValidator.validateAmount("9999999999.99", "amount")).isEqualByComparingTo("9999999999.99");
      assertThatThrownBy(() -> FieldValidator.validateAmount("10000000000", "amount"))
          .isInstanceOf(InvalidAmountException.class);
    }

    @Test
    @DisplayName("extreme exponents are rejected as invalid amounts")
    void extremeExponentsAreInvalidAmounts() {
      assertThatThrownBy(() -> FieldValidator.validateAmount("1e2147483647", "amount"))
          .isInstanceOf(InvalidAmountException.class);
      assertThatThrownBy(() -> FieldValidator.validateAmount("1e-2147483647", "amount"))
          .isInstanceOf(InvalidAmountException.class);
      assertThatThrownBy(() -> FieldValidator.validateAmount(Double.MAX_VALUE, "amount"))
          .isInstanceOf(InvalidAmountException.class);
    }

    @Test
    void smallExponentsStillRound() {
      assertThat(FieldValidator.validateAmount("1.5e1", "amount")).isEqualTo(new BigDecimal("15.00"));
      assertThat(FieldValidator.validateAmount("4e-3", "amount")).isEqualTo(new BigDecimal("0.00"));
    }
  }

  @Nested
  @DisplayName("dates")
  class Dates {
    @Test
    void posixSecondsKeepMilliseconds() {
      assertThat(FieldValidator.validatePosixTimestamp(1704412800.25, "date"))
          .isEqualTo(Instant.parse("2024-01-05T00:00:00.250Z"));
      assertThat(FieldValidator.validatePosixTimestamp("1704412800", "date"))
          .isEqualTo(Instant.parse("2024-01-05T00:00:00Z"));
    }

    @Test
    void rejectsNegativeOrGarbageTimestamps() {
      assertThatThrownBy(() -> FieldValidator.validatePosixTimestamp(-1, "date"))
          .isInstanceOf(InvalidDateException.class);
      assertThatThrownBy(() -> FieldValidator.validatePosixTimestamp("yesterday", "date"))
          .isInstanceOf(InvalidDateException.class);
    }

    @Test
    void rejectsTimestampsOutsideInstantRange() {
      assertThatThrownBy(() -> FieldValidator.validatePosixTimestamp("1e30", "date_created"))
          .isInstanceOf(InvalidDateException.class);
      assertThatThrownBy(() -> FieldValidator.validatePosixTimestamp(1e300, "date_created"))
          .isInstanceOf(InvalidDateException.class);
      assertThatThrownBy(() -> FieldValidator.validatePosixTimestamp("1e-2147483647", "date_created"))
          .isInstanceOf(InvalidDateException.class);
    }

    @Test
    void numericTextIsReadAsPosixSeconds() {
      assertThat(FieldValidator.validateDate("1704412800.0", "date", ZoneOffset.UTC))
          .isEqualTo(Instant.parse("2024-01-05T00:00:00Z"));
      assertThat(FieldValidator.validateDate(1704412800.0, "date", ZoneOffset.UTC))
          .isEqualTo(Instant.parse("2024-01-05T00:00:00Z"));
    }

    @Test
    void plainDateUsesConfiguredZone() {
      assertThat(FieldValidator.validateDate("2024-01-05", "date", ZoneOffset.UTC))
          .isEqualTo(Instant.parse("2024-01-05T00:00:00Z"));
      assertThat(FieldValidator.validateDate("2024-01-05", "date", ZoneId.of("America/New_York")))
          .isEqualTo(Instant.parse("2024-01-05T05:00:00Z"));
    }

    @Test
    void isoStringsWithAndWithoutOffset() {
      assertThat(FieldValidator.validateDate("2024-01-05T10:30:00Z", "date", ZoneOffset.UTC))
          .isEqualTo(Instant.parse("2024-01-05T10:30:00Z"));
      assertThat(FieldValidator.validateDate("2024-01-05T10:30:00+02:00", "date", ZoneOffset.UTC))
          .isEqualTo(Instant.parse("2024-01-05T08:30:00Z"));
      assertThat(FieldValidator.validateDate("2024-01-05T10:30:00", "date", ZoneOffset.UTC))
          .isEqualTo(Instant.parse("2024-01-05T10:30:00Z"));
    }

    @Test
    void rejectsUnparseableDate() {
      assertThatThrownBy(() -> FieldValidator.validateDate("05/01/2024", "date", ZoneOffset.UTC))
          .isInstanceOf(InvalidDateException.class);
    }
  }
}
