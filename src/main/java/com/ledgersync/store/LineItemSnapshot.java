package com.ledgersync.store;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

public record LineItemSnapshot(
    String legacyId,
    Instant date,
    BigDecimal amount,
    String description,
    String paymentMethod,
    String responsibleParty) {

  public LineItemSnapshot {
    amount = amount == null ? null : amount.setScale(2, RoundingMode.HALF_UP);
    date = date == null ? null : date.truncatedTo(ChronoUnit.MILLIS);
  }
}
