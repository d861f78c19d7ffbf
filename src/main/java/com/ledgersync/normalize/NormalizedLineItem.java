package com.ledgersync.normalize;

import com.ledgersync.model.TransactionSource;
import java.math.BigDecimal;
import java.time.Instant;

public record NormalizedLineItem(
    TransactionSource source,
    String sourceId,
    Instant date,
    String responsibleParty,
    String paymentMethod,
    String description,
    BigDecimal amount) {

  private static final String LEGACY_ID_PREFIX = "line_item_";

  public String legacyId() {
    return legacyIdFor(sourceId);
  }

  public static String legacyIdFor(String sourceId) {
    return LEGACY_ID_PREFIX + sourceId;
  }
}
