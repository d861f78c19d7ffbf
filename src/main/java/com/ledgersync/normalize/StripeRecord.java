package com.ledgersync.normalize;

import com.ledgersync.model.TransactionSource;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

public record StripeRecord(
    String sourceId,
    Instant occurredAt,
    String description,
    BigDecimal amountCents,
    String accountId,
    String accountDisplayName,
    Map<String, Object> document) implements RawRecord {

  @Override
  public TransactionSource source() {
    return TransactionSource.STRIPE;
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitStripe(this);
  }
}
