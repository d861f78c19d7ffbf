package com.ledgersync.normalize;

import com.ledgersync.model.TransactionSource;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

public record CashRecord(
    String sourceId,
    Instant occurredAt,
    String person,
    String description,
    BigDecimal amount,
    Map<String, Object> document) implements RawRecord {

  @Override
  public TransactionSource source() {
    return TransactionSource.CASH;
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitCash(this);
  }
}
