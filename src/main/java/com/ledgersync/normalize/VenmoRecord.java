package com.ledgersync.normalize;

import com.ledgersync.model.TransactionSource;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

public record VenmoRecord(
    String sourceId,
    Instant occurredAt,
    String actorFirstName,
    String targetFirstName,
    String paymentType,
    String note,
    BigDecimal amount,
    Map<String, Object> document) implements RawRecord {

  @Override
  public TransactionSource source() {
    return TransactionSource.VENMO;
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitVenmo(this);
  }
}
