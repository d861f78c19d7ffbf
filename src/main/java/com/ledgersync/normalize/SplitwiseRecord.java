package com.ledgersync.normalize;

import com.ledgersync.model.TransactionSource;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public record SplitwiseRecord(
    String sourceId,
    Instant occurredAt,
    String description,
    List<Participant> users,
    boolean deleted,
    Map<String, Object> document) implements RawRecord {

  public SplitwiseRecord {
    users = List.copyOf(users);
  }

  @Override
  public TransactionSource source() {
    return TransactionSource.SPLITWISE;
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitSplitwise(this);
  }

  public record Participant(String firstName, BigDecimal netBalance) {}
}
