package com.ledgersync.normalize;

import com.ledgersync.model.TransactionSource;
import java.time.Instant;
import java.util.Map;

public sealed interface RawRecord permits StripeRecord, VenmoRecord, SplitwiseRecord, CashRecord {
  TransactionSource source();

  String sourceId();

  Instant occurredAt();

  Map<String, Object> document();

  <R> R accept(Visitor<R> visitor);

  interface Visitor<R> {
    R visitStripe(StripeRecord record);

    R visitVenmo(VenmoRecord record);

    R visitSplitwise(SplitwiseRecord record);

    R visitCash(CashRecord record);
  }
}
