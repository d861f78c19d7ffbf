package com.ledgersync.normalize;

import com.ledgersync.model.TransactionSource;
import org.springframework.stereotype.Component;

@Component
public class CashNormalizer {
  static final String PAYMENT_METHOD = "Cash";

  public NormalizedLineItem normalize(CashRecord record) {
    return new NormalizedLineItem(
        TransactionSource.CASH,
        record.sourceId(),
        record.occurredAt(),
        record.person(),
        PAYMENT_METHOD,
        record.description(),
        record.amount());
  }
}
