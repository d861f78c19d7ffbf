package com.ledgersync.normalize;

import com.ledgersync.model.TransactionSource;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

@Component
public class StripeNormalizer {
  static final String DEFAULT_PAYMENT_METHOD = "Stripe";

  // Bank debits are negative cents upstream; the ledger records spending as positive dollars.
  public NormalizedLineItem normalize(StripeRecord record) {
    BigDecimal amount = record.amountCents()
        .negate()
        .movePointLeft(2)
        .setScale(FieldValidator.AMOUNT_SCALE, RoundingMode.HALF_UP);
    String paymentMethod = record.accountDisplayName() == null || record.accountDisplayName().isBlank()
        ? DEFAULT_PAYMENT_METHOD
        : record.accountDisplayName();
    return new NormalizedLineItem(
        TransactionSource.STRIPE,
        record.sourceId(),
        record.occurredAt(),
        record.description(),
        paymentMethod,
        record.description(),
        amount);
  }
}
