package com.ledgersync.normalize;

import com.ledgersync.config.SyncProperties;
import com.ledgersync.model.TransactionSource;
import java.math.BigDecimal;
import org.springframework.stereotype.Component;

@Component
public class VenmoNormalizer {
  static final String PAYMENT_METHOD = "Venmo";
  private static final String PAY = "pay";
  private static final String CHARGE = "charge";

  private final String ownerFirstName;

  public VenmoNormalizer(SyncProperties properties) {
    this.ownerFirstName = properties.ownerFirstName();
  }

  // Money the owner sent stays positive; money received is negated.
  public NormalizedLineItem normalize(VenmoRecord record) {
    String counterparty;
    BigDecimal amount;
    if (isOwner(record.actorFirstName()) && PAY.equals(record.paymentType())) {
      counterparty = record.targetFirstName();
      amount = record.amount();
    } else if (isOwner(record.targetFirstName()) && CHARGE.equals(record.paymentType())) {
      counterparty = record.actorFirstName();
      amount = record.amount();
    } else {
      counterparty = isOwner(record.targetFirstName()) ? record.actorFirstName() : record.targetFirstName();
      amount = record.amount().negate();
    }
    return new NormalizedLineItem(
        TransactionSource.VENMO,
        record.sourceId(),
        record.occurredAt(),
        counterparty,
        PAYMENT_METHOD,
        record.note(),
        amount);
  }

  public String counterparty(VenmoRecord record) {
    return isOwner(record.actorFirstName()) ? record.targetFirstName() : record.actorFirstName();
  }

  private boolean isOwner(String firstName) {
    return firstName != null && firstName.equalsIgnoreCase(ownerFirstName);
  }
}
