package com.ledgersync.normalize;

import com.ledgersync.config.SyncProperties;
import com.ledgersync.exception.MissingFieldException;
import com.ledgersync.model.TransactionSource;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

@Component
public class SplitwiseNormalizer {
  static final String PAYMENT_METHOD = "Splitwise";

  private final String ownerFirstName;

  public SplitwiseNormalizer(SyncProperties properties) {
    this.ownerFirstName = properties.ownerFirstName();
  }

  // The owner's balance is positive when owed money, so the ledger amount is its negation.
  public NormalizedLineItem normalize(SplitwiseRecord record) {
    SplitwiseRecord.Participant owner = record.users().stream()
        .filter(user -> isOwner(user.firstName()))
        .findFirst()
        .orElseThrow(() -> new MissingFieldException("users[" + ownerFirstName + "]",
            "splitwise expense " + record.sourceId()));
    return new NormalizedLineItem(
        TransactionSource.SPLITWISE,
        record.sourceId(),
        record.occurredAt(),
        responsibleParty(record),
        PAYMENT_METHOD,
        record.description(),
        owner.netBalance().negate());
  }

  public String responsibleParty(SplitwiseRecord record) {
    return record.users().stream()
        .map(SplitwiseRecord.Participant::firstName)
        .filter(name -> !isOwner(name))
        .collect(Collectors.joining(", "));
  }

  private boolean isOwner(String firstName) {
    return firstName != null && firstName.equalsIgnoreCase(ownerFirstName);
  }
}
