package com.ledgersync.reconcile;

import com.ledgersync.model.TransactionSource;
import com.ledgersync.store.LineItemSnapshot;
import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(2)
public class TransactionsStage implements ReconciliationStage {
  @Override
  public String name() {
    return "transactions & line items";
  }

  @Override
  public void run(VerificationContext context, StageRecorder recorder) {
    Map<TransactionSource, Long> legacyCounts = context.legacy().transactionCounts();
    Map<TransactionSource, Long> relationalCounts = context.relational().transactionCounts();
    for (TransactionSource source : TransactionSource.values()) {
      recorder.expectEqual(source + " transaction count",
          legacyCounts.getOrDefault(source, 0L),
          relationalCounts.getOrDefault(source, 0L));
    }

    Map<String, LineItemSnapshot> legacy = context.legacy().lineItems();
    Map<String, LineItemSnapshot> relational = context.relational().lineItems();
    recorder.expectEqual("line item count", legacy.size(), relational.size());

    for (String key : context.select(legacy.keySet())) {
      LineItemSnapshot relationalItem = relational.get(key);
      if (relationalItem == null) {
        recorder.fail("line item " + key + " missing from relational store");
        continue;
      }
      compare(key, legacy.get(key), relationalItem, recorder);
    }
    if (context.mode() == VerificationMode.THOROUGH) {
      for (String key : relational.keySet()) {
        if (!legacy.containsKey(key)) {
          recorder.fail("line item " + key + " only in relational store");
        }
      }
    }
  }

  private static void compare(String key, LineItemSnapshot legacy, LineItemSnapshot relational, StageRecorder recorder) {
    StringBuilder diff = new StringBuilder();
    if (!Objects.equals(legacy.date(), relational.date())) {
      diff.append(" date ").append(legacy.date()).append(" != ").append(relational.date());
    }
    if (!sameAmount(legacy.amount(), relational.amount())) {
      diff.append(" amount ").append(legacy.amount()).append(" != ").append(relational.amount());
    }
    if (!Objects.equals(legacy.description(), relational.description())) {
      diff.append(" description '").append(legacy.description()).append("' != '")
          .append(relational.description()).append("'");
    }
    if (!Objects.equals(legacy.paymentMethod(), relational.paymentMethod())) {
      diff.append(" payment method ").append(legacy.paymentMethod()).append(" != ").append(relational.paymentMethod());
    }
    if (!Objects.equals(legacy.responsibleParty(), relational.responsibleParty())) {
      diff.append(" responsible party ").append(legacy.responsibleParty()).append(" != ")
          .append(relational.responsibleParty());
    }
    if (diff.length() == 0) {
      recorder.pass("line item " + key);
    } else {
      recorder.fail("line item " + key + ":" + diff);
    }
  }

  private static boolean sameAmount(BigDecimal left, BigDecimal right) {
    if (left == null || right == null) {
      return left == right;
    }
    return left.compareTo(right) == 0;
  }
}
