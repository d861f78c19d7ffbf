package com.ledgersync.reconcile;

import java.util.Set;
import java.util.TreeSet;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(1)
public class ReferenceDataStage implements ReconciliationStage {
  @Override
  public String name() {
    return "reference data";
  }

  @Override
  public void run(VerificationContext context, StageRecorder recorder) {
    compare("categories", context.legacy().categoryNames(), context.relational().categoryNames(), recorder);
    compare("tags", context.legacy().tagNames(), context.relational().tagNames(), recorder);
  }

  private static void compare(String kind, Set<String> legacy, Set<String> relational, StageRecorder recorder) {
    Set<String> missing = new TreeSet<>(legacy);
    missing.removeAll(relational);
    Set<String> unexpected = new TreeSet<>(relational);
    unexpected.removeAll(legacy);
    if (missing.isEmpty() && unexpected.isEmpty()) {
      recorder.pass(legacy.size() + " " + kind + " match");
      return;
    }
    if (!missing.isEmpty()) {
      recorder.fail(kind + " missing from relational store: " + missing);
    }
    if (!unexpected.isEmpty()) {
      recorder.fail(kind + " only in relational store: " + unexpected);
    }
  }
}
