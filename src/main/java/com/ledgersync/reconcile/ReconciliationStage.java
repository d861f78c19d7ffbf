package com.ledgersync.reconcile;

public interface ReconciliationStage {
  String name();

  void run(VerificationContext context, StageRecorder recorder);
}
