package com.ledgersync.reconcile;

import java.util.List;

public record VerificationReport(VerificationMode mode, List<StageResult> stages) {
  public VerificationReport {
    stages = List.copyOf(stages);
  }

  public boolean passed() {
    return stages.stream().allMatch(StageResult::passed);
  }

  public int exitCode() {
    return passed() ? 0 : 1;
  }
}
