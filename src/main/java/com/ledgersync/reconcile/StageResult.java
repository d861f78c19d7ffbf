package com.ledgersync.reconcile;

import java.util.List;

public record StageResult(String name, boolean passed, int checks, List<String> failures, List<String> warnings) {
  public StageResult {
    failures = List.copyOf(failures);
    warnings = List.copyOf(warnings);
  }

  static StageResult crashed(String name, Exception ex) {
    String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
    return new StageResult(name, false, 0, List.of("Stage aborted: " + message), List.of());
  }
}
