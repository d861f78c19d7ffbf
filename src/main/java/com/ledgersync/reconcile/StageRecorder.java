package com.ledgersync.reconcile;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class StageRecorder {
  private static final Logger log = LoggerFactory.getLogger(StageRecorder.class);

  private final String stage;
  private final List<String> failures = new ArrayList<>();
  private final List<String> warnings = new ArrayList<>();
  private int checks;

  public StageRecorder(String stage) {
    this.stage = stage;
  }

  public void pass(String message) {
    checks++;
    log.debug("[{}] PASS {}", stage, message);
  }

  public void fail(String message) {
    checks++;
    failures.add(message);
    log.warn("[{}] FAIL {}", stage, message);
  }

  public void warn(String message) {
    warnings.add(message);
    log.warn("[{}] WARN {}", stage, message);
  }

  public boolean expectEqual(String what, Object legacy, Object relational) {
    if (Objects.equals(legacy, relational)) {
      pass(what);
      return true;
    }
    fail(what + ": legacy=" + legacy + ", relational=" + relational);
    return false;
  }

  public StageResult result() {
    return new StageResult(stage, failures.isEmpty(), checks, failures, warnings);
  }
}
