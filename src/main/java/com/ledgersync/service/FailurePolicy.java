package com.ledgersync.service;

public enum FailurePolicy {
  FAIL_FAST,
  SKIP_AND_LOG
}
