package com.ledgersync.reconcile;

public enum VerificationMode {
  QUICK,
  THOROUGH
}
