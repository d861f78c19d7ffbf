package com.ledgersync.model;

public enum TransactionSource {
  STRIPE,
  VENMO,
  SPLITWISE,
  CASH,
  MANUAL
}
