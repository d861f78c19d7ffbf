package com.ledgersync.model;

public enum PaymentMethodType {
  BANK,
  CREDIT,
  VENMO,
  SPLITWISE,
  CASH
}
