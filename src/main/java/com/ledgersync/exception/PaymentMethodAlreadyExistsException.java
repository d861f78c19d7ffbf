package com.ledgersync.exception;

public class PaymentMethodAlreadyExistsException extends LedgerException {
  public PaymentMethodAlreadyExistsException(String name) {
    super("Payment method '" + name + "' already exists");
  }
}
