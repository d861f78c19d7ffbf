package com.ledgersync.exception;

import lombok.Getter;

@Getter
public class PaymentMethodNotFoundException extends LedgerException {
  private final String paymentMethodId;

  public PaymentMethodNotFoundException(String paymentMethodId) {
    super("Payment method not found: " + paymentMethodId);
    this.paymentMethodId = paymentMethodId;
  }
}
