package com.ledgersync.exception;

import com.ledgersync.model.TransactionSource;

public class UnknownFeedException extends LedgerException {
  public UnknownFeedException(TransactionSource source) {
    super("No transaction feed configured for " + source);
  }
}
