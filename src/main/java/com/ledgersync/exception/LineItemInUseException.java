package com.ledgersync.exception;

public class LineItemInUseException extends LedgerException {
  public LineItemInUseException(String transactionId, String lineItemId) {
    super("Transaction " + transactionId + " cannot be deleted: line item " + lineItemId
        + " is assigned to an event");
  }
}
