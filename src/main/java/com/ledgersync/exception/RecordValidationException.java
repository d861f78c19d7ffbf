package com.ledgersync.exception;

public abstract class RecordValidationException extends LedgerException {
  protected RecordValidationException(String message) {
    super(message);
  }

  protected RecordValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
