package com.ledgersync.exception;

import com.ledgersync.model.TransactionSource;
import lombok.Getter;

@Getter
public class LedgerSyncException extends LedgerException {
  private final TransactionSource source;

  public LedgerSyncException(TransactionSource source, String message, Throwable cause) {
    super(message, cause);
    this.source = source;
  }
}
