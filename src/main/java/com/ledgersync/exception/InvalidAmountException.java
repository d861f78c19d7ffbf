package com.ledgersync.exception;

import lombok.Getter;

@Getter
public class InvalidAmountException extends RecordValidationException {
  private final String field;
  private final Object value;

  public InvalidAmountException(String field, Object value, String reason) {
    super("Invalid amount for '" + field + "': " + value + " (" + reason + ")");
    this.field = field;
    this.value = value;
  }

  public InvalidAmountException(String field, Object value, Throwable cause) {
    super("Invalid amount for '" + field + "': " + value, cause);
    this.field = field;
    this.value = value;
  }
}
