package com.ledgersync.exception;

import lombok.Getter;

@Getter
public class InvalidDateException extends RecordValidationException {
  private final String field;

  public InvalidDateException(String field, Object value) {
    super("Invalid date for '" + field + "': " + value);
    this.field = field;
  }

  public InvalidDateException(String field, Object value, Throwable cause) {
    super("Invalid date for '" + field + "': " + value, cause);
    this.field = field;
  }
}
