package com.ledgersync.exception;

import lombok.Getter;

@Getter
public class MissingFieldException extends RecordValidationException {
  private final String field;
  private final String context;

  public MissingFieldException(String field, String context) {
    super("Missing required field '" + field + "'" + (context == null || context.isBlank() ? "" : " in " + context));
    this.field = field;
    this.context = context;
  }
}
