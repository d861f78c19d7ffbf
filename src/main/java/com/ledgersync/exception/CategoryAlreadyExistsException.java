package com.ledgersync.exception;

public class CategoryAlreadyExistsException extends LedgerException {
  public CategoryAlreadyExistsException(String categoryName) {
    super("Category '" + categoryName + "' already exists");
  }
}
