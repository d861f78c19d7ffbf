package com.ledgersync.exception;

import lombok.Getter;

@Getter
public class CategoryNotFoundException extends LedgerException {
  private final String categoryName;

  public CategoryNotFoundException(String categoryName) {
    super("Category '" + categoryName + "' not found");
    this.categoryName = categoryName;
  }
}
