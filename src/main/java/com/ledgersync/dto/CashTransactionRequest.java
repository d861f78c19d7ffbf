package com.ledgersync.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class CashTransactionRequest {
  private String date;
  private String person;
  private String description;
  private String amount;
}
