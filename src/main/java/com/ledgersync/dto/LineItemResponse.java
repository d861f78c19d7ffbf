package com.ledgersync.dto;

import com.ledgersync.model.TransactionSource;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class LineItemResponse {
  private String id;
  private Instant date;
  private String responsibleParty;
  private String paymentMethod;
  private String description;
  private BigDecimal amount;
  private TransactionSource source;
  private String sourceId;
}
