package com.ledgersync.dto;

import com.ledgersync.model.TransactionSource;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class IntegrationAccountResponse {
  private String id;
  private TransactionSource source;
  private String displayName;
  private Instant lastRefreshedAt;
}
