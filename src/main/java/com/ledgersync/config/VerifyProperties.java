package com.ledgersync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ledger.verify")
public record VerifyProperties(boolean enabled, int sampleSize) {
  public VerifyProperties {
    if (sampleSize <= 0) {
      sampleSize = 10;
    }
  }
}
