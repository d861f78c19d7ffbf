package com.ledgersync.config;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ledger.sync")
public record SyncProperties(String ownerFirstName, ZoneId zone, LocalDate since, List<String> ignoredParties) {
  public SyncProperties {
    if (zone == null) {
      zone = ZoneId.of("UTC");
    }
    ignoredParties = ignoredParties == null ? List.of() : List.copyOf(ignoredParties);
  }
}
