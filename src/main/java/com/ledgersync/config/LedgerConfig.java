package com.ledgersync.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LedgerConfig {
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
