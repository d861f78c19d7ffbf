package com.ledgersync;

import com.ledgersync.reconcile.VerificationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LedgerSyncApplication {
  public static void main(String[] args) {
    ConfigurableApplicationContext context = SpringApplication.run(LedgerSyncApplication.class, args);
    if (!context.getBeansOfType(VerificationRunner.class).isEmpty()) {
      System.exit(SpringApplication.exit(context));
    }
  }
}
