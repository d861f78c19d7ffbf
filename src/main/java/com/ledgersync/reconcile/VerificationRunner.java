package com.ledgersync.reconcile;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "ledger.verify", name = "enabled", havingValue = "true")
public class VerificationRunner implements ApplicationRunner, ExitCodeGenerator {
  static final String QUICK_OPTION = "quick";

  private final ReconciliationService reconciliationService;
  private int exitCode;

  public VerificationRunner(ReconciliationService reconciliationService) {
    this.reconciliationService = reconciliationService;
  }

  @Override
  public void run(ApplicationArguments args) {
    VerificationMode mode = args.containsOption(QUICK_OPTION) ? VerificationMode.QUICK : VerificationMode.THOROUGH;
    exitCode = reconciliationService.verifyAll(mode).exitCode();
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }
}
