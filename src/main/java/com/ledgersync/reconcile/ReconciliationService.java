package com.ledgersync.reconcile;

import com.ledgersync.config.VerifyProperties;
import com.ledgersync.dto.SyncResult;
import com.ledgersync.model.TransactionSource;
import com.ledgersync.service.FailurePolicy;
import com.ledgersync.service.LedgerSyncService;
import com.ledgersync.store.LedgerStore;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
public class ReconciliationService {
  private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

  private final List<ReconciliationStage> stages;
  private final LedgerStore legacyStore;
  private final LedgerStore relationalStore;
  private final LedgerSyncService syncService;
  private final VerifyProperties properties;
  private final Random random;

  public ReconciliationService(List<ReconciliationStage> stages,
                               @Qualifier("legacyStore") LedgerStore legacyStore,
                               @Qualifier("relationalStore") LedgerStore relationalStore,
                               LedgerSyncService syncService,
                               VerifyProperties properties) {
    this(stages, legacyStore, relationalStore, syncService, properties, new SecureRandom());
  }

  ReconciliationService(List<ReconciliationStage> stages,
                        LedgerStore legacyStore,
                        LedgerStore relationalStore,
                        LedgerSyncService syncService,
                        VerifyProperties properties,
                        Random random) {
    this.stages = List.copyOf(stages);
    this.legacyStore = legacyStore;
    this.relationalStore = relationalStore;
    this.syncService = syncService;
    this.properties = properties;
    this.random = random;
  }

  public VerificationReport verifyAll(VerificationMode mode) {
    VerificationContext context = new VerificationContext(
        legacyStore, relationalStore, mode, properties.sampleSize(), random);
    log.info("Verifying {} store against {} store ({} mode)", relationalStore.name(), legacyStore.name(), mode);

    List<StageResult> results = new ArrayList<>();
    for (ReconciliationStage stage : stages) {
      StageRecorder recorder = new StageRecorder(stage.name());
      StageResult result;
      try {
        stage.run(context, recorder);
        result = recorder.result();
      } catch (RuntimeException ex) {
        log.error("Verification stage '{}' aborted", stage.name(), ex);
        result = StageResult.crashed(stage.name(), ex);
      }
      results.add(result);
    }

    VerificationReport report = new VerificationReport(mode, results);
    logReport(report);
    return report;
  }

  public SyncResult reconcileTransactions(TransactionSource source) {
    if (source == TransactionSource.MANUAL) {
      throw new IllegalArgumentException("Manual transactions cannot be replayed from the legacy store");
    }
    List<Map<String, Object>> documents = legacyStore.rawDocuments(source);
    log.info("Replaying {} legacy {} documents", documents.size(), source);
    return syncService.ingest(source, documents, FailurePolicy.SKIP_AND_LOG);
  }

  private static void logReport(VerificationReport report) {
    StringBuilder table = new StringBuilder();
    table.append(String.format("%n%-28s %-6s %7s %9s%n", "STAGE", "RESULT", "CHECKS", "FAILURES"));
    for (StageResult stage : report.stages()) {
      table.append(String.format("%-28s %-6s %7d %9d%n",
          stage.name(), stage.passed() ? "PASS" : "FAIL", stage.checks(), stage.failures().size()));
    }
    long failed = report.stages().stream().filter(stage -> !stage.passed()).count();
    if (report.passed()) {
      log.info("Verification passed: {} stages{}", report.stages().size(), table);
    } else {
      log.warn("Verification failed: {} of {} stages failed{}", failed, report.stages().size(), table);
    }
  }
}
