package com.ledgersync.reconcile;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ledgersync.config.VerifyProperties;
import com.ledgersync.dto.SyncResult;
import com.ledgersync.model.TransactionSource;
import com.ledgersync.service.FailurePolicy;
import com.ledgersync.service.LedgerSyncService;
import com.ledgersync.store.AccountSnapshot;
import com.ledgersync.store.EventSnapshot;
import com.ledgersync.store.LedgerStore;
import com.ledgersync.store.LineItemSnapshot;
import com.ledgersync.store.UserSnapshot;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ReconciliationServiceTest {
  private static final Instant DATE = Instant.parse("2024-01-05T00:00:00Z");

  @Mock
  private LedgerStore legacy;

  @Mock
  private LedgerStore relational;

  @Mock
  private LedgerSyncService syncService;

  private ReconciliationService service;

  @BeforeEach
  void setUp() {
    List<ReconciliationStage> stages = List.of(
        new ReferenceDataStage(), new TransactionsStage(), new EventsStage(), new AccountsStage());
    service = new ReconciliationService(stages, legacy, relational, syncService,
        new VerifyProperties(true, 2), new Random(7));
    lenient().when(legacy.name()).thenReturn("legacy");
    lenient().when(relational.name()).thenReturn("relational");
    stubMatchingStores();
  }

  private void stubMatchingStores() {
    for (LedgerStore store : List.of(legacy, relational)) {
      lenient().when(store.categoryNames()).thenReturn(Set.of("Groceries", "Travel"));
      lenient().when(store.tagNames()).thenReturn(Set.of("trip"));
      lenient().when(store.transactionCounts()).thenReturn(counts(3));
      lenient().when(store.lineItems()).thenReturn(lineItems("42.50"));
      lenient().when(store.events()).thenReturn(Map.of(
          "e1", new EventSnapshot("e1", "Trip", "Travel", false, 2, 1)));
      lenient().when(store.integrationAccounts()).thenReturn(List.of(new AccountSnapshot("STRIPE", "Checking")));
      lenient().when(store.users()).thenReturn(List.of(new UserSnapshot("jordan@example.com", "Jordan", "Lee")));
    }
  }

  @Test
  @DisplayName("identical stores pass every stage with exit code 0")
  void matchingStoresPass() {
    VerificationReport report = service.verifyAll(VerificationMode.THOROUGH);

    assertThat(report.passed()).isTrue();
    assertThat(report.exitCode()).isZero();
    assertThat(report.stages()).extracting(StageResult::name).containsExactly(
        "reference data", "transactions & line items", "events & relationships", "accounts & users");
    assertThat(report.stages()).allSatisfy(stage -> assertThat(stage.checks()).isPositive());
  }

  @Test
  @DisplayName("a category mismatch fails reference data while later stages still run")
  void categoryMismatchFailsOnlyReferenceStage() {
    when(relational.categoryNames()).thenReturn(Set.of("Groceries", "Travels"));

    VerificationReport report = service.verifyAll(VerificationMode.QUICK);

    assertThat(report.exitCode()).isEqualTo(1);
    assertThat(report.stages()).hasSize(4);
    StageResult reference = report.stages().get(0);
    assertThat(reference.passed()).isFalse();
    assertThat(reference.failures()).anySatisfy(failure -> assertThat(failure).contains("Travel"));
    assertThat(report.stages().subList(1, 4)).allSatisfy(stage -> assertThat(stage.passed()).isTrue());
  }

  @Test
  void fieldDifferencesAreReported() {
    when(relational.lineItems()).thenReturn(lineItems("42.51"));

    VerificationReport report = service.verifyAll(VerificationMode.THOROUGH);

    StageResult transactions = report.stages().get(1);
    assertThat(transactions.passed()).isFalse();
    assertThat(transactions.failures()).singleElement(InstanceOfAssertFactories.STRING)
        .contains("line_item_c1")
        .contains("amount 42.50 != 42.51");
  }

  @Test
  void thoroughModeFindsRowsOnlyInRelationalStore() {
    Map<String, LineItemSnapshot> extra = new LinkedHashMap<>(lineItems("42.50"));
    extra.put("line_item_c9", new LineItemSnapshot("line_item_c9", DATE, BigDecimal.ONE, "x", "Cash", "Sam"));
    when(relational.lineItems()).thenReturn(extra);

    VerificationReport report = service.verifyAll(VerificationMode.THOROUGH);

    assertThat(report.stages().get(1).failures())
        .anySatisfy(failure -> assertThat(failure).contains("line_item_c9 only in relational store"));
  }

  @Test
  void quickModeSamplesAtMostTheConfiguredNumberOfKeys() {
    Map<String, LineItemSnapshot> many = new LinkedHashMap<>();
    for (int i = 0; i < 20; i++) {
      String key = "line_item_" + i;
      many.put(key, new LineItemSnapshot(key, DATE, BigDecimal.TEN, "d", "Cash", "Alex"));
    }
    when(legacy.lineItems()).thenReturn(many);
    when(relational.lineItems()).thenReturn(many);

    VerificationReport report = service.verifyAll(VerificationMode.QUICK);

    // one count per source, the line item count, then two sampled rows
    assertThat(report.stages().get(1).checks()).isEqualTo(TransactionSource.values().length + 3);
    assertThat(report.passed()).isTrue();
  }

  @Test
  void eventDifferencesAreChecked() {
    when(relational.events()).thenReturn(Map.of(
        "e1", new EventSnapshot("e1", "Trip", "Travel", false, 1, 1)));

    VerificationReport report = service.verifyAll(VerificationMode.THOROUGH);

    assertThat(report.stages().get(2).failures()).singleElement(InstanceOfAssertFactories.STRING).contains("e1 line items");
  }

  @Test
  @DisplayName("a stage that throws is recorded as failed and the run continues")
  void crashingStageIsRecorded() {
    when(legacy.events()).thenThrow(new IllegalStateException("connection refused"));

    VerificationReport report = service.verifyAll(VerificationMode.QUICK);

    StageResult events = report.stages().get(2);
    assertThat(events.passed()).isFalse();
    assertThat(events.failures()).singleElement(InstanceOfAssertFactories.STRING).contains("connection refused");
    assertThat(report.stages().get(3).passed()).isTrue();
    assertThat(report.exitCode()).isEqualTo(1);
  }

  @Test
  void usersWithoutEmailOnlyWarn() {
    when(legacy.users()).thenReturn(List.of(new UserSnapshot(null, "Guest", "User")));
    when(relational.users()).thenReturn(List.of(new UserSnapshot("guest@example.com", "Guest", "User")));

    VerificationReport report = service.verifyAll(VerificationMode.THOROUGH);

    StageResult accounts = report.stages().get(3);
    assertThat(accounts.passed()).isTrue();
    assertThat(accounts.warnings()).hasSize(1);
  }

  @Test
  void reconcileTransactionsReplaysLegacyDocuments() {
    List<Map<String, Object>> documents = List.of(Map.of("id", "v1"));
    SyncResult expected = new SyncResult(TransactionSource.VENMO, 1, 0, 0, 1, 1);
    when(legacy.rawDocuments(TransactionSource.VENMO)).thenReturn(documents);
    when(syncService.ingest(TransactionSource.VENMO, documents, FailurePolicy.SKIP_AND_LOG)).thenReturn(expected);

    assertThat(service.reconcileTransactions(TransactionSource.VENMO)).isEqualTo(expected);
    verify(syncService).ingest(any(), any(), any());
  }

  private static Map<TransactionSource, Long> counts(long each) {
    Map<TransactionSource, Long> counts = new EnumMap<>(TransactionSource.class);
    for (TransactionSource source : TransactionSource.values()) {
      counts.put(source, each);
    }
    return counts;
  }

  private static Map<String, LineItemSnapshot> lineItems(String amount) {
    return Map.of("line_item_c1",
        new LineItemSnapshot("line_item_c1", DATE, new BigDecimal(amount), "Groceries", "Cash", "Alex"));
  }
}
