package com.ledgersync.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ledgersync.IngestionTestConfig;
import com.ledgersync.exception.LedgerSyncException;
import com.ledgersync.model.TransactionSource;
import com.ledgersync.normalize.NormalizedLineItem;
import com.ledgersync.repository.LineItemRepository;
import com.ledgersync.repository.SourceTransactionRepository;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Batches run in their own transactions here, so every write is committed or rolled back for
 * real.
 */
@DataJpaTest
@Import(IngestionTestConfig.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class LedgerSyncAtomicityTest {
  @Autowired
  private LedgerSyncService syncService;

  @Autowired
  private LineItemUpsertService upsertService;

  @Autowired
  private LineItemRepository lineItemRepository;

  @Autowired
  private SourceTransactionRepository transactionRepository;

  @AfterEach
  void cleanUp() {
    lineItemRepository.deleteAll();
    transactionRepository.deleteAll();
  }

  @Test
  @DisplayName("a line item conflict after the raw transactions were written rolls back the whole batch")
  void failedLineItemWriteLeavesNothingBehind() {
    // same legacy id as the venmo record below
    upsertService.upsertLineItems(List.of(new NormalizedLineItem(TransactionSource.STRIPE, "v1",
        Instant.parse("2024-01-04T00:00:00Z"), "Shop", "Checking", "Shop", new BigDecimal("3.00"))),
        TransactionSource.STRIPE);

    assertThatThrownBy(() -> syncService.ingest(TransactionSource.VENMO,
        List.of(venmo("v2", "Riley"), venmo("v1", "Casey")), FailurePolicy.SKIP_AND_LOG))
        .isInstanceOf(LedgerSyncException.class)
        .hasCauseInstanceOf(DataIntegrityViolationException.class);

    assertThat(transactionRepository.countBySource(TransactionSource.VENMO)).isZero();
    assertThat(lineItemRepository.countBySource(TransactionSource.VENMO)).isZero();
    assertThat(lineItemRepository.count()).isEqualTo(1);
  }

  @Test
  void successfulBatchCommitsBothTables() {
    syncService.ingest(TransactionSource.VENMO, List.of(venmo("v3", "Casey")), FailurePolicy.FAIL_FAST);

    assertThat(transactionRepository.countBySource(TransactionSource.VENMO)).isEqualTo(1);
    assertThat(lineItemRepository.countBySource(TransactionSource.VENMO)).isEqualTo(1);
  }

  private static Map<String, Object> venmo(String id, String counterparty) {
    Map<String, Object> document = new HashMap<>();
    document.put("id", id);
    document.put("actor", Map.of("first_name", "Jordan"));
    document.put("target", Map.of("first_name", counterparty));
    document.put("payment_type", "pay");
    document.put("note", "Dinner");
    document.put("amount", "12.00");
    document.put("date_created", 1704412800);
    return document;
  }
}
