package com.ledgersync.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ledgersync.JpaTestConfig;
import com.ledgersync.model.LineItem;
import com.ledgersync.model.SourceTransaction;
import com.ledgersync.model.TransactionSource;
import com.ledgersync.normalize.CashRecord;
import com.ledgersync.normalize.NormalizedLineItem;
import com.ledgersync.repository.LineItemRepository;
import com.ledgersync.repository.SourceTransactionRepository;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

@DataJpaTest
@Import({JpaTestConfig.class, LineItemUpsertService.class})
class LineItemUpsertServiceTest {
  private static final Instant JAN_5 = Instant.parse("2024-01-05T00:00:00Z");

  @Autowired
  private LineItemUpsertService upsertService;

  @Autowired
  private LineItemRepository lineItemRepository;

  @Autowired
  private SourceTransactionRepository transactionRepository;

  @Autowired
  private TestEntityManager entityManager;

  @Test
  @DisplayName("inserting a new batch creates one row per natural key")
  void insertsNewRows() {
    int written = upsertService.upsertLineItems(List.of(
        venmo("v1", "Casey", "20.00"),
        venmo("v2", "Riley", "5.25")), TransactionSource.VENMO);

    assertThat(written).isEqualTo(2);
    List<LineItem> rows = lineItemRepository.findAll();
    assertThat(rows).hasSize(2);
    assertThat(rows).allSatisfy(row -> {
      assertThat(row.getId()).startsWith("li_");
      assertThat(row.getLegacyId()).isEqualTo("line_item_" + row.getSourceId());
    });
  }

  @Test
  @DisplayName("replaying the same batch changes nothing")
  void replayIsIdempotent() {
    List<NormalizedLineItem> batch = List.of(venmo("v1", "Casey", "20.00"), venmo("v2", "Riley", "5.25"));
    upsertService.upsertLineItems(batch, TransactionSource.VENMO);
    entityManager.flush();
    entityManager.clear();
    LineItem before = lineItemRepository.findBySourceAndSourceId(TransactionSource.VENMO, "v1").orElseThrow();

    int written = upsertService.upsertLineItems(batch, TransactionSource.VENMO);
    entityManager.flush();
    entityManager.clear();

    LineItem after = lineItemRepository.findBySourceAndSourceId(TransactionSource.VENMO, "v1").orElseThrow();
    assertThat(written).isZero();
    assertThat(lineItemRepository.count()).isEqualTo(2);
    assertThat(after.getId()).isEqualTo(before.getId());
    assertThat(after.getUpdatedAt()).isEqualTo(before.getUpdatedAt());
  }

  @Test
  @DisplayName("a changed record updates the existing row in place")
  void updatesChangedFields() {
    upsertService.upsertLineItems(List.of(venmo("v1", "Casey", "20.00")), TransactionSource.VENMO);
    String id = lineItemRepository.findBySourceAndSourceId(TransactionSource.VENMO, "v1").orElseThrow().getId();

    int written = upsertService.upsertLineItems(List.of(venmo("v1", "Casey", "22.00")), TransactionSource.VENMO);
    entityManager.flush();
    entityManager.clear();

    LineItem row = lineItemRepository.findBySourceAndSourceId(TransactionSource.VENMO, "v1").orElseThrow();
    assertThat(written).isEqualTo(1);
    assertThat(row.getId()).isEqualTo(id);
    assertThat(row.getAmount()).isEqualByComparingTo("22.00");
  }

  @Test
  void amountsCompareByValueNotScale() {
    upsertService.upsertLineItems(List.of(venmo("v1", "Casey", "20.00")), TransactionSource.VENMO);

    int written = upsertService.upsertLineItems(List.of(venmo("v1", "Casey", "20.0")), TransactionSource.VENMO);

    assertThat(written).isZero();
  }

  @Test
  @DisplayName("the last record wins when a batch repeats a natural key")
  void lastWriteWinsWithinBatch() {
    int written = upsertService.upsertLineItems(List.of(
        venmo("v1", "Casey", "1.00"),
        venmo("v1", "Casey", "2.00")), TransactionSource.VENMO);

    assertThat(written).isEqualTo(1);
    assertThat(lineItemRepository.findBySourceAndSourceId(TransactionSource.VENMO, "v1").orElseThrow().getAmount())
        .isEqualByComparingTo("2.00");
  }

  @Test
  void sameSourceIdFromDifferentSourcesAreDistinct() {
    upsertService.upsertLineItems(List.of(venmo("42", "Casey", "1.00")), TransactionSource.VENMO);
    upsertService.upsertLineItems(List.of(item(TransactionSource.STRIPE, "42", "Shop", "3.00")), TransactionSource.STRIPE);

    assertThat(lineItemRepository.countBySource(TransactionSource.VENMO)).isEqualTo(1);
    assertThat(lineItemRepository.countBySource(TransactionSource.STRIPE)).isEqualTo(1);
  }

  @Test
  void rejectsItemsFromAnotherSource() {
    assertThatThrownBy(() -> upsertService.upsertLineItems(List.of(venmo("v1", "Casey", "1")), TransactionSource.CASH))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(lineItemRepository.count()).isZero();
  }

  @Test
  void emptyBatchWritesNothing() {
    assertThat(upsertService.upsertLineItems(List.of(), TransactionSource.VENMO)).isZero();
    assertThat(upsertService.upsertTransactions(List.of(), TransactionSource.VENMO)).isZero();
  }

  @Test
  @DisplayName("raw documents are stored once with keys in a stable order")
  void transactionsAreIdempotent() {
    CashRecord record = new CashRecord("c1", JAN_5, "Alex", "Groceries", new BigDecimal("42.50"),
        Map.of("person", "Alex", "amount", "42.50", "date", "2024-01-05", "description", "Groceries"));

    assertThat(upsertService.upsertTransactions(List.of(record), TransactionSource.CASH)).isEqualTo(1);
    assertThat(upsertService.upsertTransactions(List.of(record), TransactionSource.CASH)).isZero();

    List<SourceTransaction> rows = transactionRepository.findBySource(TransactionSource.CASH);
    assertThat(rows).hasSize(1);
    assertThat(rows.get(0).getId()).startsWith("txn_");
    assertThat(rows.get(0).getSourceData())
        .isEqualTo("{\"amount\":\"42.50\",\"date\":\"2024-01-05\",\"description\":\"Groceries\",\"person\":\"Alex\"}");
    assertThat(rows.get(0).getTransactionDate()).isEqualTo(JAN_5);
  }

  private static NormalizedLineItem venmo(String sourceId, String party, String amount) {
    return item(TransactionSource.VENMO, sourceId, party, amount);
  }

  private static NormalizedLineItem item(TransactionSource source, String sourceId, String party, String amount) {
    return new NormalizedLineItem(source, sourceId, JAN_5, party, source.name(), "note " + sourceId,
        new BigDecimal(amount));
  }
}
