package com.ledgersync.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.ledgersync.exception.LedgerSyncException;
import com.ledgersync.model.LineItem;
import com.ledgersync.model.SourceTransaction;
import com.ledgersync.model.TransactionSource;
import com.ledgersync.normalize.NormalizedLineItem;
import com.ledgersync.normalize.RawRecord;
import com.ledgersync.repository.LineItemRepository;
import com.ledgersync.repository.SourceTransactionRepository;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class LineItemUpsertService {
  private static final Logger log = LoggerFactory.getLogger(LineItemUpsertService.class);

  private final LineItemRepository lineItemRepository;
  private final SourceTransactionRepository transactionRepository;
  private final ObjectMapper objectMapper;

  public LineItemUpsertService(LineItemRepository lineItemRepository,
                               SourceTransactionRepository transactionRepository,
                               ObjectMapper objectMapper) {
    this.lineItemRepository = lineItemRepository;
    this.transactionRepository = transactionRepository;
    this.objectMapper = objectMapper.copy().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
  }

  @Transactional
  public int upsertLineItems(List<NormalizedLineItem> items, TransactionSource source) {
    if (items == null || items.isEmpty()) {
      return 0;
    }
    Map<String, NormalizedLineItem> latest = new LinkedHashMap<>();
    for (NormalizedLineItem item : items) {
      requireSource(item.source(), source);
      latest.put(item.sourceId(), item);
    }
    Map<String, LineItem> existing = lineItemRepository.findBySourceAndSourceIdIn(source, latest.keySet())
        .stream()
        .collect(Collectors.toMap(LineItem::getSourceId, Function.identity()));

    List<LineItem> pending = new ArrayList<>();
    int inserted = 0;
    int updated = 0;
    for (NormalizedLineItem item : latest.values()) {
      LineItem row = existing.get(item.sourceId());
      if (row == null) {
        row = new LineItem();
        row.setSource(source);
        row.setSourceId(item.sourceId());
        row.setLegacyId(item.legacyId());
        apply(row, item);
        pending.add(row);
        inserted++;
      } else if (apply(row, item)) {
        pending.add(row);
        updated++;
      }
    }
    if (!pending.isEmpty()) {
      lineItemRepository.saveAllAndFlush(pending);
    }
    log.info("Upserted {} line items: {} inserted, {} updated, {} unchanged",
        source, inserted, updated, latest.size() - inserted - updated);
    return inserted + updated;
  }

  @Transactional
  public int upsertTransactions(List<? extends RawRecord> records, TransactionSource source) {
    if (records == null || records.isEmpty()) {
      return 0;
    }
    Map<String, RawRecord> latest = new LinkedHashMap<>();
    for (RawRecord record : records) {
      requireSource(record.source(), source);
      latest.put(record.sourceId(), record);
    }
    Map<String, SourceTransaction> existing = transactionRepository.findBySourceAndSourceIdIn(source, latest.keySet())
        .stream()
        .collect(Collectors.toMap(SourceTransaction::getSourceId, Function.identity()));

    List<SourceTransaction> pending = new ArrayList<>();
    int inserted = 0;
    int updated = 0;
    for (RawRecord record : latest.values()) {
      String payload = serialize(record);
      SourceTransaction row = existing.get(record.sourceId());
      if (row == null) {
        row = new SourceTransaction();
        row.setSource(source);
        row.setSourceId(record.sourceId());
        row.setSourceData(payload);
        row.setTransactionDate(record.occurredAt());
        pending.add(row);
        inserted++;
      } else if (!payload.equals(row.getSourceData()) || !record.occurredAt().equals(row.getTransactionDate())) {
        row.setSourceData(payload);
        row.setTransactionDate(record.occurredAt());
        pending.add(row);
        updated++;
      }
    }
    if (!pending.isEmpty()) {
      transactionRepository.saveAllAndFlush(pending);
    }
    log.info("Upserted {} transactions: {} inserted, {} updated, {} unchanged",
        source, inserted, updated, latest.size() - inserted - updated);
    return inserted + updated;
  }

  private static boolean apply(LineItem row, NormalizedLineItem item) {
    boolean changed = false;
    if (!Objects.equals(row.getDate(), item.date())) {
      row.setDate(item.date());
      changed = true;
    }
    String responsibleParty = LineItem.fitColumn(item.responsibleParty());
    if (!Objects.equals(row.getResponsibleParty(), responsibleParty)) {
      row.setResponsibleParty(responsibleParty);
      changed = true;
    }
    String paymentMethod = LineItem.fitColumn(item.paymentMethod());
    if (!Objects.equals(row.getPaymentMethod(), paymentMethod)) {
      row.setPaymentMethod(paymentMethod);
      changed = true;
    }
    if (!Objects.equals(row.getDescription(), item.description())) {
      row.setDescription(item.description());
      changed = true;
    }
    if (!sameAmount(row.getAmount(), item.amount())) {
      row.setAmount(item.amount());
      changed = true;
    }
    return changed;
  }

  private static boolean sameAmount(BigDecimal left, BigDecimal right) {
    if (left == null || right == null) {
      return left == right;
    }
    return left.compareTo(right) == 0;
  }

  private static void requireSource(TransactionSource actual, TransactionSource expected) {
    if (actual != expected) {
      throw new IllegalArgumentException("Expected " + expected + " record but got " + actual);
    }
  }

  private String serialize(RawRecord record) {
    try {
      return objectMapper.writeValueAsString(record.document());
    } catch (JsonProcessingException ex) {
      throw new LedgerSyncException(record.source(),
          "Cannot serialize " + record.source() + " transaction " + record.sourceId(), ex);
    }
  }
}
