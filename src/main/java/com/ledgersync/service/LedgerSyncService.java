package com.ledgersync.service;

import com.ledgersync.config.SyncProperties;
import com.ledgersync.dto.SyncResult;
import com.ledgersync.exception.LedgerSyncException;
import com.ledgersync.exception.RecordValidationException;
import com.ledgersync.model.TransactionSource;
import com.ledgersync.normalize.LineItemNormalizer;
import com.ledgersync.normalize.NormalizedLineItem;
import com.ledgersync.normalize.RawRecord;
import com.ledgersync.normalize.RawRecordParser;
import com.ledgersync.normalize.SplitwiseRecord;
import com.ledgersync.provider.FeedRegistry;
import com.ledgersync.provider.TransactionFeed;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class LedgerSyncService {
  private static final Logger log = LoggerFactory.getLogger(LedgerSyncService.class);

  private final RawRecordParser parser;
  private final LineItemNormalizer normalizer;
  private final LineItemUpsertService upsertService;
  private final FeedRegistry feedRegistry;
  private final IntegrationAccountService integrationAccountService;
  private final SyncProperties properties;
  private final TransactionTemplate transactionTemplate;

  public LedgerSyncService(RawRecordParser parser,
                           LineItemNormalizer normalizer,
                           LineItemUpsertService upsertService,
                           FeedRegistry feedRegistry,
                           IntegrationAccountService integrationAccountService,
                           SyncProperties properties,
                           PlatformTransactionManager transactionManager) {
    this.parser = parser;
    this.normalizer = normalizer;
    this.upsertService = upsertService;
    this.feedRegistry = feedRegistry;
    this.integrationAccountService = integrationAccountService;
    this.properties = properties;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  public SyncResult refresh(TransactionSource source) {
    TransactionFeed feed = feedRegistry.require(source);
    List<Map<String, Object>> documents = feed.fetch();
    log.info("Fetched {} {} documents", documents == null ? 0 : documents.size(), source);
    SyncResult result = ingest(source, documents, FailurePolicy.SKIP_AND_LOG);
    integrationAccountService.markRefreshed(source, feed.displayName());
    return result;
  }

  public SyncResult ingest(TransactionSource source, List<Map<String, Object>> documents, FailurePolicy policy) {
    if (documents == null || documents.isEmpty()) {
      return new SyncResult(source, 0, 0, 0, 0, 0);
    }
    List<RawRecord> records = new ArrayList<>();
    List<NormalizedLineItem> lineItems = new ArrayList<>();
    int filtered = 0;
    int rejected = 0;
    for (Map<String, Object> document : documents) {
      RawRecord record;
      NormalizedLineItem lineItem;
      try {
        record = parser.parse(source, document);
        if (isFiltered(record)) {
          filtered++;
          continue;
        }
        lineItem = normalizer.normalize(record);
      } catch (RecordValidationException ex) {
        if (policy == FailurePolicy.FAIL_FAST) {
          throw ex;
        }
        rejected++;
        log.warn("Skipping invalid {} document: {}", source, ex.getMessage());
        continue;
      }
      records.add(record);
      lineItems.add(lineItem);
    }

    int[] written = persist(source, records, lineItems);
    log.info("Ingested {} batch: received={}, filtered={}, rejected={}, transactions={}, lineItems={}",
        source, documents.size(), filtered, rejected, written[0], written[1]);
    return new SyncResult(source, documents.size(), filtered, rejected, written[0], written[1]);
  }

  private int[] persist(TransactionSource source, List<RawRecord> records, List<NormalizedLineItem> lineItems) {
    if (records.isEmpty()) {
      return new int[] {0, 0};
    }
    try {
      return writeBatch(source, records, lineItems);
    } catch (DataIntegrityViolationException ex) {
      if (TransactionSynchronizationManager.isActualTransactionActive()) {
        // the caller owns the transaction, which is already marked for rollback
        throw new LedgerSyncException(source, "Conflicting write while storing " + source + " batch", ex);
      }
      log.info("Concurrent write on {} batch, retrying once: {}", source, ex.getMostSpecificCause().getMessage());
      try {
        return writeBatch(source, records, lineItems);
      } catch (DataAccessException retryEx) {
        throw new LedgerSyncException(source, "Failed to store " + source + " batch after retry", retryEx);
      }
    } catch (DataAccessException ex) {
      throw new LedgerSyncException(source, "Failed to store " + source + " batch", ex);
    }
  }

  private int[] writeBatch(TransactionSource source, List<RawRecord> records, List<NormalizedLineItem> lineItems) {
    return transactionTemplate.execute(status -> new int[] {
        upsertService.upsertTransactions(records, source),
        upsertService.upsertLineItems(lineItems, source)
    });
  }

  private boolean isFiltered(RawRecord record) {
    if (record instanceof SplitwiseRecord splitwise && splitwise.deleted()) {
      log.debug("Skipping deleted splitwise expense {}", splitwise.sourceId());
      return true;
    }
    if (!isPeerToPeer(record.source())) {
      return false;
    }
    if (properties.since() != null) {
      Instant cutoff = properties.since().atStartOfDay(properties.zone()).toInstant();
      if (record.occurredAt().isBefore(cutoff)) {
        return true;
      }
    }
    String counterparty = normalizer.counterparty(record);
    if (counterparty != null && ignoredParties().contains(counterparty.trim().toLowerCase(Locale.ROOT))) {
      log.debug("Skipping {} record {} with ignored party {}", record.source(), record.sourceId(), counterparty);
      return true;
    }
    return false;
  }

  private static boolean isPeerToPeer(TransactionSource source) {
    return source == TransactionSource.VENMO || source == TransactionSource.SPLITWISE;
  }

  private Set<String> ignoredParties() {
    return properties.ignoredParties().stream()
        .map(party -> party.trim().toLowerCase(Locale.ROOT))
        .collect(Collectors.toSet());
  }
}
