package com.ledgersync.service;

import com.ledgersync.dto.CashTransactionRequest;
import com.ledgersync.dto.LineItemResponse;
import com.ledgersync.exception.LedgerSyncException;
import com.ledgersync.model.LineItem;
import com.ledgersync.model.TransactionSource;
import com.ledgersync.normalize.RawRecord;
import com.ledgersync.normalize.RawRecordParser;
import com.ledgersync.repository.LineItemRepository;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;

@Service
public class CashTransactionService {
  private final RawRecordParser parser;
  private final LedgerSyncService syncService;
  private final LineItemRepository lineItemRepository;

  public CashTransactionService(RawRecordParser parser,
                                LedgerSyncService syncService,
                                LineItemRepository lineItemRepository) {
    this.parser = parser;
    this.syncService = syncService;
    this.lineItemRepository = lineItemRepository;
  }

  public LineItemResponse create(CashTransactionRequest request) {
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("date", request.getDate());
    document.put("person", request.getPerson());
    document.put("description", request.getDescription());
    document.put("amount", request.getAmount());

    RawRecord record = parser.parse(TransactionSource.CASH, document);
    document.put("id", record.sourceId());
    syncService.ingest(TransactionSource.CASH, List.of(document), FailurePolicy.FAIL_FAST);

    LineItem lineItem = lineItemRepository.findBySourceAndSourceId(TransactionSource.CASH, record.sourceId())
        .orElseThrow(() -> new LedgerSyncException(TransactionSource.CASH,
            "Cash transaction " + record.sourceId() + " was not stored", null));
    return toResponse(lineItem);
  }

  static LineItemResponse toResponse(LineItem lineItem) {
    return new LineItemResponse(
        lineItem.getId(),
        lineItem.getDate(),
        lineItem.getResponsibleParty(),
        lineItem.getPaymentMethod(),
        lineItem.getDescription(),
        lineItem.getAmount(),
        lineItem.getSource(),
        lineItem.getSourceId());
  }
}
