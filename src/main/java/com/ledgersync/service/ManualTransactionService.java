package com.ledgersync.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.ledgersync.config.SyncProperties;
import com.ledgersync.dto.ManualTransactionRequest;
import com.ledgersync.dto.ManualTransactionResponse;
import com.ledgersync.exception.LedgerSyncException;
import com.ledgersync.exception.LineItemInUseException;
import com.ledgersync.model.LineItem;
import com.ledgersync.model.PaymentMethod;
import com.ledgersync.model.SourceTransaction;
import com.ledgersync.model.TransactionSource;
import com.ledgersync.normalize.FieldValidator;
import com.ledgersync.normalize.NormalizedLineItem;
import com.ledgersync.repository.EventLineItemRepository;
import com.ledgersync.repository.LineItemRepository;
import com.ledgersync.repository.SourceTransactionRepository;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ManualTransactionService {
  private static final Logger log = LoggerFactory.getLogger(ManualTransactionService.class);
  private static final String SOURCE_ID_PREFIX = "manual";
  private static final String CONTEXT = "manual transaction";

  private final PaymentMethodService paymentMethodService;
  private final SourceTransactionRepository transactionRepository;
  private final LineItemRepository lineItemRepository;
  private final EventLineItemRepository eventLineItemRepository;
  private final IdGenerator idGenerator;
  private final SyncProperties properties;
  private final ObjectMapper objectMapper;

  public ManualTransactionService(PaymentMethodService paymentMethodService,
                                  SourceTransactionRepository transactionRepository,
                                  LineItemRepository lineItemRepository,
                                  EventLineItemRepository eventLineItemRepository,
                                  IdGenerator idGenerator,
                                  SyncProperties properties,
                                  ObjectMapper objectMapper) {
    this.paymentMethodService = paymentMethodService;
    this.transactionRepository = transactionRepository;
    this.lineItemRepository = lineItemRepository;
    this.eventLineItemRepository = eventLineItemRepository;
    this.idGenerator = idGenerator;
    this.properties = properties;
    this.objectMapper = objectMapper.copy().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
  }

  @Transactional
  public ManualTransactionResponse create(ManualTransactionRequest request) {
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("date", request.getDate());
    document.put("person", request.getPerson());
    document.put("description", request.getDescription());
    document.put("amount", request.getAmount());
    document.put("payment_method_id", request.getPaymentMethodId());

    Instant date = FieldValidator.validateDate(FieldValidator.requireField(document, "date", CONTEXT), "date",
        properties.zone());
    String person = FieldValidator.requireText(document, "person", CONTEXT);
    String description = FieldValidator.requireText(document, "description", CONTEXT);
    BigDecimal amount = FieldValidator.validateAmount(FieldValidator.requireField(document, "amount", CONTEXT),
        "amount");
    PaymentMethod paymentMethod = paymentMethodService.require(request.getPaymentMethodId());

    String sourceId = idGenerator.generate(SOURCE_ID_PREFIX);
    SourceTransaction transaction = new SourceTransaction();
    transaction.setSource(TransactionSource.MANUAL);
    transaction.setSourceId(sourceId);
    transaction.setSourceData(serialize(document));
    transaction.setTransactionDate(date);
    SourceTransaction savedTransaction = transactionRepository.save(transaction);

    LineItem lineItem = new LineItem();
    lineItem.setSource(TransactionSource.MANUAL);
    lineItem.setSourceId(sourceId);
    lineItem.setLegacyId(NormalizedLineItem.legacyIdFor(sourceId));
    lineItem.setDate(date);
    lineItem.setResponsibleParty(person);
    lineItem.setPaymentMethod(paymentMethod.getName());
    lineItem.setDescription(description);
    lineItem.setAmount(amount);
    LineItem savedLineItem = lineItemRepository.save(lineItem);

    log.info("Created manual transaction {}: {} {} ({})",
        savedTransaction.getId(), description, amount, paymentMethod.getName());
    return new ManualTransactionResponse(savedTransaction.getId(), CashTransactionService.toResponse(savedLineItem));
  }

  @Transactional
  public boolean delete(String transactionId) {
    Optional<SourceTransaction> found = transactionRepository.findById(transactionId)
        .filter(transaction -> transaction.getSource() == TransactionSource.MANUAL);
    if (found.isEmpty()) {
      log.warn("Delete requested for unknown manual transaction {}", transactionId);
      return false;
    }
    SourceTransaction transaction = found.get();
    Optional<LineItem> lineItem = lineItemRepository.findBySourceAndSourceId(
        TransactionSource.MANUAL, transaction.getSourceId());
    if (lineItem.isPresent()) {
      if (eventLineItemRepository.existsByLineItemId(lineItem.get().getId())) {
        throw new LineItemInUseException(transactionId, lineItem.get().getId());
      }
      lineItemRepository.delete(lineItem.get());
    }
    transactionRepository.delete(transaction);
    log.info("Deleted manual transaction {}", transactionId);
    return true;
  }

  private String serialize(Map<String, Object> document) {
    try {
      return objectMapper.writeValueAsString(document);
    } catch (JsonProcessingException ex) {
      throw new LedgerSyncException(TransactionSource.MANUAL, "Cannot serialize manual transaction", ex);
    }
  }
}
