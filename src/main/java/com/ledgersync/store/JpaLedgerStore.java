package com.ledgersync.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgersync.exception.LedgerSyncException;
import com.ledgersync.model.Category;
import com.ledgersync.model.Event;
import com.ledgersync.model.LineItem;
import com.ledgersync.model.SourceTransaction;
import com.ledgersync.model.Tag;
import com.ledgersync.model.TransactionSource;
import com.ledgersync.repository.CategoryRepository;
import com.ledgersync.repository.EventLineItemRepository;
import com.ledgersync.repository.EventRepository;
import com.ledgersync.repository.EventTagRepository;
import com.ledgersync.repository.IntegrationAccountRepository;
import com.ledgersync.repository.LineItemRepository;
import com.ledgersync.repository.SourceTransactionRepository;
import com.ledgersync.repository.TagRepository;
import com.ledgersync.repository.UserRepository;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component("relationalStore")
@Transactional(readOnly = true)
public class JpaLedgerStore implements LedgerStore {
  private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {};

  private final CategoryRepository categoryRepository;
  private final TagRepository tagRepository;
  private final SourceTransactionRepository transactionRepository;
  private final LineItemRepository lineItemRepository;
  private final EventRepository eventRepository;
  private final EventLineItemRepository eventLineItemRepository;
  private final EventTagRepository eventTagRepository;
  private final IntegrationAccountRepository accountRepository;
  private final UserRepository userRepository;
  private final ObjectMapper objectMapper;

  public JpaLedgerStore(CategoryRepository categoryRepository,
                        TagRepository tagRepository,
                        SourceTransactionRepository transactionRepository,
                        LineItemRepository lineItemRepository,
                        EventRepository eventRepository,
                        EventLineItemRepository eventLineItemRepository,
                        EventTagRepository eventTagRepository,
                        IntegrationAccountRepository accountRepository,
                        UserRepository userRepository,
                        ObjectMapper objectMapper) {
    this.categoryRepository = categoryRepository;
    this.tagRepository = tagRepository;
    this.transactionRepository = transactionRepository;
    this.lineItemRepository = lineItemRepository;
    this.eventRepository = eventRepository;
    this.eventLineItemRepository = eventLineItemRepository;
    this.eventTagRepository = eventTagRepository;
    this.accountRepository = accountRepository;
    this.userRepository = userRepository;
    this.objectMapper = objectMapper;
  }

  @Override
  public String name() {
    return "relational";
  }

  @Override
  public Set<String> categoryNames() {
    return categoryRepository.findAll().stream()
        .map(Category::getName)
        .collect(Collectors.toCollection(TreeSet::new));
  }

  @Override
  public Set<String> tagNames() {
    return tagRepository.findAll().stream()
        .map(Tag::getName)
        .collect(Collectors.toCollection(TreeSet::new));
  }

  @Override
  public Map<TransactionSource, Long> transactionCounts() {
    Map<TransactionSource, Long> counts = new EnumMap<>(TransactionSource.class);
    for (TransactionSource source : TransactionSource.values()) {
      counts.put(source, transactionRepository.countBySource(source));
    }
    return counts;
  }

  @Override
  public List<Map<String, Object>> rawDocuments(TransactionSource source) {
    List<Map<String, Object>> documents = new ArrayList<>();
    for (SourceTransaction transaction : transactionRepository.findBySource(source)) {
      try {
        documents.add(objectMapper.readValue(transaction.getSourceData(), DOCUMENT_TYPE));
      } catch (JsonProcessingException ex) {
        throw new LedgerSyncException(source, "Unreadable source data for transaction " + transaction.getId(), ex);
      }
    }
    return documents;
  }

  @Override
  public Map<String, LineItemSnapshot> lineItems() {
    Map<String, LineItemSnapshot> items = new LinkedHashMap<>();
    for (LineItem item : lineItemRepository.findAll()) {
      items.put(item.getLegacyId(), new LineItemSnapshot(
          item.getLegacyId(),
          item.getDate(),
          item.getAmount(),
          item.getDescription(),
          item.getPaymentMethod(),
          item.getResponsibleParty()));
    }
    return items;
  }

  @Override
  public Map<String, EventSnapshot> events() {
    Map<String, Long> lineItemCounts = countsByEvent(eventLineItemRepository.countGroupedByEvent());
    Map<String, Long> tagCounts = countsByEvent(eventTagRepository.countGroupedByEvent());
    Map<String, EventSnapshot> events = new LinkedHashMap<>();
    for (Event event : eventRepository.findAll()) {
      events.put(event.getLegacyId(), new EventSnapshot(
          event.getLegacyId(),
          event.getDescription(),
          event.getCategory() == null ? null : event.getCategory().getName(),
          event.isDuplicate(),
          lineItemCounts.getOrDefault(event.getId(), 0L).intValue(),
          tagCounts.getOrDefault(event.getId(), 0L).intValue()));
    }
    return events;
  }

  @Override
  public List<AccountSnapshot> integrationAccounts() {
    return accountRepository.findAll().stream()
        .map(account -> new AccountSnapshot(account.getSource().name(), account.getDisplayName()))
        .toList();
  }

  @Override
  public List<UserSnapshot> users() {
    return userRepository.findAll().stream()
        .map(user -> new UserSnapshot(user.getEmail(), user.getFirstName(), user.getLastName()))
        .toList();
  }

  private static Map<String, Long> countsByEvent(List<Object[]> rows) {
    Map<String, Long> counts = new HashMap<>();
    for (Object[] row : rows) {
      counts.put((String) row[0], ((Number) row[1]).longValue());
    }
    return counts;
  }
}
