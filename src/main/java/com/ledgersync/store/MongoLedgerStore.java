package com.ledgersync.store;

import com.ledgersync.model.TransactionSource;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Collection;
import java.util.Date;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

@Component("legacyStore")
public class MongoLedgerStore implements LedgerStore {
  static final String LINE_ITEMS = "line_items";
  static final String EVENTS = "events";
  static final String CATEGORIES = "categories";
  static final String INTEGRATION_ACCOUNTS = "integration_accounts";
  static final String USERS = "users";

  private final MongoTemplate mongoTemplate;

  public MongoLedgerStore(MongoTemplate mongoTemplate) {
    this.mongoTemplate = mongoTemplate;
  }

  static String rawCollection(TransactionSource source) {
    return switch (source) {
      case STRIPE -> "stripe_raw_transaction_data";
      case VENMO -> "venmo_raw_data";
      case SPLITWISE -> "splitwise_raw_data";
      case CASH -> "cash_raw_data";
      case MANUAL -> "manual_raw_data";
    };
  }

  @Override
  public String name() {
    return "legacy";
  }

  @Override
  public Set<String> categoryNames() {
    Set<String> names = new TreeSet<>();
    for (Document doc : mongoTemplate.findAll(Document.class, CATEGORIES)) {
      String name = text(doc, "name");
      if (name != null) {
        names.add(name);
      }
    }
    return names;
  }

  // Tags only exist on events in the legacy store.
  @Override
  public Set<String> tagNames() {
    Set<String> names = new TreeSet<>();
    for (Document event : mongoTemplate.findAll(Document.class, EVENTS)) {
      Object tags = event.get("tags");
      if (tags instanceof Collection<?> values) {
        for (Object tag : values) {
          String name = tagName(tag);
          if (name != null) {
            names.add(name);
          }
        }
      }
    }
    return names;
  }

  @Override
  public Map<TransactionSource, Long> transactionCounts() {
    Map<TransactionSource, Long> counts = new EnumMap<>(TransactionSource.class);
    for (TransactionSource source : TransactionSource.values()) {
      counts.put(source, mongoTemplate.count(new Query(), rawCollection(source)));
    }
    return counts;
  }

  @Override
  public List<Map<String, Object>> rawDocuments(TransactionSource source) {
    return mongoTemplate.findAll(Document.class, rawCollection(source)).stream()
        .<Map<String, Object>>map(LinkedHashMap::new)
        .toList();
  }

  @Override
  public Map<String, LineItemSnapshot> lineItems() {
    Map<String, LineItemSnapshot> items = new LinkedHashMap<>();
    for (Document doc : mongoTemplate.findAll(Document.class, LINE_ITEMS)) {
      String id = String.valueOf(doc.get("_id"));
      items.put(id, new LineItemSnapshot(
          id,
          posixDate(doc.get("date")),
          decimal(doc.get("amount")),
          text(doc, "description"),
          text(doc, "payment_method"),
          text(doc, "responsible_party")));
    }
    return items;
  }

  @Override
  public Map<String, EventSnapshot> events() {
    Map<String, EventSnapshot> events = new LinkedHashMap<>();
    for (Document doc : mongoTemplate.findAll(Document.class, EVENTS)) {
      String id = String.valueOf(doc.get("_id"));
      String description = text(doc, "name");
      if (description == null) {
        description = text(doc, "description");
      }
      events.put(id, new EventSnapshot(
          id,
          description,
          text(doc, "category"),
          Boolean.TRUE.equals(doc.get("is_duplicate_transaction")),
          size(doc.get("line_items")),
          size(doc.get("tags"))));
    }
    return events;
  }

  @Override
  public List<AccountSnapshot> integrationAccounts() {
    return mongoTemplate.findAll(Document.class, INTEGRATION_ACCOUNTS).stream()
        .map(doc -> new AccountSnapshot(upper(text(doc, "source")), text(doc, "display_name")))
        .toList();
  }

  @Override
  public List<UserSnapshot> users() {
    return mongoTemplate.findAll(Document.class, USERS).stream()
        .map(doc -> new UserSnapshot(text(doc, "email"), text(doc, "first_name"), text(doc, "last_name")))
        .toList();
  }

  private static String text(Map<String, Object> doc, String field) {
    Object value = doc.get(field);
    return value == null ? null : String.valueOf(value);
  }

  private static String tagName(Object tag) {
    if (tag instanceof Map<?, ?> map) {
      Object name = map.get("name");
      return name == null ? null : String.valueOf(name);
    }
    return tag == null ? null : String.valueOf(tag);
  }

  private static String upper(String value) {
    return value == null ? null : value.toUpperCase();
  }

  private static int size(Object value) {
    return value instanceof Collection<?> values ? values.size() : 0;
  }

  private static BigDecimal decimal(Object value) {
    if (value == null) {
      return null;
    }
    return new BigDecimal(value.toString()).setScale(2, RoundingMode.HALF_UP);
  }

  private static Instant posixDate(Object value) {
    if (value instanceof Date date) {
      return date.toInstant();
    }
    if (value == null) {
      return null;
    }
    BigDecimal seconds = new BigDecimal(value.toString());
    return Instant.ofEpochMilli(seconds.movePointRight(3).setScale(0, RoundingMode.HALF_UP).longValueExact());
  }
}
